package com.acme.spsc.queue;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedRingConcurrencyTest {

    @ParameterizedTest
    @EnumSource(RingStrategy.class)
    void shouldTransferInOrderWithoutLossOrDuplication(RingStrategy strategy) throws Exception {
        BoundedRing<Integer> ring = strategy.newRing(64);
        int totalItems = 200_000;

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> producer = pool.submit(() -> {
                start.await();
                for (int i = 0; i < totalItems; i++) {
                    while (true) {
                        OfferResult offer = ring.offer(i);
                        if (offer instanceof OfferResult.Ok ok) {
                            if (ok.cursor() != i) {
                                throw new IllegalStateException("Unexpected cursor " + ok.cursor() + " for " + i);
                            }
                            // own cursor is exact, peer cursor may lag: the observed depth can only be too high
                            long depth = (i + 1L) - ring.readCursor();
                            if (depth > ring.capacity()) {
                                throw new IllegalStateException("Depth " + depth + " exceeds capacity");
                            }
                            break;
                        }
                        Thread.onSpinWait();
                    }
                }
                return null;
            });

            Future<Integer> consumer = pool.submit(() -> {
                start.await();
                int expected = 0;
                while (expected < totalItems) {
                    Integer value = ring.poll();
                    if (value == null) {
                        Thread.onSpinWait();
                        continue;
                    }
                    if (value != expected) {
                        throw new IllegalStateException("Expected " + expected + " but got " + value);
                    }
                    expected++;
                }
                return expected;
            });

            start.countDown();
            producer.get(30, TimeUnit.SECONDS);
            assertEquals(totalItems, consumer.get(30, TimeUnit.SECONDS));

            assertEquals(0, ring.sizeApprox());
            assertEquals(totalItems, ring.writeCursor());
            assertEquals(totalItems, ring.readCursor());
            assertTrue(ring.validateInvariants());
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @ParameterizedTest
    @EnumSource(RingStrategy.class)
    void shouldHoldInvariantsWhenValidatedDuringTransfer(RingStrategy strategy) throws Exception {
        BoundedRing<Integer> ring = strategy.newRing(4);
        int totalItems = 200_000;

        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean done = new AtomicBoolean(false);
        try {
            Future<?> producer = pool.submit(() -> {
                start.await();
                for (int i = 0; i < totalItems; i++) {
                    while (ring.offer(i) instanceof OfferResult.Full) {
                        Thread.onSpinWait();
                    }
                }
                return null;
            });
            Future<?> consumer = pool.submit(() -> {
                start.await();
                int received = 0;
                while (received < totalItems) {
                    if (ring.poll() != null) {
                        received++;
                    } else {
                        Thread.onSpinWait();
                    }
                }
                return null;
            });
            Future<Integer> validator = pool.submit(() -> {
                start.await();
                int failures = 0;
                while (!done.get()) {
                    if (!ring.validateInvariants()) {
                        failures++;
                    }
                }
                return failures;
            });

            start.countDown();
            producer.get(30, TimeUnit.SECONDS);
            consumer.get(30, TimeUnit.SECONDS);
            done.set(true);
            assertEquals(0, validator.get(30, TimeUnit.SECONDS));
            assertEquals(0, ring.sizeApprox());
        } finally {
            done.set(true);
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}
