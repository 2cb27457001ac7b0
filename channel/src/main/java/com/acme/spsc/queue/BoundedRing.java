package com.acme.spsc.queue;

import java.util.function.Consumer;

/**
 * Fixed-capacity ring shared by exactly one producer thread and one consumer thread.
 *
 * <p>{@link #offer(Object)} belongs to the producer thread; {@link #poll()} and
 * {@link #drain(Consumer)} belong to the consumer thread. Neither side blocks or
 * retries: a full or empty ring is reported immediately and the caller owns the
 * retry loop.</p>
 *
 * <p>Cursors are logical and never wrap; the physical slot is {@code cursor % capacity}.
 * At every observable instant {@code readCursor <= writeCursor <= readCursor + capacity}.</p>
 */
public interface BoundedRing<E> {

    int MAX_CAPACITY = 1 << 30;

    int capacity();

    int sizeApprox();

    /**
     * Places {@code e} into the slot at the write cursor and advances the cursor by one.
     * The slot write is visible to the consumer no later than the cursor advance.
     */
    OfferResult offer(E e);

    /**
     * Removes the element at the read cursor, or returns {@code null} when the ring is empty.
     * The slot is cleared before the cursor advance frees it for reuse.
     */
    E poll();

    /**
     * Moves every element currently visible to the consumer into {@code sink}, in FIFO order.
     *
     * @return number of elements handed to the sink
     */
    default int drain(Consumer<? super E> sink) {
        int drained = 0;
        E e;
        while ((e = poll()) != null) {
            sink.accept(e);
            drained++;
        }
        return drained;
    }

    long writeCursor();

    long readCursor();

    RingStrategy strategy();

    default RingSnapshot snapshot() {
        // write cursor first: a later read cursor can only shrink the observed depth
        long write = writeCursor();
        long read = readCursor();
        int depth = (int) Math.max(0, Math.min(write - read, Integer.MAX_VALUE));
        return new RingSnapshot(read, write, depth, capacity(), System.nanoTime());
    }

    /**
     * Validates that {@code writeCursor - readCursor} lies within {@code [0, capacity]}.
     * Intended for diagnostics, not for the hot path. Safe on a live ring: the read cursor
     * is bracketed by two write cursor reads, the earlier one bounding depth from above
     * and the later one from below, so concurrent progress never yields a false failure.
     */
    default boolean validateInvariants() {
        long writeBefore = writeCursor();
        long read = readCursor();
        long writeAfter = writeCursor();
        return writeAfter - read >= 0 && writeBefore - read <= capacity();
    }

    static int checkCapacity(int capacity) {
        if (capacity < 1 || capacity > MAX_CAPACITY) {
            throw new IllegalArgumentException(
                "Ring capacity " + capacity + " outside [1, " + MAX_CAPACITY + "]");
        }
        return capacity;
    }
}
