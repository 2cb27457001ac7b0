package com.acme.spsc.channel;

import com.acme.spsc.queue.BoundedRing;
import com.acme.spsc.queue.OfferResult;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sending end of an SPSC channel. Owned by exactly one thread at a time.
 *
 * <p>{@link #close()} is the handle's destruction: it marks the producer as gone so the
 * consumer can finish once it has drained the ring. There is no other way to signal
 * the end of the stream.</p>
 */
public final class Producer<T> implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Producer.class.getName());

    private final ChannelState<T> state;

    Producer(ChannelState<T> state) {
        this.state = state;
    }

    /**
     * Sends {@code value}, spinning while the ring is full.
     *
     * <p>Returns {@link SendResult.SendError} carrying {@code value} when the consumer is
     * already gone, or goes away while this call waits for room; the ring is not modified
     * in that case. There is no timeout: a live consumer that never receives keeps this
     * call spinning.</p>
     *
     * @throws NullPointerException if {@code value} is null
     * @throws IllegalStateException if this producer was closed
     */
    public SendResult<T> send(T value) {
        Objects.requireNonNull(value, "value");
        if (!state.isProducerLive()) {
            throw new IllegalStateException("Producer of channel " + state.name + " already closed");
        }
        if (!state.isConsumerLive()) {
            return reject(value);
        }

        BoundedRing<T> ring = state.ring;
        int spins = 0;
        while (ring.offer(value) instanceof OfferResult.Full) {
            if (!state.isConsumerLive()) {
                state.metrics.observeFullSpins(spins);
                return reject(value);
            }
            state.idleStrategy.idle(spins++);
        }
        state.metrics.observeFullSpins(spins);
        state.metrics.incSent(1);
        return SendResult.sent();
    }

    public boolean isClosed() {
        return !state.isProducerLive();
    }

    public ChannelSnapshot snapshot() {
        return state.snapshot();
    }

    /**
     * Marks the producer as gone. Idempotent: only the first call has an effect.
     */
    @Override
    public void close() {
        if (!state.markProducerGone()) {
            return;
        }
        LOG.fine(() -> "Producer of channel " + state.name + " closed at write cursor " + state.ring.writeCursor());
        state.releaseHandle();
    }

    private SendResult<T> reject(T value) {
        state.metrics.incRejectedSends(1);
        return new SendResult.SendError<>(value);
    }
}
