package com.acme.spsc.channel;

import com.acme.spsc.queue.BoundedRing;

import java.util.logging.Logger;

/**
 * Receiving end of an SPSC channel. Owned by exactly one thread at a time.
 *
 * <p>{@link #close()} is the handle's destruction: it marks the consumer as gone, which
 * makes every later {@code send} fail, and hands the values still in the ring to the
 * channel's {@link ResidualHandler}.</p>
 */
public final class Consumer<T> implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Consumer.class.getName());

    private final ChannelState<T> state;

    Consumer(ChannelState<T> state) {
        this.state = state;
    }

    /**
     * Receives the next value in send order, spinning while the ring is empty and the
     * producer is still live.
     *
     * <p>Returns {@link RecvResult.RecvError} once the producer is gone and every value it
     * sent has been received. Liveness is read before the ring is polled: the producer
     * publishes its last write cursor before it marks itself gone, so an empty poll after
     * seeing it gone means nothing more can arrive.</p>
     *
     * @throws IllegalStateException if this consumer was closed
     */
    public RecvResult<T> recv() {
        if (!state.isConsumerLive()) {
            throw new IllegalStateException("Consumer of channel " + state.name + " already closed");
        }

        BoundedRing<T> ring = state.ring;
        int spins = 0;
        while (true) {
            boolean producerLive = state.isProducerLive();
            T value = ring.poll();
            if (value != null) {
                state.metrics.observeEmptySpins(spins);
                state.metrics.incReceived(1);
                return new RecvResult.Received<>(value);
            }
            if (!producerLive) {
                state.metrics.observeEmptySpins(spins);
                return RecvResult.closed();
            }
            state.idleStrategy.idle(spins++);
        }
    }

    public boolean isClosed() {
        return !state.isConsumerLive();
    }

    public ChannelSnapshot snapshot() {
        return state.snapshot();
    }

    /**
     * Marks the consumer as gone and releases the values it can still see in the ring.
     * Idempotent: only the first call has an effect. Must run on the consumer's thread,
     * or after a happens-before edge with its last {@code recv}.
     *
     * <p>If the residual handler throws an {@link Error}, every value is still released
     * and the handle is still closed before the error propagates.</p>
     */
    @Override
    public void close() {
        if (!state.markConsumerGone()) {
            return;
        }
        try {
            int drained = state.drainResiduals();
            LOG.fine(() -> "Consumer of channel " + state.name + " closed, released " + drained + " unreceived value(s)");
        } finally {
            state.releaseHandle();
        }
    }
}
