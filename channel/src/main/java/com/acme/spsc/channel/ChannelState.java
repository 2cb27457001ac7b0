package com.acme.spsc.channel;

import com.acme.spsc.queue.BoundedRing;
import com.acme.spsc.queue.RingSnapshot;
import com.acme.spsc.telemetry.ChannelMetrics;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State shared by the producer and consumer of one channel: the ring plus the two
 * liveness indicators and the count of open handles.
 *
 * <p>Every mutable field has a single writer. The ring's write cursor belongs to the
 * producer thread and its read cursor to the consumer thread; {@code producerLive} is
 * written only by {@link Producer#close()} and {@code consumerLive} only by
 * {@link Consumer#close()}. Liveness goes from {@link #LIVE} to {@link #GONE} once and
 * never back.</p>
 */
final class ChannelState<T> {
    private static final Logger LOG = Logger.getLogger(ChannelState.class.getName());

    static final int LIVE = 1;
    static final int GONE = 0;

    final String name;
    final BoundedRing<T> ring;
    final IdleStrategy idleStrategy;
    final ChannelMetrics metrics;
    private final ResidualHandler<? super T> residualHandler;

    private final AtomicInteger producerLive = new AtomicInteger(LIVE);
    private final AtomicInteger consumerLive = new AtomicInteger(LIVE);
    private final AtomicInteger openHandles = new AtomicInteger(2);

    ChannelState(String name,
                 BoundedRing<T> ring,
                 IdleStrategy idleStrategy,
                 ChannelMetrics metrics,
                 ResidualHandler<? super T> residualHandler) {
        this.name = name;
        this.ring = ring;
        this.idleStrategy = idleStrategy;
        this.metrics = metrics;
        this.residualHandler = residualHandler;
    }

    boolean isProducerLive() {
        return producerLive.get() == LIVE;
    }

    boolean isConsumerLive() {
        return consumerLive.get() == LIVE;
    }

    boolean markProducerGone() {
        return producerLive.compareAndSet(LIVE, GONE);
    }

    boolean markConsumerGone() {
        return consumerLive.compareAndSet(LIVE, GONE);
    }

    /**
     * Hands every value the calling thread can see in the ring to the residual handler.
     * Only the consumer thread, or the last handle to close, may call this.
     *
     * <p>A failing handler never stops the drain. A {@link RuntimeException} is logged; the
     * first {@link Error} is rethrown once the ring is empty, with later ones suppressed.</p>
     */
    int drainResiduals() {
        Error failure = null;
        int drained = 0;
        T value;
        while ((value = ring.poll()) != null) {
            drained++;
            try {
                releaseResidual(value);
            } catch (Error e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return drained;
    }

    /**
     * Drops one handle's share of the state. The handle that drops the last share drains
     * what is left: a producer may have published values after the consumer drained on
     * its own close. The atomic decrement orders the peer's earlier ring accesses before
     * this drain. Callers release their share in a {@code finally} block so a failing
     * drain on their own close cannot keep the count above zero.
     */
    void releaseHandle() {
        if (openHandles.decrementAndGet() == 0) {
            int drained = drainResiduals();
            if (drained > 0) {
                LOG.fine(() -> "Channel " + name + " released " + drained + " residual value(s) on teardown");
            }
        }
    }

    ChannelSnapshot snapshot() {
        RingSnapshot r = ring.snapshot();
        return new ChannelSnapshot(
            name,
            ring.strategy(),
            r.capacity(),
            r.depth(),
            r.readCursor(),
            r.writeCursor(),
            isProducerLive(),
            isConsumerLive(),
            r.tsNanos()
        );
    }

    private void releaseResidual(T value) {
        metrics.incResidualReleased(1);
        try {
            residualHandler.release(value);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Residual handler failed on channel " + name, e);
        }
    }
}
