package com.acme.spsc.telemetry;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicChannelMetrics implements ChannelMetrics {
    private final LongAdder sent = new LongAdder();
    private final LongAdder received = new LongAdder();
    private final LongAdder rejectedSends = new LongAdder();
    private final LongAdder residualReleased = new LongAdder();
    private final LongAdder fullSpins = new LongAdder();
    private final LongAdder fullStalls = new LongAdder();
    private final LongAdder emptySpins = new LongAdder();
    private final LongAdder emptyStalls = new LongAdder();
    private final AtomicLong maxFullSpins = new AtomicLong();

    @Override
    public void incSent(long n) {
        sent.add(Math.max(0L, n));
    }

    @Override
    public void incReceived(long n) {
        received.add(Math.max(0L, n));
    }

    @Override
    public void incRejectedSends(long n) {
        rejectedSends.add(Math.max(0L, n));
    }

    @Override
    public void incResidualReleased(long n) {
        residualReleased.add(Math.max(0L, n));
    }

    @Override
    public void observeFullSpins(long spins) {
        if (spins <= 0) return;
        fullSpins.add(spins);
        fullStalls.increment();
        maxFullSpins.accumulateAndGet(spins, Math::max);
    }

    @Override
    public void observeEmptySpins(long spins) {
        if (spins <= 0) return;
        emptySpins.add(spins);
        emptyStalls.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(
            sent.sum(),
            received.sum(),
            rejectedSends.sum(),
            residualReleased.sum(),
            fullSpins.sum(),
            fullStalls.sum(),
            maxFullSpins.get(),
            emptySpins.sum(),
            emptyStalls.sum()
        );
    }

    /**
     * A stall is one send (or recv) call that had to spin at least once; spins are the
     * retries it took.
     */
    public record Snapshot(long sent,
                           long received,
                           long rejectedSends,
                           long residualReleased,
                           long fullSpins,
                           long fullStalls,
                           long maxFullSpins,
                           long emptySpins,
                           long emptyStalls) {}
}
