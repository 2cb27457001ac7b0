package com.acme.spsc.telemetry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtomicChannelMetricsTest {

    @Test
    void snapshotShouldStartAtZero() {
        AtomicChannelMetrics.Snapshot s = new AtomicChannelMetrics().snapshot();
        assertEquals(new AtomicChannelMetrics.Snapshot(0, 0, 0, 0, 0, 0, 0, 0, 0), s);
    }

    @Test
    void countersShouldAccumulateAndIgnoreNegatives() {
        AtomicChannelMetrics metrics = new AtomicChannelMetrics();
        metrics.incSent(3);
        metrics.incSent(-5);
        metrics.incReceived(2);
        metrics.incRejectedSends(1);
        metrics.incResidualReleased(4);

        AtomicChannelMetrics.Snapshot s = metrics.snapshot();
        assertEquals(3, s.sent());
        assertEquals(2, s.received());
        assertEquals(1, s.rejectedSends());
        assertEquals(4, s.residualReleased());
    }

    @Test
    void spinsShouldCountStallsAndTrackMaximum() {
        AtomicChannelMetrics metrics = new AtomicChannelMetrics();
        metrics.observeFullSpins(0);
        metrics.observeFullSpins(10);
        metrics.observeFullSpins(4);
        metrics.observeEmptySpins(0);
        metrics.observeEmptySpins(7);

        AtomicChannelMetrics.Snapshot s = metrics.snapshot();
        assertEquals(14, s.fullSpins());
        assertEquals(2, s.fullStalls());
        assertEquals(10, s.maxFullSpins());
        assertEquals(7, s.emptySpins());
        assertEquals(1, s.emptyStalls());
    }
}
