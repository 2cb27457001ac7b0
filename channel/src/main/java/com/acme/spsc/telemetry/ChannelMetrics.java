package com.acme.spsc.telemetry;

/**
 * Counters fed by the producer and consumer handles.
 *
 * <p>Calls come from the send/recv paths, so implementations must be thread-safe and
 * must not block.</p>
 */
public interface ChannelMetrics {
    void incSent(long n);
    void incReceived(long n);
    void incRejectedSends(long n);
    void incResidualReleased(long n);
    void observeFullSpins(long spins);
    void observeEmptySpins(long spins);
}
