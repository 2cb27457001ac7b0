package com.acme.spsc.telemetry;

public final class NoopChannelMetrics implements ChannelMetrics {
    public static final NoopChannelMetrics INSTANCE = new NoopChannelMetrics();

    private NoopChannelMetrics() {
    }

    @Override
    public void incSent(long n) {
    }

    @Override
    public void incReceived(long n) {
    }

    @Override
    public void incRejectedSends(long n) {
    }

    @Override
    public void incResidualReleased(long n) {
    }

    @Override
    public void observeFullSpins(long spins) {
    }

    @Override
    public void observeEmptySpins(long spins) {
    }
}
