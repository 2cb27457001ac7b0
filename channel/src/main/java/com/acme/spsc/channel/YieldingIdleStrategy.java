package com.acme.spsc.channel;

/**
 * Spins for a bounded number of attempts, then yields the processor on every further
 * attempt. Keeps hand-off latency low for short stalls while letting a long-stalled
 * side share a core with its peer.
 */
public final class YieldingIdleStrategy implements IdleStrategy {
    private final int yieldAfterSpins;

    public YieldingIdleStrategy(int yieldAfterSpins) {
        if (yieldAfterSpins < 0) {
            throw new IllegalArgumentException("yieldAfterSpins must be >= 0, got " + yieldAfterSpins);
        }
        this.yieldAfterSpins = yieldAfterSpins;
    }

    public int yieldAfterSpins() {
        return yieldAfterSpins;
    }

    @Override
    public void idle(int attempt) {
        if (yieldsOn(attempt)) {
            Thread.yield();
        } else {
            Thread.onSpinWait();
        }
    }

    boolean yieldsOn(int attempt) {
        return attempt >= yieldAfterSpins;
    }
}
