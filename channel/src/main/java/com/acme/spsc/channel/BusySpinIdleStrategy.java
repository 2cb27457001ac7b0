package com.acme.spsc.channel;

public final class BusySpinIdleStrategy implements IdleStrategy {
    public static final BusySpinIdleStrategy INSTANCE = new BusySpinIdleStrategy();

    private BusySpinIdleStrategy() {
    }

    @Override
    public void idle(int attempt) {
        Thread.onSpinWait();
    }
}
