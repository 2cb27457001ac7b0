package com.acme.spsc.channel;

public enum IdleMode {
    BUSY_SPIN,
    YIELDING
}
