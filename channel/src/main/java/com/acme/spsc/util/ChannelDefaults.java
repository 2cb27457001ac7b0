package com.acme.spsc.util;

/**
 * Default capacity and tuning constants for channels.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class ChannelDefaults {

    // ---- Ring ----
    public static final int DEFAULT_CAPACITY = 512;

    // ---- Idle ----
    public static final int DEFAULT_YIELD_AFTER_SPINS = 128;
    public static final int MAX_YIELD_AFTER_SPINS = 1 << 20;

    // ---- Metrics reporter ----
    public static final long DEFAULT_METRICS_LOG_INTERVAL_SEC = 10L;
    public static final long MAX_METRICS_LOG_INTERVAL_SEC = 3_600L;

    private ChannelDefaults() {
    }
}
