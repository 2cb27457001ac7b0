package com.acme.spsc.util;

/**
 * Canonical environment variable names read by {@code ChannelConfig.fromEnv}.
 */
public final class ChannelEnvKeys {
    public static final String SPSC_CHANNEL_NAME = "SPSC_CHANNEL_NAME";
    public static final String SPSC_CHANNEL_CAPACITY = "SPSC_CHANNEL_CAPACITY";
    public static final String SPSC_CHANNEL_STRATEGY = "SPSC_CHANNEL_STRATEGY";
    public static final String SPSC_CHANNEL_IDLE = "SPSC_CHANNEL_IDLE";
    public static final String SPSC_CHANNEL_YIELD_AFTER_SPINS = "SPSC_CHANNEL_YIELD_AFTER_SPINS";

    public static final String SPSC_METRICS_LOG_INTERVAL_SEC = "SPSC_METRICS_LOG_INTERVAL_SEC";

    private ChannelEnvKeys() {
    }
}
