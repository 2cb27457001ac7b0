package com.acme.spsc.channel;

import com.acme.spsc.queue.BoundedRing;
import com.acme.spsc.queue.RingStrategy;
import com.acme.spsc.util.ChannelDefaults;
import com.acme.spsc.util.ChannelEnvKeys;
import com.acme.spsc.util.EnvVars;

import java.util.Map;
import java.util.Objects;

/**
 * Construction-time settings of a channel. Capacity is fixed for the channel's lifetime.
 */
public record ChannelConfig(
    String name,
    int capacity,
    RingStrategy ringStrategy,
    IdleMode idleMode,
    int yieldAfterSpins
) {

    public static final String DEFAULT_NAME = "spsc";

    public ChannelConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ringStrategy, "ringStrategy");
        Objects.requireNonNull(idleMode, "idleMode");
        BoundedRing.checkCapacity(capacity);
        if (yieldAfterSpins < 0) {
            throw new IllegalArgumentException("yieldAfterSpins must be >= 0, got " + yieldAfterSpins);
        }
    }

    public static ChannelConfig defaults() {
        return new ChannelConfig(
            DEFAULT_NAME,
            ChannelDefaults.DEFAULT_CAPACITY,
            RingStrategy.LOCK_FREE,
            IdleMode.BUSY_SPIN,
            ChannelDefaults.DEFAULT_YIELD_AFTER_SPINS
        );
    }

    public static ChannelConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static ChannelConfig fromEnv(Map<String, String> env) {
        return new ChannelConfig(
            EnvVars.getOrDefault(env, ChannelEnvKeys.SPSC_CHANNEL_NAME, DEFAULT_NAME),
            EnvVars.getIntClamped(env, ChannelEnvKeys.SPSC_CHANNEL_CAPACITY,
                ChannelDefaults.DEFAULT_CAPACITY, 1, BoundedRing.MAX_CAPACITY),
            EnvVars.getEnum(env, ChannelEnvKeys.SPSC_CHANNEL_STRATEGY,
                RingStrategy.class, RingStrategy.LOCK_FREE),
            EnvVars.getEnum(env, ChannelEnvKeys.SPSC_CHANNEL_IDLE,
                IdleMode.class, IdleMode.BUSY_SPIN),
            EnvVars.getIntClamped(env, ChannelEnvKeys.SPSC_CHANNEL_YIELD_AFTER_SPINS,
                ChannelDefaults.DEFAULT_YIELD_AFTER_SPINS, 0, ChannelDefaults.MAX_YIELD_AFTER_SPINS)
        );
    }

    public ChannelConfig withName(String newName) {
        return new ChannelConfig(newName, capacity, ringStrategy, idleMode, yieldAfterSpins);
    }

    public ChannelConfig withCapacity(int newCapacity) {
        return new ChannelConfig(name, newCapacity, ringStrategy, idleMode, yieldAfterSpins);
    }

    public ChannelConfig withRingStrategy(RingStrategy newStrategy) {
        return new ChannelConfig(name, capacity, newStrategy, idleMode, yieldAfterSpins);
    }

    public ChannelConfig withIdleMode(IdleMode newIdleMode) {
        return new ChannelConfig(name, capacity, ringStrategy, newIdleMode, yieldAfterSpins);
    }

    IdleStrategy newIdleStrategy() {
        return switch (idleMode) {
            case BUSY_SPIN -> BusySpinIdleStrategy.INSTANCE;
            case YIELDING -> new YieldingIdleStrategy(yieldAfterSpins);
        };
    }
}
