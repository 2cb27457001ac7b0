package com.acme.spsc.channel;

import com.acme.spsc.queue.BoundedRing;
import com.acme.spsc.telemetry.ChannelMetrics;
import com.acme.spsc.telemetry.NoopChannelMetrics;

import java.util.Objects;

/**
 * Factory for bounded single-producer single-consumer channels.
 *
 * <pre>{@code
 * ChannelPair<String> pair = SpscChannel.open(512);
 * executor.submit(() -> {
 *     try (Producer<String> producer = pair.producer()) {
 *         producer.send("ping");
 *     }
 * });
 * try (Consumer<String> consumer = pair.consumer()) {
 *     RecvResult<String> r;
 *     while ((r = consumer.recv()) instanceof RecvResult.Received<String> received) {
 *         handle(received.value());
 *     }
 * }
 * }</pre>
 */
public final class SpscChannel {

    private SpscChannel() {
    }

    public static <T> ChannelPair<T> open(int capacity) {
        return open(ChannelConfig.defaults().withCapacity(capacity));
    }

    public static <T> ChannelPair<T> open(ChannelConfig config) {
        return open(config, ResidualHandler.discard(), NoopChannelMetrics.INSTANCE);
    }

    public static <T> ChannelPair<T> open(ChannelConfig config, ResidualHandler<? super T> residualHandler) {
        return open(config, residualHandler, NoopChannelMetrics.INSTANCE);
    }

    public static <T> ChannelPair<T> open(ChannelConfig config,
                                          ResidualHandler<? super T> residualHandler,
                                          ChannelMetrics metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(residualHandler, "residualHandler");
        Objects.requireNonNull(metrics, "metrics");

        BoundedRing<T> ring = config.ringStrategy().newRing(config.capacity());
        ChannelState<T> state = new ChannelState<>(
            config.name(),
            ring,
            config.newIdleStrategy(),
            metrics,
            residualHandler
        );
        return new ChannelPair<>(new Producer<>(state), new Consumer<>(state));
    }
}
