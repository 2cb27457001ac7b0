package com.acme.spsc.telemetry;

import com.acme.spsc.util.ChannelDefaults;
import com.acme.spsc.util.ChannelEnvKeys;
import com.acme.spsc.util.EnvVars;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs channel counters as one JSON line per interval.
 *
 * <p>Runs on its own daemon thread and never touches the ring directly; the optional
 * state supplier is expected to return a snapshot value (for example a channel
 * snapshot record), which is rendered as a nested object.</p>
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String channelName;
    private final AtomicChannelMetrics metrics;
    private final Supplier<?> channelStateSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(String channelName, AtomicChannelMetrics metrics, long intervalSeconds) {
        this(channelName, metrics, intervalSeconds, () -> null);
    }

    public PeriodicMetricsReporter(String channelName,
                                   AtomicChannelMetrics metrics,
                                   long intervalSeconds,
                                   Supplier<?> channelStateSupplier) {
        this.channelName = Objects.requireNonNull(channelName, "channelName");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.channelStateSupplier = channelStateSupplier == null ? (() -> null) : channelStateSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "spsc-metrics-reporter-" + channelName);
            t.setDaemon(true);
            return t;
        });
    }

    public static long intervalFromEnv(Map<String, String> env) {
        return EnvVars.getLongClamped(env,
            ChannelEnvKeys.SPSC_METRICS_LOG_INTERVAL_SEC,
            ChannelDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC,
            1L,
            ChannelDefaults.MAX_METRICS_LOG_INTERVAL_SEC);
    }

    public long intervalSeconds() {
        return intervalSeconds;
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() throws JsonProcessingException {
        AtomicChannelMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "spsc-channel");
        payload.put("channel", channelName);
        payload.put("type", "channel_metrics");
        payload.put("sent", s.sent());
        payload.put("received", s.received());
        payload.put("rejectedSends", s.rejectedSends());
        payload.put("residualReleased", s.residualReleased());
        payload.put("fullSpins", s.fullSpins());
        payload.put("fullStalls", s.fullStalls());
        payload.put("maxFullSpins", s.maxFullSpins());
        payload.put("emptySpins", s.emptySpins());
        payload.put("emptyStalls", s.emptyStalls());
        Object state = channelStateSupplier.get();
        if (state != null) {
            payload.put("state", state);
        }
        return MAPPER.writeValueAsString(payload);
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            // a failing tick must not cancel the schedule
            LOG.log(Level.WARNING, "Metrics reporter failure for channel " + channelName, t);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
