package com.acme.spsc.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodicMetricsReporterTest {

    public record FakeState(long readCursor, long writeCursor) {}

    @Test
    void shouldRenderCountersAndStateAsJson() throws Exception {
        AtomicChannelMetrics metrics = new AtomicChannelMetrics();
        metrics.incSent(5);
        metrics.incReceived(3);
        metrics.observeFullSpins(9);

        try (PeriodicMetricsReporter reporter =
                 new PeriodicMetricsReporter("orders", metrics, 5, () -> new FakeState(3, 5))) {
            JsonNode json = new ObjectMapper().readTree(reporter.render());
            assertEquals("orders", json.get("channel").asText());
            assertEquals("channel_metrics", json.get("type").asText());
            assertEquals(5, json.get("sent").asLong());
            assertEquals(3, json.get("received").asLong());
            assertEquals(9, json.get("maxFullSpins").asLong());
            assertEquals(3, json.get("state").get("readCursor").asLong());
            assertEquals(5, json.get("state").get("writeCursor").asLong());
        }
    }

    @Test
    void shouldOmitStateWhenSupplierReturnsNothing() throws Exception {
        try (PeriodicMetricsReporter reporter = new PeriodicMetricsReporter("idle", new AtomicChannelMetrics(), 0)) {
            JsonNode json = new ObjectMapper().readTree(reporter.render());
            assertFalse(json.has("state"));
            assertTrue(json.has("rejectedSends"));
            assertEquals(1, reporter.intervalSeconds());
        }
    }

    @Test
    void shouldReadIntervalFromEnvironment() {
        assertEquals(10, PeriodicMetricsReporter.intervalFromEnv(Map.of()));
        assertEquals(30, PeriodicMetricsReporter.intervalFromEnv(Map.of("SPSC_METRICS_LOG_INTERVAL_SEC", "30")));
        assertEquals(1, PeriodicMetricsReporter.intervalFromEnv(Map.of("SPSC_METRICS_LOG_INTERVAL_SEC", "0")));
        assertEquals(3_600, PeriodicMetricsReporter.intervalFromEnv(Map.of("SPSC_METRICS_LOG_INTERVAL_SEC", "99999")));
    }
}
