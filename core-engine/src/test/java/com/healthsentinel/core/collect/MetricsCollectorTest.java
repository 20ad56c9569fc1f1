package com.healthsentinel.core.collect;

import com.healthsentinel.core.model.Entity;
import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.store.InMemoryEntityRegistry;
import com.healthsentinel.core.store.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricsCollector}.
 */
class MetricsCollectorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00.123456789Z");

    private InMemoryTimeSeriesStore store;
    private InMemoryEntityRegistry registry;
    private Clock clock;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
        registry = new InMemoryEntityRegistry();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry.register("api", "gateway", NOW.minusSeconds(3600));
    }

    @Test
    @DisplayName("Should map every reading and truncate the timestamp to milliseconds")
    void shouldMapReadings() {
        MetricSource source = entity -> RawReadings.empty()
                .put(Reading.REQUEST_RATE, 120.5)
                .put(Reading.ERROR_RATE, "0.02")
                .put(Reading.LATENCY_P50, 40)
                .put(Reading.LATENCY_P95, 180.0)
                .put(Reading.LATENCY_P99, 350.0)
                .put(Reading.CPU_USAGE, 0.45)
                .put(Reading.MEMORY_USAGE, 512_000_000L)
                .put(Reading.RESTART_COUNT, "3.7")
                .put(Reading.INSTANCE_COUNT, 4);

        MetricRecord record = new MetricsCollector(source, store, registry, clock).collect("api");

        assertThat(record.getEntity()).isEqualTo("api");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00.123Z"));
        assertThat(record.getRequestRate()).isEqualTo(120.5);
        assertThat(record.getErrorRate()).isEqualTo(0.02);
        assertThat(record.getLatencyP50()).isEqualTo(40.0);
        assertThat(record.getMemoryUsage()).isEqualTo(512_000_000.0);
        assertThat(record.getRestartCount()).isEqualTo(3);
        assertThat(record.getInstanceCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should default absent, malformed and non-finite readings to zero")
    void shouldDefaultBadReadingsToZero() {
        MetricSource source = entity -> RawReadings.empty()
                .put(Reading.REQUEST_RATE, "not-a-number")
                .put(Reading.ERROR_RATE, Double.NaN)
                .put(Reading.CPU_USAGE, "Inf")
                .put(Reading.LATENCY_P95, null)
                .put(Reading.MEMORY_USAGE, 1024.0);

        MetricRecord record = new MetricsCollector(source, store, registry, clock).collect("api");

        assertThat(record.getRequestRate()).isZero();
        assertThat(record.getErrorRate()).isZero();
        assertThat(record.getCpuUsage()).isZero();
        assertThat(record.getLatencyP95()).isZero();
        assertThat(record.getLatencyP99()).isZero();
        assertThat(record.getRestartCount()).isZero();
        assertThat(record.getMemoryUsage()).isEqualTo(1024.0);
    }

    @Test
    @DisplayName("Should clamp negative counts to zero and saturate huge ones")
    void shouldClampCounts() {
        MetricSource source = entity -> RawReadings.empty()
                .put(Reading.RESTART_COUNT, -2)
                .put(Reading.INSTANCE_COUNT, 1.0e12);

        MetricRecord record = new MetricsCollector(source, store, registry, clock).collect("api");

        assertThat(record.getRestartCount()).isZero();
        assertThat(record.getInstanceCount()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("Should record zeros when the source throws")
    void shouldRecordZerosWhenSourceThrows() {
        MetricSource source = entity -> {
            throw new IllegalStateException("connection refused");
        };

        MetricRecord record = new MetricsCollector(source, store, registry, clock).collectAndStore("api");

        assertThat(record.getRequestRate()).isZero();
        assertThat(store.latestMetric("api")).contains(record);
    }

    @Test
    @DisplayName("Should store the record and mark the entity as seen")
    void shouldStoreAndTouch() {
        MetricSource source = entity -> RawReadings.empty().put(Reading.REQUEST_RATE, 10);

        MetricRecord record = new MetricsCollector(source, store, registry, clock).collectAndStore("api");

        assertThat(store.latestMetric("api")).contains(record);
        assertThat(registry.listEntities())
                .singleElement()
                .extracting(Entity::getLastSeen)
                .isEqualTo(record.getTimestamp());
    }
}
