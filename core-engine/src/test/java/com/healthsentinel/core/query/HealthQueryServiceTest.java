package com.healthsentinel.core.query;

import com.healthsentinel.core.collect.MetricsCollector;
import com.healthsentinel.core.collect.RawReadings;
import com.healthsentinel.core.collect.Reading;
import com.healthsentinel.core.detection.WindowedAnomalyDetector;
import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.DetectionSettings;
import com.healthsentinel.core.model.HealthReport;
import com.healthsentinel.core.model.HealthStatus;
import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.model.Severity;
import com.healthsentinel.core.store.InMemoryEntityRegistry;
import com.healthsentinel.core.store.InMemoryTimeSeriesStore;
import com.healthsentinel.core.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link HealthQueryService}.
 */
class HealthQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryTimeSeriesStore store;
    private HealthQueryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
        service = newService(store);
    }

    @Test
    @DisplayName("Should score the latest record of an entity")
    void shouldReportLatestHealth() {
        store.upsertMetric(record("api", NOW.minusSeconds(120), 0.0));
        store.upsertMetric(record("api", NOW.minusSeconds(60), 0.2));

        HealthReport report = service.latestHealth("api").orElseThrow();

        assertThat(report.getEntity()).isEqualTo("api");
        assertThat(report.getHealthScore()).isEqualTo(70);
        assertThat(report.getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(service.latestHealth("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should list latest health for every entity with data")
    void shouldReportLatestHealthForAll() {
        store.upsertMetric(record("web", NOW.minusSeconds(60), 0.0));
        store.upsertMetric(record("api", NOW.minusSeconds(60), 0.07));

        assertThat(service.latestHealthAll())
                .extracting(HealthReport::getEntity, HealthReport::getHealthScore)
                .containsExactly(
                        tuple("api", 85),
                        tuple("web", 100));
    }

    @Test
    @DisplayName("Should return history oldest first after 'since'")
    void shouldReturnHistoryAscending() {
        for (int i = 3; i >= 1; i--) {
            store.upsertMetric(record("api", NOW.minus(Duration.ofMinutes(i)), 0.0));
        }

        List<MetricRecord> history = service.history("api", NOW.minus(Duration.ofMinutes(3)));

        assertThat(history).extracting(MetricRecord::getTimestamp)
                .containsExactly(NOW.minus(Duration.ofMinutes(2)), NOW.minus(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Should filter anomalies by entity when one is given")
    void shouldFilterAnomalies() {
        store.appendAnomaly(anomaly("api"));
        store.appendAnomaly(anomaly("web"));

        assertThat(service.anomalies(null, Instant.EPOCH)).hasSize(2);
        assertThat(service.anomalies("web", Instant.EPOCH))
                .singleElement()
                .extracting(AnomalyRecord::getEntity)
                .isEqualTo("web");
    }

    @Test
    @DisplayName("Should collect, store and detect on demand")
    void shouldTriggerCollection() {
        CollectionResult result = service.triggerCollection("api");

        assertThat(result.getRecord().getRequestRate()).isEqualTo(42.0);
        assertThat(result.getAnomaliesDetected()).isZero();
        assertThat(store.latestMetric("api")).contains(result.getRecord());
    }

    @Test
    @DisplayName("Should surface store failures to the caller")
    void shouldSurfaceStoreFailures() {
        InMemoryTimeSeriesStore failing = new InMemoryTimeSeriesStore() {
            @Override
            public void upsertMetric(MetricRecord record) {
                throw new StoreException("disk full");
            }
        };

        assertThatThrownBy(() -> newService(failing).triggerCollection("api"))
                .isInstanceOf(StoreException.class)
                .hasMessage("disk full");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static HealthQueryService newService(InMemoryTimeSeriesStore store) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        MetricsCollector collector = new MetricsCollector(
                entity -> RawReadings.empty().put(Reading.REQUEST_RATE, 42.0),
                store, new InMemoryEntityRegistry(), clock);
        WindowedAnomalyDetector detector = new WindowedAnomalyDetector(store, new DetectionSettings(), clock);
        return new HealthQueryService(store, collector, detector);
    }

    private static MetricRecord record(String entity, Instant ts, double errorRate) {
        return MetricRecord.builder()
                .entity(entity)
                .timestamp(ts)
                .errorRate(errorRate)
                .latencyP95(100)
                .cpuUsage(0.2)
                .build();
    }

    private static AnomalyRecord anomaly(String entity) {
        return AnomalyRecord.builder()
                .entity(entity)
                .timestamp(NOW)
                .severity(Severity.MEDIUM)
                .score(0.6)
                .description("Medium anomaly detected in service behavior")
                .build();
    }
}
