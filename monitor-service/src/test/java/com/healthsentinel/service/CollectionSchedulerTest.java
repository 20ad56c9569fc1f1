package com.healthsentinel.service;

import com.codahale.metrics.MetricRegistry;
import com.healthsentinel.core.collect.MetricsCollector;
import com.healthsentinel.core.collect.RawReadings;
import com.healthsentinel.core.collect.Reading;
import com.healthsentinel.core.detection.WindowedAnomalyDetector;
import com.healthsentinel.core.model.DetectionSettings;
import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.store.InMemoryEntityRegistry;
import com.healthsentinel.core.store.InMemoryTimeSeriesStore;
import com.healthsentinel.core.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CollectionScheduler}.
 */
class CollectionSchedulerTest {

    private InMemoryTimeSeriesStore store;
    private InMemoryEntityRegistry registry;
    private MetricRegistry metricRegistry;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore() {
            @Override
            public void upsertMetric(MetricRecord record) {
                if (record.getEntity().equals("broken")) {
                    throw new StoreException("write rejected");
                }
                super.upsertMetric(record);
            }
        };
        registry = new InMemoryEntityRegistry();
        metricRegistry = new MetricRegistry();
        Instant now = Instant.now();
        registry.register("api", "gateway", now);
        registry.register("broken", "backend", now);
        registry.register("web", "frontend", now);
    }

    @Test
    @DisplayName("Should keep processing other entities when one fails")
    void shouldIsolateEntityFailures() {
        TickSummary summary = scheduler(registry).runOnce();

        assertThat(summary.getProcessed()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.isAborted()).isFalse();
        assertThat(store.latestMetric("api")).isPresent();
        assertThat(store.latestMetric("web")).isPresent();
        assertThat(store.latestMetric("broken")).isEmpty();

        assertThat(counter("entities_collected_total")).isEqualTo(2);
        assertThat(counter("collection_failures_total")).isEqualTo(1);
        assertThat(metricRegistry.timer("health_sentinel.tick_duration").getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should end the tick when active entities cannot be listed")
    void shouldAbortTickWhenRegistryFails() {
        InMemoryEntityRegistry failing = new InMemoryEntityRegistry() {
            @Override
            public Set<String> listActiveEntities() {
                throw new StoreException("registry unavailable");
            }
        };

        TickSummary summary = scheduler(failing).runOnce();

        assertThat(summary.isAborted()).isTrue();
        assertThat(summary.getProcessed()).isZero();
        assertThat(counter("tick_failures_total")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat an Error from one entity as that entity's failure")
    void shouldIsolateEntityErrors() {
        InMemoryTimeSeriesStore overflowing = new InMemoryTimeSeriesStore() {
            @Override
            public void upsertMetric(MetricRecord record) {
                if (record.getEntity().equals("broken")) {
                    throw new StackOverflowError();
                }
                super.upsertMetric(record);
            }
        };
        store = overflowing;

        TickSummary summary = scheduler(registry).runOnce();

        assertThat(summary.getProcessed()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(store.latestMetric("web")).isPresent();
    }

    @Test
    @DisplayName("Should keep ticking after a tick fails with an Error")
    void shouldSurviveErrorInTick() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        InMemoryEntityRegistry flaky = new InMemoryEntityRegistry() {
            @Override
            public Set<String> listActiveEntities() {
                if (calls.incrementAndGet() == 1) {
                    throw new AssertionError("registry corrupted");
                }
                return Set.of("web");
            }
        };
        CollectionScheduler scheduler = scheduler(flaky, Duration.ofMillis(50));
        scheduler.start();
        try {
            long deadline = System.currentTimeMillis() + 5_000;
            while (calls.get() < 3 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertThat(calls.get()).isGreaterThanOrEqualTo(3);
            assertThat(scheduler.isRunning()).isTrue();
        } finally {
            scheduler.stop();
        }
        assertThat(store.latestMetric("web")).isPresent();
        assertThat(counter("tick_failures_total")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count anomalies found during the tick")
    void shouldCountAnomalies() {
        Instant now = Instant.now();
        for (int i = 15; i >= 1; i--) {
            store.upsertMetric(MetricRecord.builder()
                    .entity("api")
                    .timestamp(now.minus(Duration.ofMinutes(i)))
                    .requestRate(100)
                    .errorRate(0.01)
                    .build());
        }

        // the collected record carries a request rate of 500 and an error rate of 0
        TickSummary summary = scheduler(registry).runOnce();

        assertThat(summary.getAnomalies()).isEqualTo(1);
        assertThat(counter("anomalies_detected_total")).isEqualTo(1);
        assertThat(store.queryAnomalies("api", Instant.EPOCH)).hasSize(1);
    }

    @Test
    @DisplayName("Should run ticks in the background until stopped")
    void shouldRunInBackground() throws InterruptedException {
        CollectionScheduler scheduler = scheduler(registry);
        scheduler.start();
        try {
            assertThat(scheduler.isRunning()).isTrue();
            assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);

            long deadline = System.currentTimeMillis() + 5_000;
            while (store.latestMetric("web").isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertThat(store.latestMetric("web")).isPresent();
        } finally {
            scheduler.stop();
        }
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new CollectionScheduler(registry, collector(), detector(), Duration.ZERO,
                new SchedulerMetrics(metricRegistry)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CollectionScheduler scheduler(InMemoryEntityRegistry entities) {
        return scheduler(entities, Duration.ofHours(1));
    }

    private CollectionScheduler scheduler(InMemoryEntityRegistry entities, Duration interval) {
        return new CollectionScheduler(entities, collector(), detector(), interval,
                new SchedulerMetrics(metricRegistry));
    }

    private MetricsCollector collector() {
        return new MetricsCollector(
                entity -> RawReadings.empty().put(Reading.REQUEST_RATE, 500.0).put(Reading.ERROR_RATE, 0.0),
                store, registry, Clock.systemUTC());
    }

    private WindowedAnomalyDetector detector() {
        return new WindowedAnomalyDetector(store, new DetectionSettings(), Clock.systemUTC());
    }

    private long counter(String name) {
        return metricRegistry.counter(SchedulerMetrics.GROUP + "." + name).getCount();
    }
}
