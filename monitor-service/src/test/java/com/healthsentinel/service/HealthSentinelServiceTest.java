package com.healthsentinel.service;

import com.healthsentinel.core.collect.MetricSource;
import com.healthsentinel.core.collect.RawReadings;
import com.healthsentinel.core.collect.Reading;
import com.healthsentinel.core.config.EntitySeed;
import com.healthsentinel.core.config.MonitorConfig;
import com.healthsentinel.core.model.HealthReport;
import com.healthsentinel.core.model.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring tests for {@link HealthSentinelService}.
 */
class HealthSentinelServiceTest {

    private static final MetricSource SOURCE = entity -> RawReadings.empty()
            .put(Reading.REQUEST_RATE, 80.0)
            .put(Reading.ERROR_RATE, 0.06)
            .put(Reading.LATENCY_P95, 250.0)
            .put(Reading.CPU_USAGE, 0.5);

    @Test
    @DisplayName("Should seed entities and serve health after a tick in memory")
    void shouldRunInMemory() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        try (HealthSentinelService service = HealthSentinelService.create(config, monitorConfig(),
                SOURCE, Clock.systemUTC())) {
            assertThat(service.getRegistry().listActiveEntities()).containsExactly("api-gateway", "checkout");

            TickSummary summary = service.getScheduler().runOnce();

            assertThat(summary.getProcessed()).isEqualTo(2);
            List<HealthReport> reports = service.getQueryService().latestHealthAll();
            assertThat(reports).hasSize(2);
            // -15 for error rate, -5 for latency
            assertThat(reports).allSatisfy(r -> {
                assertThat(r.getHealthScore()).isEqualTo(80);
                assertThat(r.getStatus()).isEqualTo(HealthStatus.DEGRADED);
            });
        }
    }

    @Test
    @DisplayName("Should persist through JDBC when a URL is configured")
    void shouldRunOnJdbc() {
        ServiceConfig config = new ServiceConfig.Builder()
                .jdbcUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .build();

        try (HealthSentinelService service = HealthSentinelService.create(config, monitorConfig(),
                SOURCE, Clock.systemUTC())) {
            assertThat(service.getRegistry()).isInstanceOf(JdbcEntityRegistry.class);

            service.getQueryService().triggerCollection("checkout");

            assertThat(service.getQueryService().latestHealth("checkout")).isPresent();
            assertThat(service.getRegistry().listEntities())
                    .filteredOn(e -> e.getName().equals("checkout"))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getLastSeen()).isNotNull());
        }
    }

    @Test
    @DisplayName("Should load the monitor configuration from the configured path")
    void shouldLoadConfiguredMonitorConfig(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, "detection:\n  model: rcf\nentities:\n  - name: orders\n");
        ServiceConfig config = new ServiceConfig.Builder().monitorConfigPath(file.toString()).build();

        MonitorConfig loaded = HealthSentinelService.loadMonitorConfig(config);

        assertThat(loaded.getDetection().getModel()).isEqualTo("rcf");
        assertThat(loaded.getEntities()).extracting(EntitySeed::getName).containsExactly("orders");
    }

    @Test
    @DisplayName("Should fall back to the bundled monitor.yml")
    void shouldLoadBundledMonitorConfig() {
        MonitorConfig loaded = HealthSentinelService.loadMonitorConfig(new ServiceConfig.Builder().build());

        assertThat(loaded.getDetection().getModel()).isEqualTo("ecod");
        assertThat(loaded.getEntities()).extracting(EntitySeed::getName).contains("api-gateway");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MonitorConfig monitorConfig() {
        MonitorConfig config = new MonitorConfig();
        config.setEntities(List.of(new EntitySeed("checkout", "backend"), new EntitySeed("api-gateway", "gateway")));
        return config;
    }
}
