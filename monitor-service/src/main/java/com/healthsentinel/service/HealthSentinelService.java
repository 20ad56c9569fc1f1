package com.healthsentinel.service;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.healthsentinel.core.collect.MetricSource;
import com.healthsentinel.core.collect.MetricsCollector;
import com.healthsentinel.core.config.EntitySeed;
import com.healthsentinel.core.config.MonitorConfig;
import com.healthsentinel.core.config.MonitorConfigLoader;
import com.healthsentinel.core.detection.WindowedAnomalyDetector;
import com.healthsentinel.core.query.HealthQueryService;
import com.healthsentinel.core.store.EntityRegistry;
import com.healthsentinel.core.store.InMemoryEntityRegistry;
import com.healthsentinel.core.store.InMemoryTimeSeriesStore;
import com.healthsentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the Health Sentinel monitor service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   EntityRegistry (active entities)
 *     → MetricSource (Prometheus) → MetricsCollector → TimeSeriesStore
 *     → WindowedAnomalyDetector → TimeSeriesStore (anomalies)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Runtime settings come from environment variables via {@link ServiceConfig};
 * detection tuning, Prometheus query overrides and the entities registered at
 * start-up come from the YAML {@link MonitorConfig}.
 * </p>
 *
 * <h3>Storage</h3>
 * <p>
 * With {@code JDBC_URL} set, metrics, anomalies and the registry live in the
 * relational store; otherwise everything is kept in memory and lost on exit.
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthSentinelService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HealthSentinelService.class);

    private final ServiceConfig config;
    private final EntityRegistry registry;
    private final HealthQueryService queryService;
    private final CollectionScheduler scheduler;
    private final MetricRegistry metricRegistry;
    private final JdbcStorage jdbcStorage;

    private HealthServer healthServer;
    private Slf4jReporter reporter;

    private HealthSentinelService(ServiceConfig config, TimeSeriesStore store, EntityRegistry registry,
            MetricSource source, MonitorConfig monitorConfig, Clock clock, JdbcStorage jdbcStorage) {
        this.config = config;
        this.registry = registry;
        this.jdbcStorage = jdbcStorage;
        this.metricRegistry = new MetricRegistry();

        MetricsCollector collector = new MetricsCollector(source, store, registry, clock);
        WindowedAnomalyDetector detector = new WindowedAnomalyDetector(store, monitorConfig.getDetection(), clock);
        this.queryService = new HealthQueryService(store, collector, detector);
        this.scheduler = new CollectionScheduler(registry, collector, detector,
                config.getCollectionInterval(), new SchedulerMetrics(metricRegistry));

        seedEntities(monitorConfig, clock);
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Health Sentinel with config: {}", config);
        MonitorConfig monitorConfig = loadMonitorConfig(config);

        // 2. Wire components
        HealthSentinelService service = create(config, monitorConfig);

        // 3. Start health endpoint, scheduler and metrics reporting
        service.start();
        Runtime.getRuntime().addShutdownHook(new Thread(service::close, "service-shutdown"));
    }

    // ---------------------------------------------------------------
    // Assembly
    // ---------------------------------------------------------------

    /**
     * Assemble the service with the Prometheus source.
     */
    public static HealthSentinelService create(ServiceConfig config, MonitorConfig monitorConfig) {
        MetricSource source = new PrometheusMetricSource(config.getPrometheusUrl(),
                monitorConfig.getQueries(), config.getPrometheusTimeout());
        return create(config, monitorConfig, source, Clock.systemUTC());
    }

    /**
     * Assemble the service around an arbitrary metric source.
     */
    static HealthSentinelService create(ServiceConfig config, MonitorConfig monitorConfig,
            MetricSource source, Clock clock) {
        Objects.requireNonNull(config, "ServiceConfig must not be null");
        Objects.requireNonNull(monitorConfig, "MonitorConfig must not be null");
        if (config.usesJdbc()) {
            JdbcStorage storage = JdbcStorage.open(config.getJdbcUrl(), config.getJdbcUser(),
                    config.getJdbcPassword());
            return new HealthSentinelService(config, storage.getStore(), storage.getRegistry(), source,
                    monitorConfig, clock, storage);
        }
        LOG.warn("JDBC_URL not set, keeping metrics and anomalies in memory");
        return new HealthSentinelService(config, new InMemoryTimeSeriesStore(), new InMemoryEntityRegistry(),
                source, monitorConfig, clock, null);
    }

    static MonitorConfig loadMonitorConfig(ServiceConfig config) {
        String path = config.getMonitorConfigPath();
        return path.isBlank() ? MonitorConfigLoader.load() : MonitorConfigLoader.fromFile(path);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        healthServer = new HealthServer(scheduler::isRunning);
        healthServer.start(config.getHealthPort());

        reporter = Slf4jReporter.forRegistry(metricRegistry)
                .outputTo(LoggerFactory.getLogger("com.healthsentinel.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();
        reporter.start(config.getMetricsReportInterval().toSeconds(), TimeUnit.SECONDS);

        scheduler.start();
        LOG.info("Health Sentinel started");
    }

    @Override
    public synchronized void close() {
        scheduler.stop();
        if (reporter != null) {
            reporter.stop();
        }
        if (healthServer != null) {
            healthServer.stop();
        }
        if (jdbcStorage != null) {
            jdbcStorage.close();
        }
        LOG.info("Health Sentinel stopped");
    }

    public HealthQueryService getQueryService() {
        return queryService;
    }

    public EntityRegistry getRegistry() {
        return registry;
    }

    CollectionScheduler getScheduler() {
        return scheduler;
    }

    MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    private void seedEntities(MonitorConfig monitorConfig, Clock clock) {
        int added = 0;
        for (EntitySeed seed : monitorConfig.getEntities()) {
            if (registry.register(seed.getName(), seed.getType(), clock.instant())) {
                added++;
            }
        }
        LOG.info("Registered {} new entit{} from configuration", added, added == 1 ? "y" : "ies");
    }
}
