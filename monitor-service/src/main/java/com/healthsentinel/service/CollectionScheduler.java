package com.healthsentinel.service;

import com.codahale.metrics.Timer;
import com.healthsentinel.core.collect.MetricsCollector;
import com.healthsentinel.core.detection.WindowedAnomalyDetector;
import com.healthsentinel.core.store.EntityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs collection and anomaly detection for every active entity at a fixed
 * cadence.
 *
 * <h3>Tick</h3>
 * <ol>
 * <li>Read the active entities from the {@link EntityRegistry}.</li>
 * <li>Per entity, collect and store a metric record, then run detection.</li>
 * </ol>
 *
 * <h3>Failure Isolation</h3>
 * <p>
 * A failure for one entity, {@link Error}s included, is logged and counted;
 * the remaining entities of the tick are still processed. A failure to list entities ends the tick.
 * Neither stops the schedule: the next tick starts one interval after the
 * previous one finished.
 * </p>
 *
 * @since 1.0.0
 */
public class CollectionScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CollectionScheduler.class);

    private final EntityRegistry registry;
    private final MetricsCollector collector;
    private final WindowedAnomalyDetector detector;
    private final Duration interval;
    private final SchedulerMetrics metrics;

    private ScheduledExecutorService executor;

    public CollectionScheduler(EntityRegistry registry, MetricsCollector collector,
            WindowedAnomalyDetector detector, Duration interval, SchedulerMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "EntityRegistry must not be null");
        this.collector = Objects.requireNonNull(collector, "MetricsCollector must not be null");
        this.detector = Objects.requireNonNull(detector, "WindowedAnomalyDetector must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.metrics = Objects.requireNonNull(metrics, "SchedulerMetrics must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    /**
     * Start ticking immediately, then once per interval.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Collection scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collection-scheduler");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Collection scheduler started, interval {}", interval);
    }

    /**
     * Stop the schedule, waiting briefly for a running tick to finish.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Collection tick did not finish in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        LOG.info("Collection scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Execute a single tick on the calling thread.
     *
     * @return what the tick did
     */
    public TickSummary runOnce() {
        Timer.Context timer = metrics.startTick();
        try {
            Set<String> entities;
            try {
                entities = registry.listActiveEntities();
            } catch (RuntimeException e) {
                LOG.error("Failed to list active entities, skipping tick: {}", e.getMessage(), e);
                metrics.incrementTickFailures();
                return TickSummary.aborted();
            }

            int processed = 0;
            int failed = 0;
            int anomalies = 0;
            for (String entity : entities) {
                try {
                    collector.collectAndStore(entity);
                    int found = detector.detect(entity).size();
                    anomalies += found;
                    processed++;
                    metrics.incrementEntitiesCollected();
                    metrics.incrementAnomaliesDetected(found);
                } catch (Throwable t) {
                    failed++;
                    metrics.incrementCollectionFailures();
                    LOG.error("[{}] collection failed: {}", entity, t.getMessage(), t);
                }
            }

            TickSummary summary = new TickSummary(processed, failed, anomalies);
            LOG.info("Collection tick finished: {}", summary);
            return summary;
        } finally {
            timer.stop();
        }
    }

    // A throwing task would cancel every later run of the schedule.
    private void tick() {
        try {
            runOnce();
        } catch (Throwable t) {
            metrics.incrementTickFailures();
            LOG.error("Uncaught error in collection tick.", t);
        }
    }
}
