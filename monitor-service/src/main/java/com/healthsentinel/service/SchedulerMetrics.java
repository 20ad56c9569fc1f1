package com.healthsentinel.service;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Operational metrics of the collection scheduler.
 * <p>
 * Registered in a Dropwizard {@link MetricRegistry}; the service reports the
 * registry periodically through SLF4J.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code health_sentinel.entities_collected_total} – entities processed without error</li>
 *   <li>{@code health_sentinel.collection_failures_total} – entities whose collection or detection failed</li>
 *   <li>{@code health_sentinel.anomalies_detected_total} – anomalies stored by scheduled detection</li>
 *   <li>{@code health_sentinel.tick_failures_total} – ticks aborted before processing any entity</li>
 *   <li>{@code health_sentinel.tick_duration} – timer over whole ticks</li>
 * </ul>
 */
public class SchedulerMetrics {

    static final String GROUP = "health_sentinel";

    private final Counter entitiesCollected;
    private final Counter collectionFailures;
    private final Counter anomaliesDetected;
    private final Counter tickFailures;
    private final Timer tickDuration;

    public SchedulerMetrics(MetricRegistry registry) {
        this.entitiesCollected = registry.counter(MetricRegistry.name(GROUP, "entities_collected_total"));
        this.collectionFailures = registry.counter(MetricRegistry.name(GROUP, "collection_failures_total"));
        this.anomaliesDetected = registry.counter(MetricRegistry.name(GROUP, "anomalies_detected_total"));
        this.tickFailures = registry.counter(MetricRegistry.name(GROUP, "tick_failures_total"));
        this.tickDuration = registry.timer(MetricRegistry.name(GROUP, "tick_duration"));
    }

    public void incrementEntitiesCollected() {
        entitiesCollected.inc();
    }

    public void incrementCollectionFailures() {
        collectionFailures.inc();
    }

    public void incrementAnomaliesDetected(int count) {
        anomaliesDetected.inc(count);
    }

    public void incrementTickFailures() {
        tickFailures.inc();
    }

    public Timer.Context startTick() {
        return tickDuration.time();
    }
}
