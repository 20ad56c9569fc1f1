package com.healthsentinel.core.query;

import com.healthsentinel.core.collect.MetricsCollector;
import com.healthsentinel.core.detection.WindowedAnomalyDetector;
import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.HealthReport;
import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.scoring.HealthScore;
import com.healthsentinel.core.scoring.HealthScorer;
import com.healthsentinel.core.store.TimeOrder;
import com.healthsentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read and invoke operations exposed to an external API layer.
 *
 * <p>
 * Health is scored at query time from the latest stored record; nothing here
 * writes except {@link #triggerCollection(String)}, which runs the same
 * collect-store-detect sequence as one scheduler pass for a single entity.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(HealthQueryService.class);

    private final TimeSeriesStore store;
    private final MetricsCollector collector;
    private final WindowedAnomalyDetector detector;

    public HealthQueryService(TimeSeriesStore store, MetricsCollector collector,
            WindowedAnomalyDetector detector) {
        this.store = Objects.requireNonNull(store, "TimeSeriesStore must not be null");
        this.collector = Objects.requireNonNull(collector, "MetricsCollector must not be null");
        this.detector = Objects.requireNonNull(detector, "WindowedAnomalyDetector must not be null");
    }

    /**
     * @param entity entity name
     * @return health of the entity's latest record, empty if it has none
     */
    public Optional<HealthReport> latestHealth(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        return store.latestMetric(entity).map(HealthQueryService::report);
    }

    /**
     * @return health of the latest record of every entity, ordered by name
     */
    public List<HealthReport> latestHealthAll() {
        return store.latestMetricAll().stream()
                .map(HealthQueryService::report)
                .toList();
    }

    /**
     * @param entity entity name
     * @param since  exclusive lower bound
     * @return records after {@code since}, oldest first
     */
    public List<MetricRecord> history(String entity, Instant since) {
        Objects.requireNonNull(entity, "entity must not be null");
        return store.queryMetrics(entity, since, TimeOrder.OLDEST_FIRST);
    }

    /**
     * @param entity entity name, or {@code null} for every entity
     * @param since  exclusive lower bound
     * @return anomalies after {@code since}, newest first
     */
    public List<AnomalyRecord> anomalies(String entity, Instant since) {
        return store.queryAnomalies(entity, since);
    }

    /**
     * Collect, store and run detection for one entity now.
     *
     * @param entity entity name
     * @return the stored record and the anomalies found
     * @throws com.healthsentinel.core.store.StoreException if persistence fails
     */
    public CollectionResult triggerCollection(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        MetricRecord record = collector.collectAndStore(entity);
        List<AnomalyRecord> anomalies = detector.detect(entity);
        LOG.info("Manual collection for [{}] stored {} and found {} anomal{}", entity,
                record.getTimestamp(), anomalies.size(), anomalies.size() == 1 ? "y" : "ies");
        return new CollectionResult(record, anomalies);
    }

    private static HealthReport report(MetricRecord record) {
        HealthScore score = HealthScorer.score(record);
        return new HealthReport(record, score.getScore(), score.getStatus());
    }
}
