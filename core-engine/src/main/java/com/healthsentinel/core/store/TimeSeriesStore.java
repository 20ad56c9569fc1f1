package com.healthsentinel.core.store;

import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.MetricRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for metric records and anomaly records.
 *
 * <p>
 * Every operation is individually atomic and self-contained; implementations
 * hold no locks across calls. Metric records are keyed by
 * {@code (entity, timestamp)}: a second write with the same key replaces the
 * first. Anomaly records are append-only and receive an increasing id.
 * </p>
 *
 * <p>
 * Implementations signal unavailable persistence with {@link StoreException}.
 * </p>
 */
public interface TimeSeriesStore {

    /**
     * Insert a record, replacing any record with the same entity and
     * timestamp.
     *
     * @param record record to write
     */
    void upsertMetric(MetricRecord record);

    /**
     * Records for {@code entity} with a timestamp strictly after
     * {@code since}.
     *
     * @param entity entity name
     * @param since  exclusive lower bound
     * @param order  result ordering
     * @return matching records, empty when none
     */
    List<MetricRecord> queryMetrics(String entity, Instant since, TimeOrder order);

    /**
     * @param entity entity name
     * @return most recent record of the entity, if any
     */
    Optional<MetricRecord> latestMetric(String entity);

    /**
     * @return most recent record of every entity that has one, ordered by
     *         entity name
     */
    List<MetricRecord> latestMetricAll();

    /**
     * Append an anomaly. There is no deduplication.
     *
     * @param record anomaly without id
     * @return the stored anomaly carrying its assigned id
     */
    AnomalyRecord appendAnomaly(AnomalyRecord record);

    /**
     * Anomalies with a timestamp strictly after {@code since}, newest first.
     *
     * @param entity entity name, or {@code null} for every entity
     * @param since  exclusive lower bound
     * @return matching anomalies
     */
    List<AnomalyRecord> queryAnomalies(String entity, Instant since);
}
