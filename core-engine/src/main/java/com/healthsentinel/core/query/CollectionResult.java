package com.healthsentinel.core.query;

import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.MetricRecord;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a manually triggered collection.
 *
 * @since 1.0.0
 */
public final class CollectionResult {

    private final MetricRecord record;
    private final List<AnomalyRecord> anomalies;

    public CollectionResult(MetricRecord record, List<AnomalyRecord> anomalies) {
        this.record = Objects.requireNonNull(record, "record must not be null");
        this.anomalies = List.copyOf(anomalies);
    }

    public MetricRecord getRecord() {
        return record;
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    public int getAnomaliesDetected() {
        return anomalies.size();
    }

    @Override
    public String toString() {
        return "CollectionResult{record=" + record + ", anomaliesDetected=" + anomalies.size() + '}';
    }
}
