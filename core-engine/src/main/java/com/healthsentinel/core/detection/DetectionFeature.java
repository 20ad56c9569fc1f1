package com.healthsentinel.core.detection;

import com.healthsentinel.core.model.MetricRecord;

import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * The six metric record fields the outlier models are trained on, in column
 * order.
 *
 * @since 1.0.0
 */
public enum DetectionFeature {

    REQUEST_RATE(MetricRecord::getRequestRate),
    ERROR_RATE(MetricRecord::getErrorRate),
    LATENCY_P95(MetricRecord::getLatencyP95),
    CPU_USAGE(MetricRecord::getCpuUsage),
    MEMORY_USAGE(MetricRecord::getMemoryUsage),
    RESTART_COUNT(MetricRecord::getRestartCount);

    private final ToDoubleFunction<MetricRecord> extractor;

    DetectionFeature(ToDoubleFunction<MetricRecord> extractor) {
        this.extractor = extractor;
    }

    /**
     * @return metric name used in anomaly attribution, e.g. {@code "cpu_usage"}
     */
    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public double extract(MetricRecord record) {
        return extractor.applyAsDouble(record);
    }

    /**
     * Build the observation matrix for a window; row {@code i} is
     * {@code records.get(i)}.
     *
     * @param records window records
     * @return {@code records.size() × values().length} matrix
     */
    public static double[][] matrix(List<MetricRecord> records) {
        DetectionFeature[] features = values();
        double[][] rows = new double[records.size()][features.length];
        for (int i = 0; i < records.size(); i++) {
            MetricRecord record = records.get(i);
            for (int j = 0; j < features.length; j++) {
                rows[i][j] = features[j].extract(record);
            }
        }
        return rows;
    }
}
