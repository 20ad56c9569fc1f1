package com.healthsentinel.core.scoring;

import com.healthsentinel.core.model.MetricRecord;

import java.util.Objects;

/**
 * Deterministic health score for a single metric record.
 *
 * <p>
 * Starts at 100 and subtracts the penalty of the worst bracket each metric
 * falls into. Penalties of different metrics add up; the result is clamped
 * at zero.
 * </p>
 *
 * <table>
 * <caption>Penalty brackets (strictly greater than)</caption>
 * <tr><th>metric</th><th>brackets</th></tr>
 * <tr><td>error rate</td><td>&gt;0.10 −30, &gt;0.05 −15, &gt;0.01 −5</td></tr>
 * <tr><td>p95 latency (ms)</td><td>&gt;1000 −25, &gt;500 −15, &gt;200 −5</td></tr>
 * <tr><td>cpu usage</td><td>&gt;0.90 −20, &gt;0.70 −10</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class HealthScorer {

    static final int MAX_SCORE = 100;

    private HealthScorer() {
        // utility class, not instantiable
    }

    /**
     * Score a record.
     *
     * @param record metric record; must not be {@code null}
     * @return score in {@code [0, 100]} with its status
     */
    public static HealthScore score(MetricRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        int score = MAX_SCORE
                - errorRatePenalty(record.getErrorRate())
                - latencyPenalty(record.getLatencyP95())
                - cpuPenalty(record.getCpuUsage());

        return new HealthScore(Math.max(0, score));
    }

    static int errorRatePenalty(double errorRate) {
        if (errorRate > 0.10) {
            return 30;
        }
        if (errorRate > 0.05) {
            return 15;
        }
        if (errorRate > 0.01) {
            return 5;
        }
        return 0;
    }

    static int latencyPenalty(double latencyP95Ms) {
        if (latencyP95Ms > 1000) {
            return 25;
        }
        if (latencyP95Ms > 500) {
            return 15;
        }
        if (latencyP95Ms > 200) {
            return 5;
        }
        return 0;
    }

    static int cpuPenalty(double cpuUsage) {
        if (cpuUsage > 0.90) {
            return 20;
        }
        if (cpuUsage > 0.70) {
            return 10;
        }
        return 0;
    }
}
