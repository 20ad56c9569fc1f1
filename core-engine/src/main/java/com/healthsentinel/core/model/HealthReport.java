package com.healthsentinel.core.model;

import java.util.Objects;

/**
 * Latest metric snapshot of an entity together with its computed health.
 *
 * <p>
 * Built at query time; health is never persisted.
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthReport {

    private final MetricRecord latest;
    private final int healthScore;
    private final HealthStatus status;

    public HealthReport(MetricRecord latest, int healthScore, HealthStatus status) {
        this.latest = Objects.requireNonNull(latest, "latest must not be null");
        this.healthScore = healthScore;
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public String getEntity() {
        return latest.getEntity();
    }

    public MetricRecord getLatest() {
        return latest;
    }

    public int getHealthScore() {
        return healthScore;
    }

    public HealthStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "HealthReport{" +
                "entity='" + getEntity() + '\'' +
                ", timestamp=" + latest.getTimestamp() +
                ", healthScore=" + healthScore +
                ", status=" + status +
                '}';
    }
}
