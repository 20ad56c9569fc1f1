package com.healthsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Canonical health snapshot for one entity at one instant.
 *
 * <p>
 * Produced by the collector from whatever a metric source returned, so every
 * record has the same nine readings regardless of the monitoring backend.
 * Latencies are in milliseconds, {@code errorRate} and {@code cpuUsage} are
 * fractions, {@code memoryUsage} is in bytes.
 * </p>
 *
 * <h3>Identity</h3>
 * <p>
 * A record is keyed by {@code (entity, timestamp)}. Stores keep at most one
 * record per key; writing a second record with the same key replaces the
 * first.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final Instant timestamp;
    private final double requestRate;
    private final double errorRate;
    private final double latencyP50;
    private final double latencyP95;
    private final double latencyP99;
    private final double cpuUsage;
    private final double memoryUsage;
    private final int restartCount;
    private final int instanceCount;

    private MetricRecord(Builder builder) {
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.requestRate = builder.requestRate;
        this.errorRate = builder.errorRate;
        this.latencyP50 = builder.latencyP50;
        this.latencyP95 = builder.latencyP95;
        this.latencyP99 = builder.latencyP99;
        this.cpuUsage = builder.cpuUsage;
        this.memoryUsage = builder.memoryUsage;
        this.restartCount = builder.restartCount;
        this.instanceCount = builder.instanceCount;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-filled with every value of this record.
     *
     * @return builder copy
     */
    public Builder toBuilder() {
        return new Builder()
                .entity(entity)
                .timestamp(timestamp)
                .requestRate(requestRate)
                .errorRate(errorRate)
                .latencyP50(latencyP50)
                .latencyP95(latencyP95)
                .latencyP99(latencyP99)
                .cpuUsage(cpuUsage)
                .memoryUsage(memoryUsage)
                .restartCount(restartCount)
                .instanceCount(instanceCount);
    }

    /**
     * Fluent builder for {@link MetricRecord}.
     *
     * <p>
     * {@code entity} and {@code timestamp} are required; every reading
     * defaults to zero.
     * </p>
     */
    public static class Builder {
        private String entity;
        private Instant timestamp;
        private double requestRate;
        private double errorRate;
        private double latencyP50;
        private double latencyP95;
        private double latencyP99;
        private double cpuUsage;
        private double memoryUsage;
        private int restartCount;
        private int instanceCount;

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder requestRate(double requestRate) {
            this.requestRate = requestRate;
            return this;
        }

        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }

        public Builder latencyP50(double latencyP50) {
            this.latencyP50 = latencyP50;
            return this;
        }

        public Builder latencyP95(double latencyP95) {
            this.latencyP95 = latencyP95;
            return this;
        }

        public Builder latencyP99(double latencyP99) {
            this.latencyP99 = latencyP99;
            return this;
        }

        public Builder cpuUsage(double cpuUsage) {
            this.cpuUsage = cpuUsage;
            return this;
        }

        public Builder memoryUsage(double memoryUsage) {
            this.memoryUsage = memoryUsage;
            return this;
        }

        public Builder restartCount(int restartCount) {
            this.restartCount = restartCount;
            return this;
        }

        public Builder instanceCount(int instanceCount) {
            this.instanceCount = instanceCount;
            return this;
        }

        /**
         * Build the record.
         *
         * @return a new {@link MetricRecord}
         * @throws NullPointerException if {@code entity} or {@code timestamp} is
         *                              {@code null}
         */
        public MetricRecord build() {
            return new MetricRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEntity() {
        return entity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getRequestRate() {
        return requestRate;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public double getLatencyP50() {
        return latencyP50;
    }

    public double getLatencyP95() {
        return latencyP95;
    }

    public double getLatencyP99() {
        return latencyP99;
    }

    public double getCpuUsage() {
        return cpuUsage;
    }

    public double getMemoryUsage() {
        return memoryUsage;
    }

    public int getRestartCount() {
        return restartCount;
    }

    public int getInstanceCount() {
        return instanceCount;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricRecord that))
            return false;
        return Double.compare(requestRate, that.requestRate) == 0
                && Double.compare(errorRate, that.errorRate) == 0
                && Double.compare(latencyP50, that.latencyP50) == 0
                && Double.compare(latencyP95, that.latencyP95) == 0
                && Double.compare(latencyP99, that.latencyP99) == 0
                && Double.compare(cpuUsage, that.cpuUsage) == 0
                && Double.compare(memoryUsage, that.memoryUsage) == 0
                && restartCount == that.restartCount
                && instanceCount == that.instanceCount
                && entity.equals(that.entity)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, timestamp, requestRate, errorRate, latencyP50, latencyP95,
                latencyP99, cpuUsage, memoryUsage, restartCount, instanceCount);
    }

    @Override
    public String toString() {
        return "MetricRecord{" +
                "entity='" + entity + '\'' +
                ", timestamp=" + timestamp +
                ", requestRate=" + requestRate +
                ", errorRate=" + errorRate +
                ", latencyP50=" + latencyP50 +
                ", latencyP95=" + latencyP95 +
                ", latencyP99=" + latencyP99 +
                ", cpuUsage=" + cpuUsage +
                ", memoryUsage=" + memoryUsage +
                ", restartCount=" + restartCount +
                ", instanceCount=" + instanceCount +
                '}';
    }
}
