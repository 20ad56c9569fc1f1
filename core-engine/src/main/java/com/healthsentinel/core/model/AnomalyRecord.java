package com.healthsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Anomaly produced by the windowed detector for one entity.
 *
 * <p>
 * Records are append-only. The {@code id} is {@code null} until a store has
 * persisted the record; {@link #withId(long)} returns the stored copy.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code entity}, {@code timestamp} and
 * {@code severity} are required; {@code kind} defaults to
 * {@value #METRIC_DEVIATION} and {@code createdAt} to {@code timestamp}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The only kind of anomaly the windowed detector emits. */
    public static final String METRIC_DEVIATION = "metric_deviation";

    private final Long id;
    private final String entity;
    private final Instant timestamp;
    private final String kind;
    private final Severity severity;
    private final double score;
    private final List<String> affectedMetrics;
    private final String description;
    private final Instant createdAt;

    private AnomalyRecord(Builder builder) {
        this.id = builder.id;
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.kind = builder.kind != null ? builder.kind : METRIC_DEVIATION;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.score = builder.score;
        this.affectedMetrics = builder.affectedMetrics != null
                ? List.copyOf(builder.affectedMetrics)
                : List.of();
        this.description = builder.description;
        this.createdAt = builder.createdAt != null ? builder.createdAt : timestamp;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a copy of this record carrying the store-assigned id.
     *
     * @param id identifier assigned by the store
     * @return stored copy
     */
    public AnomalyRecord withId(long id) {
        return new Builder()
                .id(id)
                .entity(entity)
                .timestamp(timestamp)
                .kind(kind)
                .severity(severity)
                .score(score)
                .affectedMetrics(affectedMetrics)
                .description(description)
                .createdAt(createdAt)
                .build();
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    public static class Builder {
        private Long id;
        private String entity;
        private Instant timestamp;
        private String kind;
        private Severity severity;
        private double score;
        private List<String> affectedMetrics;
        private String description;
        private Instant createdAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder affectedMetrics(List<String> affectedMetrics) {
            this.affectedMetrics = affectedMetrics;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException if a required field is {@code null}
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Long getId() {
        return id;
    }

    public String getEntity() {
        return entity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getScore() {
        return score;
    }

    /**
     * @return unmodifiable list of affected metric names, in feature order
     */
    public List<String> getAffectedMetrics() {
        return affectedMetrics;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Objects.equals(id, that.id)
                && entity.equals(that.entity)
                && timestamp.equals(that.timestamp)
                && severity == that.severity
                && Double.compare(score, that.score) == 0
                && affectedMetrics.equals(that.affectedMetrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entity, timestamp, severity, score, affectedMetrics);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "id=" + id +
                ", entity='" + entity + '\'' +
                ", timestamp=" + timestamp +
                ", severity=" + severity +
                ", score=" + score +
                ", affectedMetrics=" + affectedMetrics +
                ", description='" + description + '\'' +
                '}';
    }
}
