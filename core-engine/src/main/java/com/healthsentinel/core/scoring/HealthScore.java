package com.healthsentinel.core.scoring;

import com.healthsentinel.core.model.HealthStatus;

import java.util.Objects;

/**
 * Result of {@link HealthScorer#score}: a value in {@code [0, 100]} and its
 * status.
 *
 * @since 1.0.0
 */
public final class HealthScore {

    private final int score;
    private final HealthStatus status;

    HealthScore(int score) {
        this.score = score;
        this.status = HealthStatus.fromScore(score);
    }

    public int getScore() {
        return score;
    }

    public HealthStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HealthScore that))
            return false;
        return score == that.score && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, status);
    }

    @Override
    public String toString() {
        return "HealthScore{score=" + score + ", status=" + status + '}';
    }
}
