package com.healthsentinel.core.model;

import java.util.Locale;

/**
 * Discrete health status derived from a 0–100 health score.
 *
 * @since 1.0.0
 */
public enum HealthStatus {

    HEALTHY,
    DEGRADED,
    WARNING,
    CRITICAL;

    /**
     * Map a health score to its status: {@code >= 90} healthy, {@code >= 70}
     * degraded, {@code >= 50} warning, anything lower critical.
     *
     * @param score health score in {@code [0, 100]}
     * @return status bucket
     */
    public static HealthStatus fromScore(int score) {
        if (score >= 90) {
            return HEALTHY;
        }
        if (score >= 70) {
            return DEGRADED;
        }
        if (score >= 50) {
            return WARNING;
        }
        return CRITICAL;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
