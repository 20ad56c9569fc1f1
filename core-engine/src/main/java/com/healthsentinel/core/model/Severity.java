package com.healthsentinel.core.model;

import java.util.Locale;

/**
 * Severity of a detected anomaly, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Classify a normalized anomaly score in {@code [0, 1]}.
     *
     * <p>
     * Thresholds are strict: a score of exactly {@code 0.9} is {@link #HIGH}.
     * </p>
     *
     * @param score normalized anomaly score, higher means more abnormal
     * @return severity bucket for the score
     */
    public static Severity fromScore(double score) {
        if (score > 0.9) {
            return CRITICAL;
        }
        if (score > 0.7) {
            return HIGH;
        }
        if (score > 0.5) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Parse a stored label such as {@code "high"}.
     *
     * @param label case-insensitive severity label
     * @return matching severity
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Severity fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @return lowercase label used in storage, e.g. {@code "critical"}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return capitalized label used in descriptions, e.g. {@code "Critical"}
     */
    public String displayName() {
        String label = label();
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
