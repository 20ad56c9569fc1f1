package com.healthsentinel.core.collect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source-specific readings for one entity, as returned by a
 * {@link MetricSource}.
 *
 * <p>
 * Values are kept as the source produced them ({@link Number}, numeric
 * {@link String}, or anything else) so that the collector decides how to
 * coerce them. A reading that is absent, {@code null} or not numeric is
 * reported as empty by {@link #getNumeric(Reading)}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A source fills one instance and hands it to the collector.
 * </p>
 *
 * @since 1.0.0
 */
public class RawReadings {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public static RawReadings empty() {
        return new RawReadings();
    }

    /**
     * Record a reading.
     *
     * @param key   reading key; must not be {@code null}
     * @param value raw value, may be {@code null}
     * @return this instance
     */
    public RawReadings put(String key, Object value) {
        Objects.requireNonNull(key, "Reading key must not be null");
        values.put(key, value);
        return this;
    }

    public RawReadings put(Reading reading, Object value) {
        return put(reading.key(), value);
    }

    /**
     * @return unmodifiable view of every recorded value
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Retrieve a reading as a finite {@code double}.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers. NaN and
     * infinities are treated as malformed.
     * </p>
     *
     * @param reading which reading
     * @return the value, or empty if absent or malformed
     */
    public Optional<Double> getNumeric(Reading reading) {
        Object raw = values.get(reading.key());
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    @Override
    public String toString() {
        return "RawReadings" + values;
    }
}
