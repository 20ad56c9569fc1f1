package com.healthsentinel.core.collect;

import java.util.Locale;

/**
 * The nine raw readings every metric source is asked for.
 *
 * <p>
 * {@link #key()} is the name used in {@link RawReadings} and in the
 * configuration of source-specific queries.
 * </p>
 *
 * @since 1.0.0
 */
public enum Reading {

    REQUEST_RATE,
    ERROR_RATE,
    LATENCY_P50,
    LATENCY_P95,
    LATENCY_P99,
    CPU_USAGE,
    MEMORY_USAGE,
    RESTART_COUNT,
    INSTANCE_COUNT;

    /**
     * @return snake_case key, e.g. {@code "latency_p95"}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
