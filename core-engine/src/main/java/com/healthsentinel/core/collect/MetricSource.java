package com.healthsentinel.core.collect;

/**
 * Capability of a monitoring backend to report raw readings for a named
 * entity.
 *
 * <p>
 * One implementation exists per backend. Implementations should leave a
 * reading out rather than fail when that single reading cannot be obtained;
 * the collector treats anything missing as zero.
 * </p>
 */
@FunctionalInterface
public interface MetricSource {

    /**
     * Read the current values for {@code entity}.
     *
     * @param entity entity name
     * @return readings keyed by {@link Reading#key()}; never {@code null}
     */
    RawReadings read(String entity);
}
