package com.healthsentinel.core.collect;

import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.store.EntityRegistry;
import com.healthsentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Turns the raw readings of a {@link MetricSource} into a canonical
 * {@link MetricRecord} and writes it to the store.
 *
 * <h3>Partial data</h3>
 * <p>
 * Each of the nine readings is extracted independently. A reading that is
 * missing, malformed or non-finite becomes {@code 0.0}; a source call that
 * throws is logged and yields a record of zeros. Only a failing store write
 * propagates to the caller.
 * </p>
 *
 * <p>
 * The collector is stateless between calls and safe to share across threads
 * as long as the source, store and registry are.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsCollector {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsCollector.class);

    private final MetricSource source;
    private final TimeSeriesStore store;
    private final EntityRegistry registry;
    private final Clock clock;

    /**
     * @param source   where readings come from
     * @param store    where records are written
     * @param registry registry whose {@code last_seen} is updated on store
     * @param clock    clock used to stamp records
     * @throws NullPointerException if any argument is {@code null}
     */
    public MetricsCollector(MetricSource source, TimeSeriesStore store, EntityRegistry registry, Clock clock) {
        this.source = Objects.requireNonNull(source, "MetricSource must not be null");
        this.store = Objects.requireNonNull(store, "TimeSeriesStore must not be null");
        this.registry = Objects.requireNonNull(registry, "EntityRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Read the source and build a record stamped with the current instant.
     *
     * @param entity entity name
     * @return the normalized record; never {@code null}
     */
    public MetricRecord collect(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");

        RawReadings readings;
        try {
            readings = source.read(entity);
        } catch (RuntimeException e) {
            LOG.warn("Metric source failed for [{}], recording zeros: {}", entity, e.getMessage());
            readings = null;
        }
        if (readings == null) {
            readings = RawReadings.empty();
        }

        MetricRecord record = MetricRecord.builder()
                .entity(entity)
                .timestamp(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .requestRate(value(readings, Reading.REQUEST_RATE))
                .errorRate(value(readings, Reading.ERROR_RATE))
                .latencyP50(value(readings, Reading.LATENCY_P50))
                .latencyP95(value(readings, Reading.LATENCY_P95))
                .latencyP99(value(readings, Reading.LATENCY_P99))
                .cpuUsage(value(readings, Reading.CPU_USAGE))
                .memoryUsage(value(readings, Reading.MEMORY_USAGE))
                .restartCount(count(readings, Reading.RESTART_COUNT))
                .instanceCount(count(readings, Reading.INSTANCE_COUNT))
                .build();

        LOG.debug("Collected {}", record);
        return record;
    }

    /**
     * Write a record and mark its entity as seen.
     *
     * @param record record produced by {@link #collect(String)}
     * @throws com.healthsentinel.core.store.StoreException if persistence fails
     */
    public void store(MetricRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        store.upsertMetric(record);
        registry.touch(record.getEntity(), record.getTimestamp());
    }

    /**
     * Convenience for {@link #collect(String)} followed by
     * {@link #store(MetricRecord)}.
     *
     * @param entity entity name
     * @return the stored record
     */
    public MetricRecord collectAndStore(String entity) {
        MetricRecord record = collect(entity);
        store(record);
        return record;
    }

    private static double value(RawReadings readings, Reading reading) {
        return readings.getNumeric(reading).orElseGet(() -> {
            LOG.trace("Reading '{}' absent or malformed – defaulting to 0.0", reading.key());
            return 0.0;
        });
    }

    // counts are >= 0; the int cast saturates large values at Integer.MAX_VALUE
    static int count(RawReadings readings, Reading reading) {
        double v = value(readings, reading);
        if (v < 0) {
            LOG.trace("Reading '{}' negative ({}) – clamping to 0", reading.key(), v);
            return 0;
        }
        return (int) v;
    }
}
