package com.healthsentinel.core.store;

import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.MetricRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TimeSeriesStore} kept entirely in memory.
 *
 * <p>
 * Metrics live in one skip-list per entity keyed by timestamp, which gives
 * replace-on-conflict and ordered range scans without external locking.
 * Contents are lost on restart.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private final Map<String, ConcurrentNavigableMap<Instant, MetricRecord>> metrics =
            new ConcurrentHashMap<>();
    private final List<AnomalyRecord> anomalies = new CopyOnWriteArrayList<>();
    private final AtomicLong nextAnomalyId = new AtomicLong(1);

    @Override
    public void upsertMetric(MetricRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        metrics.computeIfAbsent(record.getEntity(), e -> new ConcurrentSkipListMap<>())
                .put(record.getTimestamp(), record);
    }

    @Override
    public List<MetricRecord> queryMetrics(String entity, Instant since, TimeOrder order) {
        ConcurrentNavigableMap<Instant, MetricRecord> series = metrics.get(entity);
        if (series == null) {
            return List.of();
        }
        NavigableMap<Instant, MetricRecord> range = series.tailMap(since, false);
        if (order == TimeOrder.NEWEST_FIRST) {
            range = range.descendingMap();
        }
        return List.copyOf(range.values());
    }

    @Override
    public Optional<MetricRecord> latestMetric(String entity) {
        ConcurrentNavigableMap<Instant, MetricRecord> series = metrics.get(entity);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, MetricRecord> last = series.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<MetricRecord> latestMetricAll() {
        List<MetricRecord> latest = new ArrayList<>();
        for (String entity : metrics.keySet()) {
            latestMetric(entity).ifPresent(latest::add);
        }
        latest.sort(Comparator.comparing(MetricRecord::getEntity));
        return latest;
    }

    @Override
    public AnomalyRecord appendAnomaly(AnomalyRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        AnomalyRecord stored = record.withId(nextAnomalyId.getAndIncrement());
        anomalies.add(stored);
        return stored;
    }

    @Override
    public List<AnomalyRecord> queryAnomalies(String entity, Instant since) {
        return anomalies.stream()
                .filter(a -> entity == null || a.getEntity().equals(entity))
                .filter(a -> a.getTimestamp().isAfter(since))
                .sorted(Comparator.comparing(AnomalyRecord::getTimestamp)
                        .thenComparing(AnomalyRecord::getId)
                        .reversed())
                .toList();
    }
}
