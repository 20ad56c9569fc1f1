package com.healthsentinel.service;

import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.model.Severity;
import com.healthsentinel.core.store.StoreException;
import com.healthsentinel.core.store.TimeOrder;
import com.healthsentinel.core.store.TimeSeriesStore;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TimeSeriesStore} over the {@code service_metrics} and
 * {@code metrics_anomalies} tables.
 *
 * <p>
 * Metric upserts use H2's {@code MERGE INTO ... KEY (service_name, ts)}.
 * Timestamps are bound as UTC {@link OffsetDateTime}. Affected metric names
 * are stored as one comma-separated column. Every
 * {@link DataAccessException} is rethrown as {@link StoreException}.
 * </p>
 */
public class JdbcTimeSeriesStore implements TimeSeriesStore {

    private static final String METRIC_COLUMNS = "service_name, ts, request_rate, error_rate, "
            + "latency_p50, latency_p95, latency_p99, cpu_usage, memory_usage, restart_count, instance_count";

    private static final String UPSERT_METRIC = "MERGE INTO service_metrics (" + METRIC_COLUMNS + ") "
            + "KEY (service_name, ts) VALUES (:entity, :ts, :request_rate, :error_rate, :latency_p50, "
            + ":latency_p95, :latency_p99, :cpu_usage, :memory_usage, :restart_count, :instance_count)";

    private static final String SELECT_METRICS = "SELECT " + METRIC_COLUMNS
            + " FROM service_metrics WHERE service_name = :entity AND ts > :since ORDER BY ts ";

    private static final String SELECT_LATEST = "SELECT " + METRIC_COLUMNS
            + " FROM service_metrics WHERE service_name = :entity ORDER BY ts DESC LIMIT 1";

    private static final String SELECT_LATEST_ALL = "SELECT m.service_name, m.ts, m.request_rate, "
            + "m.error_rate, m.latency_p50, m.latency_p95, m.latency_p99, m.cpu_usage, m.memory_usage, "
            + "m.restart_count, m.instance_count FROM service_metrics m "
            + "JOIN (SELECT service_name, MAX(ts) AS max_ts FROM service_metrics GROUP BY service_name) l "
            + "ON m.service_name = l.service_name AND m.ts = l.max_ts ORDER BY m.service_name";

    private static final String INSERT_ANOMALY = "INSERT INTO metrics_anomalies (service_name, ts, "
            + "anomaly_type, severity, anomaly_score, affected_metrics, description, created_at) "
            + "VALUES (:entity, :ts, :kind, :severity, :score, :affected, :description, :created_at)";

    private static final String SELECT_ANOMALIES = "SELECT id, service_name, ts, anomaly_type, severity, "
            + "anomaly_score, affected_metrics, description, created_at FROM metrics_anomalies "
            + "WHERE ts > :since ";

    static final String AFFECTED_SEPARATOR = ", ";

    private static final RowMapper<MetricRecord> METRIC_MAPPER = JdbcTimeSeriesStore::mapMetric;
    private static final RowMapper<AnomalyRecord> ANOMALY_MAPPER = JdbcTimeSeriesStore::mapAnomaly;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTimeSeriesStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "NamedParameterJdbcTemplate must not be null");
    }

    @Override
    public void upsertMetric(MetricRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entity", record.getEntity())
                .addValue("ts", utc(record.getTimestamp()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("request_rate", record.getRequestRate())
                .addValue("error_rate", record.getErrorRate())
                .addValue("latency_p50", record.getLatencyP50())
                .addValue("latency_p95", record.getLatencyP95())
                .addValue("latency_p99", record.getLatencyP99())
                .addValue("cpu_usage", record.getCpuUsage())
                .addValue("memory_usage", record.getMemoryUsage())
                .addValue("restart_count", record.getRestartCount())
                .addValue("instance_count", record.getInstanceCount());
        try {
            jdbc.update(UPSERT_METRIC, params);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to upsert metric for " + record.getEntity(), e);
        }
    }

    @Override
    public List<MetricRecord> queryMetrics(String entity, Instant since, TimeOrder order) {
        String sql = SELECT_METRICS + (order == TimeOrder.NEWEST_FIRST ? "DESC" : "ASC");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entity", entity)
                .addValue("since", utc(since), Types.TIMESTAMP_WITH_TIMEZONE);
        try {
            return jdbc.query(sql, params, METRIC_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to query metrics for " + entity, e);
        }
    }

    @Override
    public Optional<MetricRecord> latestMetric(String entity) {
        try {
            return jdbc.query(SELECT_LATEST, new MapSqlParameterSource("entity", entity), METRIC_MAPPER)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read latest metric for " + entity, e);
        }
    }

    @Override
    public List<MetricRecord> latestMetricAll() {
        try {
            return jdbc.query(SELECT_LATEST_ALL, new MapSqlParameterSource(), METRIC_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read latest metrics", e);
        }
    }

    @Override
    public AnomalyRecord appendAnomaly(AnomalyRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entity", record.getEntity())
                .addValue("ts", utc(record.getTimestamp()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("kind", record.getKind())
                .addValue("severity", record.getSeverity().label())
                .addValue("score", record.getScore())
                .addValue("affected", String.join(AFFECTED_SEPARATOR, record.getAffectedMetrics()))
                .addValue("description", record.getDescription() == null ? "" : record.getDescription())
                .addValue("created_at", utc(record.getCreatedAt()), Types.TIMESTAMP_WITH_TIMEZONE);
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbc.update(INSERT_ANOMALY, params, keys, new String[] {"ID"});
        } catch (DataAccessException e) {
            throw new StoreException("Failed to append anomaly for " + record.getEntity(), e);
        }
        Number id = keys.getKey();
        if (id == null) {
            throw new StoreException("No id generated for anomaly of " + record.getEntity());
        }
        return record.withId(id.longValue());
    }

    @Override
    public List<AnomalyRecord> queryAnomalies(String entity, Instant since) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("since", utc(since), Types.TIMESTAMP_WITH_TIMEZONE);
        StringBuilder sql = new StringBuilder(SELECT_ANOMALIES);
        if (entity != null) {
            sql.append("AND service_name = :entity ");
            params.addValue("entity", entity);
        }
        sql.append("ORDER BY ts DESC, id DESC");
        try {
            return jdbc.query(sql.toString(), params, ANOMALY_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to query anomalies", e);
        }
    }

    // ---------------------------------------------------------------
    // Mapping
    // ---------------------------------------------------------------

    static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static MetricRecord mapMetric(ResultSet rs, int rowNum) throws SQLException {
        return MetricRecord.builder()
                .entity(rs.getString("service_name"))
                .timestamp(instant(rs, "ts"))
                .requestRate(rs.getDouble("request_rate"))
                .errorRate(rs.getDouble("error_rate"))
                .latencyP50(rs.getDouble("latency_p50"))
                .latencyP95(rs.getDouble("latency_p95"))
                .latencyP99(rs.getDouble("latency_p99"))
                .cpuUsage(rs.getDouble("cpu_usage"))
                .memoryUsage(rs.getDouble("memory_usage"))
                .restartCount(rs.getInt("restart_count"))
                .instanceCount(rs.getInt("instance_count"))
                .build();
    }

    private static AnomalyRecord mapAnomaly(ResultSet rs, int rowNum) throws SQLException {
        String affected = rs.getString("affected_metrics");
        return AnomalyRecord.builder()
                .id(rs.getLong("id"))
                .entity(rs.getString("service_name"))
                .timestamp(instant(rs, "ts"))
                .kind(rs.getString("anomaly_type"))
                .severity(Severity.fromLabel(rs.getString("severity")))
                .score(rs.getDouble("anomaly_score"))
                .affectedMetrics(affected == null || affected.isEmpty()
                        ? List.of()
                        : Arrays.asList(affected.split(AFFECTED_SEPARATOR)))
                .description(rs.getString("description"))
                .createdAt(instant(rs, "created_at"))
                .build();
    }
}
