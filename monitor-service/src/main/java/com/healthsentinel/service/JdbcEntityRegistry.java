package com.healthsentinel.service;

import com.healthsentinel.core.model.Entity;
import com.healthsentinel.core.model.EntityStatus;
import com.healthsentinel.core.store.EntityRegistry;
import com.healthsentinel.core.store.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.healthsentinel.service.JdbcTimeSeriesStore.utc;

/**
 * {@link EntityRegistry} over the {@code services} table.
 */
public class JdbcEntityRegistry implements EntityRegistry {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcEntityRegistry(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "NamedParameterJdbcTemplate must not be null");
    }

    @Override
    public Set<String> listActiveEntities() {
        try {
            return new LinkedHashSet<>(jdbc.queryForList(
                    "SELECT service_name FROM services WHERE status = :status ORDER BY service_name",
                    new MapSqlParameterSource("status", EntityStatus.ACTIVE.label()),
                    String.class));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list active entities", e);
        }
    }

    @Override
    public List<Entity> listEntities() {
        try {
            return jdbc.query(
                    "SELECT service_name, service_type, status, created_at, last_seen FROM services "
                            + "ORDER BY service_name",
                    new MapSqlParameterSource(),
                    (rs, rowNum) -> {
                        OffsetDateTime lastSeen = rs.getObject("last_seen", OffsetDateTime.class);
                        return new Entity(
                                rs.getString("service_name"),
                                rs.getString("service_type"),
                                EntityStatus.fromLabel(rs.getString("status")),
                                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                                lastSeen == null ? null : lastSeen.toInstant());
                    });
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list entities", e);
        }
    }

    @Override
    public boolean register(String name, String type, Instant now) {
        Objects.requireNonNull(name, "name must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("type", type == null || type.isBlank() ? Entity.UNKNOWN_TYPE : type)
                .addValue("status", EntityStatus.ACTIVE.label())
                .addValue("now", utc(now), Types.TIMESTAMP_WITH_TIMEZONE);
        try {
            jdbc.update("INSERT INTO services (service_name, service_type, status, created_at) "
                    + "VALUES (:name, :type, :status, :now)", params);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to register entity " + name, e);
        }
    }

    @Override
    public void touch(String name, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("now", utc(now), Types.TIMESTAMP_WITH_TIMEZONE);
        try {
            jdbc.update("UPDATE services SET last_seen = :now WHERE service_name = :name", params);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to update last_seen of " + name, e);
        }
    }

    @Override
    public boolean setStatus(String name, EntityStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("status", status.label());
        try {
            return jdbc.update("UPDATE services SET status = :status WHERE service_name = :name", params) > 0;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to set status of " + name, e);
        }
    }
}
