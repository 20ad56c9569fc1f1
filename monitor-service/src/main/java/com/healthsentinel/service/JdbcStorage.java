package com.healthsentinel.service;

import com.healthsentinel.core.store.StoreException;
import org.h2.jdbcx.JdbcConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Owns the connection pool of the relational store and creates the
 * {@link JdbcTimeSeriesStore} and {@link JdbcEntityRegistry} on top of it.
 *
 * <p>
 * The schema in {@code schema.sql} is applied on open; every statement is
 * idempotent, so opening an existing database is safe.
 * </p>
 */
public final class JdbcStorage implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcStorage.class);

    static final String SCHEMA_RESOURCE = "schema.sql";

    private final JdbcConnectionPool pool;
    private final JdbcTimeSeriesStore store;
    private final JdbcEntityRegistry registry;

    private JdbcStorage(JdbcConnectionPool pool) {
        this.pool = pool;
        NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(pool);
        this.store = new JdbcTimeSeriesStore(jdbc);
        this.registry = new JdbcEntityRegistry(jdbc);
    }

    /**
     * Open a pool for {@code url} and apply the schema.
     *
     * @throws StoreException if the schema cannot be applied
     */
    public static JdbcStorage open(String url, String user, String password) {
        Objects.requireNonNull(url, "JDBC url must not be null");
        JdbcConnectionPool pool = JdbcConnectionPool.create(url, user, password);
        try {
            applySchema(pool);
        } catch (StoreException e) {
            pool.dispose();
            throw e;
        }
        LOG.info("Opened JDBC storage at {}", url);
        return new JdbcStorage(pool);
    }

    static void applySchema(DataSource dataSource) {
        try {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE)).execute(dataSource);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to apply schema " + SCHEMA_RESOURCE, e);
        }
    }

    public JdbcTimeSeriesStore getStore() {
        return store;
    }

    public JdbcEntityRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        pool.dispose();
        LOG.info("JDBC storage closed");
    }
}
