/**
 * Storage contracts for metric records, anomaly records and the entity
 * registry, with in-memory implementations.
 *
 * <p>
 * The JDBC implementations live in the {@code monitor-service} module.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.store;
