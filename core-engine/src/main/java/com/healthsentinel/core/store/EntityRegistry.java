package com.healthsentinel.core.store;

import com.healthsentinel.core.model.Entity;
import com.healthsentinel.core.model.EntityStatus;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Registry of monitored entities.
 */
public interface EntityRegistry {

    /**
     * @return names of every entity whose status is active
     */
    Set<String> listActiveEntities();

    /**
     * @return every registered entity, ordered by name
     */
    List<Entity> listEntities();

    /**
     * Register a new active entity.
     *
     * @param name entity name
     * @param type free-form entity type, {@code null} for unknown
     * @param now  registration instant
     * @return {@code false} if an entity with that name already exists
     */
    boolean register(String name, String type, Instant now);

    /**
     * Record that metrics were collected for {@code name}. Unknown names are
     * ignored.
     *
     * @param name entity name
     * @param now  collection instant
     */
    void touch(String name, Instant now);

    /**
     * Change the lifecycle status of an entity.
     *
     * @param name   entity name
     * @param status new status
     * @return {@code false} if no such entity exists
     */
    boolean setStatus(String name, EntityStatus status);
}
