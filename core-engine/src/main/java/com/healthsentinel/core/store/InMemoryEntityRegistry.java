package com.healthsentinel.core.store;

import com.healthsentinel.core.model.Entity;
import com.healthsentinel.core.model.EntityStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * {@link EntityRegistry} backed by a concurrent map.
 *
 * @since 1.0.0
 */
public class InMemoryEntityRegistry implements EntityRegistry {

    private final ConcurrentMap<String, Entity> entities = new ConcurrentHashMap<>();

    @Override
    public Set<String> listActiveEntities() {
        return entities.values().stream()
                .filter(Entity::isActive)
                .map(Entity::getName)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public List<Entity> listEntities() {
        return entities.values().stream()
                .sorted(Comparator.comparing(Entity::getName))
                .toList();
    }

    @Override
    public boolean register(String name, String type, Instant now) {
        Objects.requireNonNull(name, "name must not be null");
        Entity entity = new Entity(name, type, EntityStatus.ACTIVE, now, null);
        return entities.putIfAbsent(name, entity) == null;
    }

    @Override
    public void touch(String name, Instant now) {
        entities.computeIfPresent(name, (n, e) -> e.withLastSeen(now));
    }

    @Override
    public boolean setStatus(String name, EntityStatus status) {
        return entities.computeIfPresent(name, (n, e) -> e.withStatus(status)) != null;
    }
}
