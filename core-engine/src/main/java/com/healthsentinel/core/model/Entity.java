package com.healthsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A named unit under observation: a service, container or pod.
 *
 * <p>
 * Names are unique across the registry. {@code lastSeen} is {@code null}
 * until metrics have been collected for the entity at least once.
 * </p>
 *
 * @since 1.0.0
 */
public final class Entity implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Type recorded when the registrant does not supply one. */
    public static final String UNKNOWN_TYPE = "unknown";

    private final String name;
    private final String type;
    private final EntityStatus status;
    private final Instant createdAt;
    private final Instant lastSeen;

    public Entity(String name, String type, EntityStatus status, Instant createdAt, Instant lastSeen) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type != null && !type.isBlank() ? type : UNKNOWN_TYPE;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.lastSeen = lastSeen;
    }

    public Entity withStatus(EntityStatus newStatus) {
        return new Entity(name, type, newStatus, createdAt, lastSeen);
    }

    public Entity withLastSeen(Instant seen) {
        return new Entity(name, type, status, createdAt, seen);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public EntityStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == EntityStatus.ACTIVE;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Entity that))
            return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Entity{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", status=" + status +
                ", lastSeen=" + lastSeen +
                '}';
    }
}
