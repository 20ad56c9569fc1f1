package com.healthsentinel.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a monitored entity. Only {@link #ACTIVE} entities are
 * polled by the scheduler.
 *
 * @since 1.0.0
 */
public enum EntityStatus {

    ACTIVE,
    INACTIVE;

    public static EntityStatus fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
