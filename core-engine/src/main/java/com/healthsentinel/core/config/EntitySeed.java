package com.healthsentinel.core.config;

import java.io.Serializable;

/**
 * Entity registered at start-up when it is not yet known.
 */
public class EntitySeed implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String type;

    public EntitySeed() {
    }

    public EntitySeed(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return "EntitySeed{name='" + name + "', type='" + type + "'}";
    }
}
