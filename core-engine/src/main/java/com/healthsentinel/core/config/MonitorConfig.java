package com.healthsentinel.core.config;

import com.healthsentinel.core.collect.Reading;
import com.healthsentinel.core.model.DetectionSettings;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for the monitor YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * detection:
 *   model: ecod
 *   lookbackHours: 24
 *   minSamples: 10
 * queries:
 *   cpu_usage: 'sum(rate(container_cpu_usage_seconds_total{service="{entity}"}[5m]))'
 * entities:
 *   - name: api-gateway
 *     type: microservice
 * </pre>
 *
 * <p>
 * Every section is optional. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectionSettings detection = new DetectionSettings();
    private Map<String, String> queries = new LinkedHashMap<>();
    private List<EntitySeed> entities = new ArrayList<>();

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    /**
     * Source query overrides keyed by {@link Reading#key()}. The returned map
     * is <strong>unmodifiable</strong>.
     *
     * @return query templates
     */
    public Map<String, String> getQueries() {
        return Collections.unmodifiableMap(queries);
    }

    public void setQueries(Map<String, String> queries) {
        this.queries = queries != null ? new LinkedHashMap<>(queries) : new LinkedHashMap<>();
    }

    /**
     * @return unmodifiable list of entities to register at start-up
     */
    public List<EntitySeed> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public void setEntities(List<EntitySeed> entities) {
        this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>();
    }

    /**
     * Validate every section, collecting all errors into one exception.
     *
     * @throws IllegalStateException if any section is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            detection.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        Set<String> readingKeys = new HashSet<>();
        Arrays.stream(Reading.values()).forEach(r -> readingKeys.add(r.key()));
        for (Map.Entry<String, String> query : queries.entrySet()) {
            if (!readingKeys.contains(query.getKey())) {
                errors.add("Unknown reading in 'queries': '" + query.getKey() + "'");
            } else if (query.getValue() == null || query.getValue().isBlank()) {
                errors.add("Query for '" + query.getKey() + "' must not be blank");
            }
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < entities.size(); i++) {
            EntitySeed seed = entities.get(i);
            if (seed == null || seed.getName() == null || seed.getName().isBlank()) {
                errors.add("Entity at index " + i + " requires 'name'");
            } else if (!names.add(seed.getName())) {
                errors.add("Duplicate entity name: '" + seed.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "detection=" + detection +
                ", queries=" + queries.keySet() +
                ", entities=" + entities +
                '}';
    }
}
