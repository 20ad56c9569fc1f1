package com.healthsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tuning of the windowed anomaly detector, loaded from the {@code detection}
 * section of the monitor configuration.
 *
 * <p>
 * Supported models:
 * </p>
 * <ul>
 * <li>{@code ecod} — empirical-CDF outlier detection (default)</li>
 * <li>{@code rcf} — random cut forest</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Model names accepted by {@link #setModel(String)}. */
    public static final Set<String> SUPPORTED_MODELS = Set.of("ecod", "rcf");

    /** Outlier model name. */
    private String model = "ecod";

    /** How far back the detection window reaches. */
    private int lookbackHours = 24;

    /** Below this many records in the window nothing is detected. */
    private int minSamples = 10;

    /** Number of newest observations that may be reported. */
    private int recentCount = 5;

    /** Expected fraction of outliers in a window. */
    private double contamination = 0.1;

    /** Standard deviations a feature must move to count as affected. */
    private double deviationFactor = 2.0;

    /** Seed for randomized models. */
    private long randomSeed = 42L;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (model == null || !SUPPORTED_MODELS.contains(model)) {
            errors.add("Unknown detection model: '" + model + "'. Supported: " + SUPPORTED_MODELS);
        }
        if (lookbackHours <= 0) {
            errors.add("'lookbackHours' must be > 0, got: " + lookbackHours);
        }
        if (minSamples < 2) {
            errors.add("'minSamples' must be >= 2, got: " + minSamples);
        }
        if (recentCount < 1) {
            errors.add("'recentCount' must be >= 1, got: " + recentCount);
        }
        if (contamination <= 0 || contamination > 0.5) {
            errors.add("'contamination' must be in (0, 0.5], got: " + contamination);
        }
        if (deviationFactor <= 0) {
            errors.add("'deviationFactor' must be > 0, got: " + deviationFactor);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionSettings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getModel() {
        return model;
    }

    /**
     * Set the model name, normalised to lowercase.
     *
     * @param model model name
     */
    public void setModel(String model) {
        this.model = model != null ? model.toLowerCase(Locale.ROOT) : null;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getRecentCount() {
        return recentCount;
    }

    public void setRecentCount(int recentCount) {
        this.recentCount = recentCount;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "model='" + model + '\'' +
                ", lookbackHours=" + lookbackHours +
                ", minSamples=" + minSamples +
                ", recentCount=" + recentCount +
                ", contamination=" + contamination +
                ", deviationFactor=" + deviationFactor +
                ", randomSeed=" + randomSeed +
                '}';
    }
}
