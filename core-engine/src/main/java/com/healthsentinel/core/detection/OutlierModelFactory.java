package com.healthsentinel.core.detection;

import com.healthsentinel.core.model.DetectionSettings;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link OutlierModel} instances from
 * {@link DetectionSettings}.
 *
 * <p>
 * This is the single point of extension when adding new outlier models:
 * register the model name here and in
 * {@link DetectionSettings#SUPPORTED_MODELS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutlierModelFactory {

    private OutlierModelFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the model named by the settings.
     *
     * @param settings detection settings; must not be {@code null}
     * @return a new model
     * @throws NullPointerException     if {@code settings} or its model is
     *                                  {@code null}
     * @throws IllegalArgumentException if the model name is unknown
     */
    public static OutlierModel create(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        Objects.requireNonNull(settings.getModel(), "Model name must not be null");

        String model = settings.getModel().toLowerCase(Locale.ROOT);
        return switch (model) {
            case EcodModel.NAME -> new EcodModel(settings.getContamination());
            case RandomCutForestModel.NAME -> new RandomCutForestModel(
                    settings.getContamination(), settings.getRandomSeed());
            default -> throw new IllegalArgumentException(
                    "Unknown outlier model: '" + settings.getModel()
                            + "'. Supported models: ecod, rcf");
        };
    }
}
