package com.healthsentinel.core.detection;

import com.healthsentinel.core.model.DetectionSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OutlierModelFactory}.
 */
class OutlierModelFactoryTest {

    @Test
    @DisplayName("Should create ECOD by default")
    void shouldCreateEcodByDefault() {
        OutlierModel model = OutlierModelFactory.create(new DetectionSettings());

        assertThat(model).isInstanceOf(EcodModel.class);
        assertThat(model.getName()).isEqualTo("ecod");
    }

    @Test
    @DisplayName("Should create random cut forest regardless of case")
    void shouldCreateRandomCutForest() {
        DetectionSettings settings = new DetectionSettings();
        settings.setModel("RCF");

        assertThat(OutlierModelFactory.create(settings)).isInstanceOf(RandomCutForestModel.class);
    }

    @Test
    @DisplayName("Should throw for unknown model name")
    void shouldThrowForUnknownModel() {
        DetectionSettings settings = new DetectionSettings();
        settings.setModel("lof");

        assertThatThrownBy(() -> OutlierModelFactory.create(settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown outlier model");
    }
}
