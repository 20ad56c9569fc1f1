package com.healthsentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should use in-memory storage and documented defaults")
    void shouldApplyDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.usesJdbc()).isFalse();
        assertThat(config.getCollectionInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getPrometheusUrl()).isEqualTo("http://localhost:9090");
        assertThat(config.getPrometheusTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.toString()).contains("storage=in-memory");
    }

    @Test
    @DisplayName("Should switch to JDBC storage when a URL is given")
    void shouldUseJdbcWhenUrlGiven() {
        ServiceConfig config = new ServiceConfig.Builder().jdbcUrl("jdbc:h2:mem:test").build();

        assertThat(config.usesJdbc()).isTrue();
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().collectionIntervalSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("collectionIntervalSeconds");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().prometheusUrl(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prometheusUrl");
        assertThatThrownBy(() -> new ServiceConfig.Builder().prometheusTimeoutSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
