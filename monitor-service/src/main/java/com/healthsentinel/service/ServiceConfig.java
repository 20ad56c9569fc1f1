package com.healthsentinel.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable runtime configuration of the monitor service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. Detection tuning lives in the YAML monitor configuration,
 * not here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;

    // ---------------------------------------------------------------
    // Collection
    // ---------------------------------------------------------------
    private final long collectionIntervalSeconds;
    private final String monitorConfigPath;

    // ---------------------------------------------------------------
    // Prometheus source
    // ---------------------------------------------------------------
    private final String prometheusUrl;
    private final long prometheusTimeoutSeconds;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;
    private final long metricsReportIntervalSeconds;

    private ServiceConfig(Builder b) {
        this.jdbcUrl = b.jdbcUrl;
        this.jdbcUser = b.jdbcUser;
        this.jdbcPassword = b.jdbcPassword;
        this.collectionIntervalSeconds = b.collectionIntervalSeconds;
        this.monitorConfigPath = b.monitorConfigPath;
        this.prometheusUrl = b.prometheusUrl;
        this.prometheusTimeoutSeconds = b.prometheusTimeoutSeconds;
        this.healthPort = b.healthPort;
        this.metricsReportIntervalSeconds = b.metricsReportIntervalSeconds;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .jdbcUrl(env("JDBC_URL", ""))
                    .jdbcUser(env("JDBC_USER", "sa"))
                    .jdbcPassword(env("JDBC_PASSWORD", ""))
                    .collectionIntervalSeconds(parseLongEnv("COLLECTION_INTERVAL_SECONDS", "60"))
                    .monitorConfigPath(env("MONITOR_CONFIG_PATH", ""))
                    .prometheusUrl(env("PROMETHEUS_URL", "http://localhost:9090"))
                    .prometheusTimeoutSeconds(parseLongEnv("PROMETHEUS_TIMEOUT_SECONDS", "5"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .metricsReportIntervalSeconds(parseLongEnv("METRICS_REPORT_INTERVAL_SECONDS", "300"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return JDBC URL, or an empty string for in-memory storage
     */
    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public boolean usesJdbc() {
        return !jdbcUrl.isBlank();
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public Duration getCollectionInterval() {
        return Duration.ofSeconds(collectionIntervalSeconds);
    }

    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    public String getPrometheusUrl() {
        return prometheusUrl;
    }

    public Duration getPrometheusTimeout() {
        return Duration.ofSeconds(prometheusTimeoutSeconds);
    }

    public int getHealthPort() {
        return healthPort;
    }

    public Duration getMetricsReportInterval() {
        return Duration.ofSeconds(metricsReportIntervalSeconds);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (intervals and timeouts &gt; 0, port in [1, 65535], non-blank
     * Prometheus URL).
     * </p>
     */
    public static class Builder {
        private String jdbcUrl = "";
        private String jdbcUser = "sa";
        private String jdbcPassword = "";
        private long collectionIntervalSeconds = 60;
        private String monitorConfigPath = "";
        private String prometheusUrl = "http://localhost:9090";
        private long prometheusTimeoutSeconds = 5;
        private int healthPort = 8080;
        private long metricsReportIntervalSeconds = 300;

        public Builder jdbcUrl(String v) {
            this.jdbcUrl = v;
            return this;
        }

        public Builder jdbcUser(String v) {
            this.jdbcUser = v;
            return this;
        }

        public Builder jdbcPassword(String v) {
            this.jdbcPassword = v;
            return this;
        }

        public Builder collectionIntervalSeconds(long v) {
            this.collectionIntervalSeconds = v;
            return this;
        }

        public Builder monitorConfigPath(String v) {
            this.monitorConfigPath = v;
            return this;
        }

        public Builder prometheusUrl(String v) {
            this.prometheusUrl = v;
            return this;
        }

        public Builder prometheusTimeoutSeconds(long v) {
            this.prometheusTimeoutSeconds = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder metricsReportIntervalSeconds(long v) {
            this.metricsReportIntervalSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(jdbcUrl, "jdbcUrl required (empty for in-memory)");
            Objects.requireNonNull(monitorConfigPath, "monitorConfigPath required (empty for default)");
            requireNonBlank(prometheusUrl, "prometheusUrl");

            if (collectionIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "collectionIntervalSeconds must be >= 1, got: " + collectionIntervalSeconds);
            }
            if (prometheusTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "prometheusTimeoutSeconds must be >= 1, got: " + prometheusTimeoutSeconds);
            }
            if (metricsReportIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "metricsReportIntervalSeconds must be >= 1, got: " + metricsReportIntervalSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "storage=" + (usesJdbc() ? jdbcUrl : "in-memory") +
                ", collectionIntervalSeconds=" + collectionIntervalSeconds +
                ", monitorConfigPath='" + monitorConfigPath + '\'' +
                ", prometheusUrl='" + prometheusUrl + '\'' +
                ", prometheusTimeoutSeconds=" + prometheusTimeoutSeconds +
                ", healthPort=" + healthPort +
                '}';
    }
}
