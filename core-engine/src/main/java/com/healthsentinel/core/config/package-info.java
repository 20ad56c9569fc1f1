/**
 * YAML configuration of the monitor: detection settings, source query
 * overrides and entities registered at start-up.
 *
 * <p>
 * {@link com.healthsentinel.core.config.MonitorConfigLoader} parses the file
 * into a {@link com.healthsentinel.core.config.MonitorConfig} and validates
 * it before returning.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.config;
