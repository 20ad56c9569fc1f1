/**
 * Runnable monitor service for Health Sentinel.
 *
 * <p>
 * This package wires the core engine to Prometheus and a relational store
 * and runs collection and detection on a fixed schedule.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.healthsentinel.service.HealthSentinelService} — main entry
 * point</li>
 * <li>{@link com.healthsentinel.service.CollectionScheduler} — periodic
 * collect and detect</li>
 * <li>{@link com.healthsentinel.service.JdbcStorage} — relational store and
 * registry</li>
 * <li>{@link com.healthsentinel.service.PrometheusMetricSource} — Prometheus
 * HTTP API client</li>
 * <li>{@link com.healthsentinel.service.ServiceConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.healthsentinel.service.HealthServer} — HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.healthsentinel.service;
