/**
 * Domain model classes for Health Sentinel.
 *
 * <ul>
 * <li>{@link com.healthsentinel.core.model.MetricRecord} — canonical
 * nine-reading snapshot of one entity</li>
 * <li>{@link com.healthsentinel.core.model.AnomalyRecord} — anomaly emitted
 * by the windowed detector</li>
 * <li>{@link com.healthsentinel.core.model.Entity} — registered service,
 * container or pod</li>
 * <li>{@link com.healthsentinel.core.model.HealthReport} — latest snapshot
 * with its health score</li>
 * <li>{@link com.healthsentinel.core.model.DetectionSettings} — YAML-backed
 * tuning of the anomaly detector</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.model;
