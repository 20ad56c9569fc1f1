/**
 * Windowed anomaly detection.
 *
 * <p>
 * {@link com.healthsentinel.core.detection.WindowedAnomalyDetector} loads an
 * entity's recent history, fits an
 * {@link com.healthsentinel.core.detection.OutlierModel} created by
 * {@link com.healthsentinel.core.detection.OutlierModelFactory}, and stores
 * one anomaly record per recent outlier. Built-in models:
 * </p>
 * <ul>
 * <li>{@link com.healthsentinel.core.detection.EcodModel} — empirical-CDF
 * tail probabilities</li>
 * <li>{@link com.healthsentinel.core.detection.RandomCutForestModel} —
 * seeded random cut forest</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a model, implement {@code OutlierModel} with scores in
 * {@code [0, 1]} and register its name in {@code OutlierModelFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.detection;
