/**
 * Metric source contract and the collector that normalizes raw readings into
 * {@link com.healthsentinel.core.model.MetricRecord}s.
 *
 * <p>
 * New monitoring backends are added by implementing
 * {@link com.healthsentinel.core.collect.MetricSource}; the collector never
 * changes.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.collect;
