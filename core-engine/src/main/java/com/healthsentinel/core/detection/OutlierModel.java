package com.healthsentinel.core.detection;

/**
 * Contract for unsupervised outlier models.
 *
 * <p>
 * A model is fitted from scratch on every call to {@link #fit(double[][])};
 * implementations keep no state between calls, so a single instance may be
 * shared by concurrent detection cycles.
 * </p>
 *
 * <p>
 * Scores must increase with abnormality and lie in {@code [0, 1]} so that
 * severity thresholds mean the same thing for every model.
 * </p>
 */
public interface OutlierModel {

    /**
     * Fit the model on a window and score every observation in it.
     *
     * @param observations one row per observation, one column per feature;
     *                     at least two rows
     * @return per-row normalized scores and anomaly labels
     */
    OutlierScores fit(double[][] observations);

    /**
     * @return short model name, e.g. {@code "ecod"}
     */
    String getName();
}
