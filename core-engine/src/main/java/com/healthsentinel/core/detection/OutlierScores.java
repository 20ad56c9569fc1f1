package com.healthsentinel.core.detection;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-observation output of an {@link OutlierModel}.
 *
 * <p>
 * Labels follow the contamination rule: an observation is anomalous when its
 * raw score is strictly above the {@code (1 − contamination)} percentile of
 * all raw scores in the window (linear interpolation). Ties at the threshold
 * are therefore never labelled.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutlierScores {

    private final double[] scores;
    private final boolean[] anomalous;

    private OutlierScores(double[] scores, boolean[] anomalous) {
        this.scores = scores;
        this.anomalous = anomalous;
    }

    /**
     * Label raw scores under a contamination assumption and attach the
     * normalized scores that are reported.
     *
     * @param rawScores        model-native scores, higher is more abnormal
     * @param normalizedScores same scores mapped into {@code [0, 1]}
     * @param contamination    expected outlier fraction in {@code (0, 0.5]}
     * @return labelled scores
     */
    static OutlierScores label(double[] rawScores, double[] normalizedScores, double contamination) {
        Objects.requireNonNull(rawScores, "rawScores must not be null");
        if (rawScores.length != normalizedScores.length) {
            throw new IllegalArgumentException("Raw and normalized score lengths differ");
        }
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(rawScores, 100.0 * (1.0 - contamination));

        boolean[] anomalous = new boolean[rawScores.length];
        for (int i = 0; i < rawScores.length; i++) {
            anomalous[i] = rawScores[i] > threshold;
        }
        return new OutlierScores(normalizedScores.clone(), anomalous);
    }

    /**
     * Min–max scale scores into {@code [0, 1]}. A constant input maps to all
     * zeros.
     *
     * @param raw raw scores
     * @return scaled copy
     */
    static double[] minMaxScale(double[] raw) {
        double min = Arrays.stream(raw).min().orElse(0);
        double max = Arrays.stream(raw).max().orElse(0);
        double range = max - min;
        double[] scaled = new double[raw.length];
        if (range > 0) {
            for (int i = 0; i < raw.length; i++) {
                scaled[i] = (raw[i] - min) / range;
            }
        }
        return scaled;
    }

    public int size() {
        return scores.length;
    }

    public double score(int index) {
        return scores[index];
    }

    public boolean isAnomalous(int index) {
        return anomalous[index];
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean a : anomalous) {
            if (a) {
                count++;
            }
        }
        return count;
    }
}
