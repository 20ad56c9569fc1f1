package com.healthsentinel.core.detection;

import org.apache.commons.math3.stat.descriptive.moment.Skewness;

import java.util.Arrays;

/**
 * Empirical-CDF-based outlier detection (ECOD).
 *
 * <p>
 * For every feature the model estimates how far into the left and right
 * tails of the window's empirical distribution each value lies. Tail
 * probabilities are turned into {@code -log(p)} and the tail that matters is
 * picked by the sign of the feature's skewness:
 * </p>
 * <ul>
 * <li>negative skew: left tail</li>
 * <li>positive skew: right tail</li>
 * <li>no skew: both tails summed</li>
 * </ul>
 * <p>
 * The per-feature contribution is the larger of that value and the mean of
 * both tails; the raw score of an observation is the sum over features.
 * </p>
 *
 * <h3>Score scale</h3>
 * <p>
 * Raw scores are unbounded, so reported scores are min–max scaled over the
 * window. The most abnormal observation of a window scores {@code 1.0}, so
 * when it is labelled it is always {@code critical}, however mild the window
 * is. Scores rank observations within one window and are not comparable
 * across windows.
 * </p>
 *
 * <p>
 * The model is parameter-free apart from the contamination used for
 * labelling and is fully deterministic.
 * </p>
 *
 * @since 1.0.0
 */
public class EcodModel implements OutlierModel {

    static final String NAME = "ecod";

    private final double contamination;

    /**
     * @param contamination expected outlier fraction in {@code (0, 0.5]}
     * @throws IllegalArgumentException if contamination is out of range
     */
    public EcodModel(double contamination) {
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException(
                    "contamination must be in (0, 0.5], got: " + contamination);
        }
        this.contamination = contamination;
    }

    @Override
    public OutlierScores fit(double[][] observations) {
        int n = observations.length;
        if (n < 2) {
            throw new IllegalArgumentException("ECOD needs at least 2 observations, got: " + n);
        }
        int d = observations[0].length;
        double[] raw = new double[n];

        for (int j = 0; j < d; j++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = observations[i][j];
            }
            double[] sorted = column.clone();
            Arrays.sort(sorted);
            double skewSign = skewSign(column);

            for (int i = 0; i < n; i++) {
                double left = countAtMost(sorted, column[i]) / (double) n;
                double right = countAtLeast(sorted, column[i]) / (double) n;
                double tailLeft = -Math.log(left);
                double tailRight = -Math.log(right);

                double skewed;
                if (skewSign < 0) {
                    skewed = tailLeft;
                } else if (skewSign > 0) {
                    skewed = tailRight;
                } else {
                    skewed = tailLeft + tailRight;
                }
                raw[i] += Math.max(skewed, (tailLeft + tailRight) / 2);
            }
        }

        return OutlierScores.label(raw, OutlierScores.minMaxScale(raw), contamination);
    }

    @Override
    public String getName() {
        return NAME;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double skewSign(double[] column) {
        double skew = new Skewness().evaluate(column);
        return Double.isNaN(skew) ? 0 : Math.signum(skew);
    }

    /** Number of sorted values {@code <= value}. */
    static int countAtMost(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** Number of sorted values {@code >= value}. */
    static int countAtLeast(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return sorted.length - lo;
    }
}
