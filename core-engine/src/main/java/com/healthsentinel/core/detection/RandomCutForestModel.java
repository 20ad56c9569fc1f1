package com.healthsentinel.core.detection;

import com.amazon.randomcutforest.RandomCutForest;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Random cut forest outlier model.
 *
 * <p>
 * Every call builds a fresh, seeded {@link RandomCutForest} of
 * {@value #TREES} trees, feeds it the whole window oldest first and then asks
 * it for the anomaly score of each observation. Points that are isolated by
 * few cuts score high.
 * </p>
 *
 * <p>
 * Cuts are chosen in proportion to each dimension's range, so features are
 * standardized first (constant features become all zeros); otherwise memory
 * in bytes would swallow every cut.
 * </p>
 *
 * <h3>Score scale</h3>
 * <p>
 * Forest scores are unbounded. As with {@link EcodModel}, reported scores are
 * min–max scaled over the window and labels use the forest scores.
 * </p>
 *
 * @since 1.0.0
 */
public class RandomCutForestModel implements OutlierModel {

    static final String NAME = "rcf";

    static final int TREES = 100;
    static final int SAMPLE_SIZE = 256;

    private final double contamination;
    private final long seed;

    /**
     * @param contamination expected outlier fraction in {@code (0, 0.5]}
     * @param seed          forest random seed
     * @throws IllegalArgumentException if contamination is out of range
     */
    public RandomCutForestModel(double contamination, long seed) {
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException(
                    "contamination must be in (0, 0.5], got: " + contamination);
        }
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public OutlierScores fit(double[][] observations) {
        int n = observations.length;
        if (n < 2) {
            throw new IllegalArgumentException(
                    "Random cut forest needs at least 2 observations, got: " + n);
        }
        double[][] points = standardize(observations);

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(points[0].length)
                .numberOfTrees(TREES)
                .sampleSize(SAMPLE_SIZE)
                .outputAfter(1)
                .randomSeed(seed)
                .build();

        // rows are newest first
        for (int i = n - 1; i >= 0; i--) {
            forest.update(points[i]);
        }

        double[] raw = new double[n];
        for (int i = 0; i < n; i++) {
            raw[i] = forest.getAnomalyScore(points[i]);
        }
        return OutlierScores.label(raw, OutlierScores.minMaxScale(raw), contamination);
    }

    @Override
    public String getName() {
        return NAME;
    }

    static double[][] standardize(double[][] observations) {
        int n = observations.length;
        int d = observations[0].length;
        double[][] points = new double[n][d];
        for (int j = 0; j < d; j++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = observations[i][j];
            }
            double mean = new Mean().evaluate(column);
            double std = new StandardDeviation(false).evaluate(column);
            for (int i = 0; i < n; i++) {
                points[i][j] = std > 0 ? (column[i] - mean) / std : 0.0;
            }
        }
        return points;
    }
}
