package com.healthsentinel.core.detection;

import com.healthsentinel.core.model.AnomalyRecord;
import com.healthsentinel.core.model.DetectionSettings;
import com.healthsentinel.core.model.MetricRecord;
import com.healthsentinel.core.model.Severity;
import com.healthsentinel.core.store.TimeOrder;
import com.healthsentinel.core.store.TimeSeriesStore;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects anomalous behaviour of an entity over a sliding window of its
 * stored metric records.
 *
 * <h3>Cycle</h3>
 * <ol>
 * <li>Load the lookback window, newest first.</li>
 * <li>Stop with no result when fewer than {@code minSamples} records
 * exist.</li>
 * <li>Fit the configured {@link OutlierModel} on the whole window.</li>
 * <li>For each of the {@code recentCount} newest observations labelled
 * anomalous, classify severity from its score and attribute the features
 * that lie more than {@code deviationFactor} standard deviations from the
 * window mean.</li>
 * <li>Append every anomaly to the store.</li>
 * </ol>
 *
 * <h3>State</h3>
 * <p>
 * This detector is <strong>stateless</strong>: the model is refit on every
 * call and nothing is cached between calls. Severity comes from the model
 * score while attribution comes from per-feature z-scores, so an anomaly may
 * list no affected metric at all.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowedAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(WindowedAnomalyDetector.class);

    static final double RELATIVE_TOLERANCE = 1e-9;

    private final TimeSeriesStore store;
    private final OutlierModel model;
    private final DetectionSettings settings;
    private final Clock clock;

    /**
     * @param store    store holding the metric history
     * @param settings validated detection settings
     * @param clock    clock used for the window bound and creation time
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if the model named by the settings is
     *                                  unknown
     */
    public WindowedAnomalyDetector(TimeSeriesStore store, DetectionSettings settings, Clock clock) {
        this(store, OutlierModelFactory.create(settings), settings, clock);
    }

    WindowedAnomalyDetector(TimeSeriesStore store, OutlierModel model, DetectionSettings settings,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "TimeSeriesStore must not be null");
        this.model = Objects.requireNonNull(model, "OutlierModel must not be null");
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Run one detection cycle for {@code entity}.
     *
     * @param entity entity name
     * @return the anomalies found and stored, newest observation first; empty
     *         when the window is too small or nothing is anomalous
     * @throws com.healthsentinel.core.store.StoreException if the window cannot
     *                                                      be loaded or an
     *                                                      anomaly cannot be
     *                                                      stored
     */
    public List<AnomalyRecord> detect(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");

        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofHours(settings.getLookbackHours()));
        List<MetricRecord> window = store.queryMetrics(entity, since, TimeOrder.NEWEST_FIRST);

        if (window.size() < settings.getMinSamples()) {
            LOG.debug("[{}]: {} record(s) in window, need {} – skipping detection",
                    entity, window.size(), settings.getMinSamples());
            return List.of();
        }

        double[][] observations = DetectionFeature.matrix(window);
        OutlierScores scores = model.fit(observations);
        double[] means = columnMeans(observations);
        double[] stdDevs = columnStdDevs(observations);

        List<AnomalyRecord> anomalies = new ArrayList<>();
        int recent = Math.min(settings.getRecentCount(), window.size());
        for (int i = 0; i < recent; i++) {
            if (!scores.isAnomalous(i)) {
                continue;
            }
            double score = scores.score(i);
            Severity severity = Severity.fromScore(score);
            List<String> affected = affectedMetrics(observations[i], means, stdDevs);

            AnomalyRecord anomaly = AnomalyRecord.builder()
                    .entity(entity)
                    .timestamp(window.get(i).getTimestamp())
                    .severity(severity)
                    .score(score)
                    .affectedMetrics(affected)
                    .description(describe(severity, affected))
                    .createdAt(now)
                    .build();

            LOG.debug("[{}] anomaly at {}: model={} score={} severity={} affected={}",
                    entity, anomaly.getTimestamp(), model.getName(), score, severity, affected);
            anomalies.add(store.appendAnomaly(anomaly));
        }

        if (!anomalies.isEmpty()) {
            LOG.info("[{}]: {} anomal{} detected over {} record(s)", entity, anomalies.size(),
                    anomalies.size() == 1 ? "y" : "ies", window.size());
        }
        return List.copyOf(anomalies);
    }

    // ---------------------------------------------------------------
    // Attribution
    // ---------------------------------------------------------------

    List<String> affectedMetrics(double[] observation, double[] means, double[] stdDevs) {
        DetectionFeature[] features = DetectionFeature.values();
        List<String> affected = new ArrayList<>();
        for (int j = 0; j < features.length; j++) {
            double excess = Math.abs(observation[j] - means[j]) - settings.getDeviationFactor() * stdDevs[j];
            // rounding noise on a constant column must not count as a deviation
            double tolerance = RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(means[j]));
            if (excess > tolerance) {
                affected.add(features[j].metricName());
            }
        }
        return affected;
    }

    static String describe(Severity severity, List<String> affected) {
        if (affected.isEmpty()) {
            return severity.displayName() + " anomaly detected in service behavior";
        }
        return severity.displayName() + " anomaly: unusual patterns in " + String.join(", ", affected);
    }

    private static double[] columnMeans(double[][] observations) {
        int d = observations[0].length;
        double[] means = new double[d];
        for (int j = 0; j < d; j++) {
            means[j] = new Mean().evaluate(column(observations, j));
        }
        return means;
    }

    private static double[] columnStdDevs(double[][] observations) {
        int d = observations[0].length;
        double[] stdDevs = new double[d];
        for (int j = 0; j < d; j++) {
            // population standard deviation over the whole window
            stdDevs[j] = new StandardDeviation(false).evaluate(column(observations, j));
        }
        return stdDevs;
    }

    private static double[] column(double[][] observations, int j) {
        double[] column = new double[observations.length];
        for (int i = 0; i < observations.length; i++) {
            column[i] = observations[i][j];
        }
        return column;
    }
}
