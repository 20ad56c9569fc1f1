package com.healthsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RandomCutForestModel}.
 */
class RandomCutForestModelTest {

    @Test
    @DisplayName("Should give the isolated point the top score and label it")
    void shouldScoreIsolatedPointHighest() {
        double[][] data = cluster(50);
        data[10] = new double[] {100.0, 100.0};

        OutlierScores scores = new RandomCutForestModel(0.1, 42).fit(data);

        assertThat(scores.isAnomalous(10)).isTrue();
        assertThat(scores.score(10)).isEqualTo(1.0);
        for (int i = 0; i < scores.size(); i++) {
            assertThat(scores.score(i)).isBetween(0.0, 1.0);
            if (i != 10) {
                assertThat(scores.score(i)).isLessThan(scores.score(10));
            }
        }
    }

    @Test
    @DisplayName("Should produce identical scores for the same seed")
    void shouldBeDeterministic() {
        double[][] data = cluster(40);
        data[0] = new double[] {-50.0, 30.0};

        OutlierScores first = new RandomCutForestModel(0.1, 42).fit(data);
        OutlierScores second = new RandomCutForestModel(0.1, 42).fit(data);

        for (int i = 0; i < data.length; i++) {
            assertThat(second.score(i)).isEqualTo(first.score(i));
            assertThat(second.isAnomalous(i)).isEqualTo(first.isAnomalous(i));
        }
    }

    @Test
    @DisplayName("Should label nothing in a constant window")
    void shouldLabelNothingWhenConstant() {
        double[][] data = new double[12][3];

        OutlierScores scores = new RandomCutForestModel(0.1, 42).fit(data);

        assertThat(scores.anomalyCount()).isZero();
    }

    @Test
    @DisplayName("Should standardize each feature and zero constant ones")
    void shouldStandardizeFeatures() {
        double[][] points = RandomCutForestModel.standardize(new double[][] {
                {1.0, 5.0e8}, {3.0, 5.0e8}});

        assertThat(points[0][0]).isCloseTo(-1.0, within(1e-12));
        assertThat(points[1][0]).isCloseTo(1.0, within(1e-12));
        assertThat(points[0][1]).isZero();
        assertThat(points[1][1]).isZero();
    }

    @Test
    @DisplayName("Should reject contamination outside (0, 0.5]")
    void shouldRejectBadContamination() {
        assertThatThrownBy(() -> new RandomCutForestModel(0.6, 42))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[][] cluster(int n) {
        double[][] data = new double[n][2];
        for (int i = 0; i < n; i++) {
            data[i][0] = (i % 7) * 0.1;
            data[i][1] = (i % 5) * 0.1;
        }
        return data;
    }
}
