package com.polkadot.analytics.engine.forecast;

import com.polkadot.analytics.engine.features.FeaturePipeline;
import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.model.FeatureTable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HorizonSynthesizerTest {

    private static final Instant ANCHOR = Instant.parse("2024-03-01T00:00:00Z");
    private static final int LAG1 = Arrays.asList(FeatureTable.FEATURE_NAMES).indexOf("lag_1");
    private static final int MEAN7 = Arrays.asList(FeatureTable.FEATURE_NAMES).indexOf("rolling_mean_7");

    private static FeatureScaler identity() {
        double[] mean = new double[FeatureTable.FEATURE_COUNT];
        double[] scale = new double[FeatureTable.FEATURE_COUNT];
        Arrays.fill(scale, 1.0);
        return new FeatureScaler(mean, scale);
    }

    private static double[] history(int n, double value) {
        double[] history = new double[n];
        Arrays.fill(history, value);
        return history;
    }

    @Test
    void synthesize_feedsPredictionsIntoFollowingLags() {
        Regressor nextDay = rows -> Arrays.stream(rows).mapToDouble(row -> row[LAG1] + 1.0).toArray();
        HorizonSynthesizer synthesizer = new HorizonSynthesizer(nextDay, identity());

        HorizonSynthesizer.Synthesis result = synthesizer.synthesize(history(40, 10.0), ANCHOR, 3);

        assertThat(result.values()).containsExactly(11.0, 12.0, 13.0);
        assertThat(result.timestamps()).containsExactly(
                ANCHOR.plus(Duration.ofDays(1)),
                ANCHOR.plus(Duration.ofDays(2)),
                ANCHOR.plus(Duration.ofDays(3)));
        assertThat(result.standardizedRows()).hasNumberOfRows(3);
    }

    @Test
    void synthesize_rollingFeaturesUseEarlierPredictionsOnly() {
        Regressor meanOfWindow = rows -> Arrays.stream(rows).mapToDouble(row -> row[MEAN7]).toArray();
        HorizonSynthesizer synthesizer = new HorizonSynthesizer(meanOfWindow, identity());
        double[] history = new double[FeaturePipeline.MAX_LAG];
        for (int i = 0; i < history.length; i++) {
            history[i] = i + 1;
        }

        HorizonSynthesizer.Synthesis result = synthesizer.synthesize(history, ANCHOR, 2);

        // day 1 averages 24..30; day 2 averages 25..30 and the day 1 prediction
        assertThat(result.values()[0]).isCloseTo(27.0, within(1e-9));
        assertThat(result.values()[1]).isCloseTo(192.0 / 7.0, within(1e-9));
    }

    @Test
    void synthesize_rejectsNonFinitePredictions() {
        HorizonSynthesizer synthesizer = new HorizonSynthesizer(
                rows -> Arrays.stream(rows).mapToDouble(row -> Double.NaN).toArray(), identity());

        assertThatThrownBy(() -> synthesizer.synthesize(history(FeaturePipeline.MAX_LAG, 7.0), ANCHOR, 3))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void synthesize_rejectsShortHistory() {
        HorizonSynthesizer synthesizer = new HorizonSynthesizer(rows -> new double[rows.length], identity());
        assertThatThrownBy(() -> synthesizer.synthesize(history(10, 1.0), ANCHOR, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void confidence_isHighForIdenticalRowsAndClampedForDispersedOnes() {
        double[][] same = {{1, 2}, {1, 2}, {1, 2}};
        double[][] spread = {{-20, 20}, {20, -20}};

        assertThat(HorizonSynthesizer.confidence(same)).isEqualTo(0.95);
        assertThat(HorizonSynthesizer.confidence(spread)).isEqualTo(0.1);
        assertThat(HorizonSynthesizer.confidence(new double[0][])).isEqualTo(0.1);
    }

    @Test
    void confidence_scalesWithMeanColumnVariance() {
        // column variances 1 and 4, mean 2.5
        double[][] rows = {{-1, -2}, {1, 2}};
        assertThat(HorizonSynthesizer.confidence(rows)).isCloseTo(0.75, within(1e-12));
    }
}
