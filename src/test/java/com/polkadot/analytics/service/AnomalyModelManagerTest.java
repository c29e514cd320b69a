package com.polkadot.analytics.service;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.InsufficientDataException;
import com.polkadot.analytics.exception.ModelUnavailableException;
import com.polkadot.analytics.model.AnomalyMethod;
import com.polkadot.analytics.model.AnomalyReport;
import com.polkadot.analytics.model.AnomalyTrainingReport;
import com.polkadot.analytics.model.DetectedAnomaly;
import com.polkadot.analytics.model.FeatureTable;
import com.polkadot.analytics.model.RetrainSummary;
import com.polkadot.analytics.model.Severity;
import com.polkadot.analytics.repository.ModelArtifactStore;
import com.polkadot.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyModelManagerTest {

    @TempDir
    Path cacheDir;

    private AnalyticsConfig config;
    private AnomalyModelManager manager;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.config();
        manager = newManager();
    }

    private AnomalyModelManager newManager() {
        AnomalyModelManager m = new AnomalyModelManager(config, new ModelArtifactStore(cacheDir),
                TestDataFactory.metricsConfig());
        m.loadPersisted();
        return m;
    }

    // 60 rows alternating 90/110: mean 100, population std 10
    private static FeatureTable alternating() {
        return TestDataFactory.featureTable("2004", "tvl", 90, i -> i % 2 == 0 ? 90 : 110);
    }

    private static FeatureTable smooth() {
        return TestDataFactory.featureTable("2004", "tvl", 230, i -> 1000 + 50 * Math.sin(i / 3.0));
    }

    @Test
    void statistical_flagsLargeDeviationAsHigh() {
        AnomalyTrainingReport training = manager.train(alternating(), "2004", "tvl", AnomalyMethod.STATISTICAL);
        assertThat(training.getBaselineMean()).isCloseTo(100.0, within(1e-9));
        assertThat(training.getBaselineStd()).isCloseTo(10.0, within(1e-9));

        AnomalyReport report = manager.detect("2004", "tvl", 0.05, AnomalyMethod.STATISTICAL,
                TestDataFactory.window("2004", "tvl", 200, 105));

        assertThat(report.getTotalPoints()).isEqualTo(2);
        assertThat(report.getAnomalyCount()).isEqualTo(1);
        assertThat(report.getAnomalyPercentage()).isEqualTo(50.0);
        DetectedAnomaly anomaly = report.getAnomalies().get(0);
        assertThat(anomaly.getValue()).isEqualTo(200);
        assertThat(anomaly.getZScore()).isCloseTo(10.0, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getDescription()).isEqualTo("Statistical anomaly detected (z-score: 10.00)");
        assertThat(anomaly.getAnomalyScore()).isNull();
    }

    @Test
    void statistical_sensitivityMovesThreshold() {
        manager.train(alternating(), "2004", "tvl", AnomalyMethod.STATISTICAL);
        FeatureTable window = TestDataFactory.window("2004", "tvl", 125);

        // z = 2.5: above the 0.05 threshold (1.96), below the 0.01 threshold (2.58)
        assertThat(manager.detect("2004", "tvl", 0.05, AnomalyMethod.STATISTICAL, window).getAnomalies())
                .singleElement().extracting(DetectedAnomaly::getSeverity).isEqualTo(Severity.MEDIUM);
        assertThat(manager.detect("2004", "tvl", 0.01, AnomalyMethod.STATISTICAL, window).getAnomalies())
                .isEmpty();
    }

    @Test
    void isolationForest_flagsExtremeRow() {
        manager.train(smooth(), "2004", "tvl", AnomalyMethod.ISOLATION_FOREST);

        AnomalyReport report = manager.detect("2004", "tvl", 0.05, AnomalyMethod.ISOLATION_FOREST,
                TestDataFactory.window("2004", "tvl", 1_000_000));

        assertThat(report.getAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getAnomalyScore()).isNegative();
            assertThat(anomaly.getZScore()).isNull();
            assertThat(anomaly.getDescription()).isEqualTo("Unusual tvl value detected");
        });
        assertThat(report.getBaseline().getMethod()).isEqualTo(AnomalyMethod.ISOLATION_FOREST);
    }

    @Test
    void detect_emptyWindowReportsNothing() {
        manager.train(alternating(), "2004", "tvl", AnomalyMethod.STATISTICAL);

        AnomalyReport report = manager.detect("2004", "tvl", 0.05, AnomalyMethod.STATISTICAL,
                FeatureTable.empty("2004", "tvl"));

        assertThat(report.getTotalPoints()).isZero();
        assertThat(report.getAnomalyPercentage()).isZero();
    }

    @Test
    void detect_rejectsSensitivityOutsideOpenUnitInterval() {
        for (double bad : new double[]{0.0, 1.0, -0.1, 1.5, Double.NaN}) {
            assertThatThrownBy(() -> manager.detect("2004", "tvl", bad, AnomalyMethod.STATISTICAL,
                    FeatureTable.empty("2004", "tvl")))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    void detect_untrainedKeyIsUnavailable() {
        assertThatThrownBy(() -> manager.detect("2004", "tvl", 0.05, AnomalyMethod.STATISTICAL,
                FeatureTable.empty("2004", "tvl")))
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    void train_rejectsTooFewRows() {
        FeatureTable small = TestDataFactory.featureTable("2004", "tvl", 60, i -> i);
        assertThatThrownBy(() -> manager.train(small, "2004", "tvl", AnomalyMethod.STATISTICAL))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void persistedBaseline_survivesRestart() {
        manager.train(smooth(), "2004", "tvl", AnomalyMethod.ISOLATION_FOREST);
        FeatureTable window = TestDataFactory.window("2004", "tvl", 1_000_000, 1000);
        AnomalyReport before = manager.detect("2004", "tvl", 0.05, AnomalyMethod.ISOLATION_FOREST, window);

        AnomalyModelManager restarted = newManager();
        AnomalyReport after = restarted.detect("2004", "tvl", 0.05, AnomalyMethod.ISOLATION_FOREST, window);

        assertThat(restarted.isReady()).isTrue();
        assertThat(after.getAnomalies()).isEqualTo(before.getAnomalies());
        assertThat(after.getBaseline()).isEqualTo(before.getBaseline());
    }

    @Test
    void retrain_countsFailures() {
        manager.train(alternating(), "2004", "tvl", AnomalyMethod.STATISTICAL);
        manager.train(smooth(), "2004", "tvl", AnomalyMethod.ISOLATION_FOREST);

        RetrainSummary summary = manager.retrain(
                key -> key.variant().equals("statistical") ? FeatureTable.empty("2004", "tvl") : smooth(),
                () -> false);

        assertThat(summary).isEqualTo(new RetrainSummary(2, 1, 1, false));
    }

    @Test
    void methods_listsCodes() {
        assertThat(manager.methods()).containsExactly("isolation_forest", "statistical");
    }
}
