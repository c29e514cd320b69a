package com.polkadot.analytics.repository;

import com.polkadot.analytics.engine.anomaly.AnomalyArtifact;
import com.polkadot.analytics.engine.anomaly.BaselineStatistics;
import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.engine.forecast.ForecastArtifact;
import com.polkadot.analytics.engine.forecast.LinearRegressor;
import com.polkadot.analytics.engine.isolationforest.IsolationForest;
import com.polkadot.analytics.model.AnomalyMethod;
import com.polkadot.analytics.model.ModelKey;
import com.polkadot.analytics.model.ModelKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ModelArtifactStoreTest {

    @TempDir
    Path root;

    private ModelArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ModelArtifactStore(root);
    }

    private static ForecastArtifact forecastArtifact(double intercept) {
        double[][] x = {{0}, {1}, {2}};
        double[] y = {intercept, intercept + 1, intercept + 2};
        return new ForecastArtifact(ModelKind.LINEAR, LinearRegressor.fit(x, y), FeatureScaler.fit(x),
                new double[]{1, 2, 3}, 0.5, 0.7, 3, 1, Instant.parse("2024-05-01T00:00:00Z"));
    }

    private static AnomalyArtifact anomalyArtifact() {
        double[][] rows = new double[40][2];
        double[] values = new double[40];
        for (int i = 0; i < 40; i++) {
            rows[i][0] = i % 7;
            rows[i][1] = Math.sin(i);
            values[i] = 100 + i % 5;
        }
        FeatureScaler scaler = FeatureScaler.fit(rows);
        IsolationForest forest = new IsolationForest();
        forest.train(scaler.transform(rows), 20, 32, 0.1, 42);
        return AnomalyArtifact.builder()
                .method(AnomalyMethod.ISOLATION_FOREST)
                .baseline(BaselineStatistics.compute(values, AnomalyMethod.ISOLATION_FOREST))
                .scaler(scaler)
                .forest(forest)
                .trainingSamples(40)
                .trainedAtEpochMs(1714521600000L)
                .build();
    }

    @Test
    void forecast_roundTripPreservesPredictions() throws Exception {
        ModelKey key = ModelKey.forecast("2004", "tvl", ModelKind.LINEAR);
        ForecastArtifact artifact = forecastArtifact(10);

        store.saveForecast(key, artifact);
        ForecastArtifact loaded = store.loadForecast(key).orElseThrow();

        assertThat(loaded.getModelKind()).isEqualTo(ModelKind.LINEAR);
        assertThat(loaded.getRecentValues()).containsExactly(1, 2, 3);
        assertThat(loaded.getTrainedAt()).isEqualTo(artifact.getTrainedAt());
        assertThat(loaded.getRegressor().predict(new double[]{0.5}))
                .isEqualTo(artifact.getRegressor().predict(new double[]{0.5}));
        assertThat(store.forecastExists(key)).isTrue();
    }

    @Test
    void anomaly_roundTripPreservesForestScores() throws Exception {
        ModelKey key = ModelKey.anomaly("2004", "tvl", AnomalyMethod.ISOLATION_FOREST);
        AnomalyArtifact artifact = anomalyArtifact();

        store.saveAnomaly(key, artifact);
        AnomalyArtifact loaded = store.loadAnomaly(key).orElseThrow();

        double[] sample = {3, 0.2};
        assertThat(loaded.hasForest()).isTrue();
        assertThat(loaded.getBaseline()).isEqualTo(artifact.getBaseline());
        assertThat(loaded.getForest().getOffset()).isEqualTo(artifact.getForest().getOffset());
        assertThat(loaded.getForest().anomalyScore(loaded.getScaler().transform(sample)))
                .isEqualTo(artifact.getForest().anomalyScore(artifact.getScaler().transform(sample)));
    }

    @Test
    void load_missingArtifactIsEmpty() throws Exception {
        ModelKey key = ModelKey.forecast("2004", "tvl", ModelKind.ENSEMBLE);
        assertThat(store.loadForecast(key)).isEqualTo(Optional.empty());
        assertThat(store.loadAnomaly(ModelKey.anomaly("2004", "tvl", AnomalyMethod.STATISTICAL))).isEmpty();
        assertThat(store.forecastExists(key)).isFalse();
    }

    @Test
    void save_overwritesAndLeavesNoTemporaryFiles() throws Exception {
        ModelKey key = ModelKey.forecast("2004", "tvl", ModelKind.LINEAR);
        store.saveForecast(key, forecastArtifact(10));
        store.saveForecast(key, forecastArtifact(50));

        assertThat(store.loadForecast(key).orElseThrow().getRegressor().predict(new double[]{0}))
                .isGreaterThan(40);
        try (Stream<Path> files = Files.walk(root)) {
            assertThat(files.filter(Files::isRegularFile)).hasSize(1);
        }
    }

    @Test
    void listKeys_decodesPathSegments() throws Exception {
        ModelKey dotted = ModelKey.forecast("..", "tvl/usd", ModelKind.LINEAR);
        ModelKey plain = ModelKey.forecast("2004", "users", ModelKind.RANDOM_FOREST);
        store.saveForecast(dotted, forecastArtifact(1));
        store.saveForecast(plain, forecastArtifact(2));
        store.saveAnomaly(ModelKey.anomaly("2004", "tvl", AnomalyMethod.ISOLATION_FOREST), anomalyArtifact());

        assertThat(store.listForecastKeys()).containsExactlyInAnyOrder(dotted, plain);
        assertThat(store.listAnomalyKeys())
                .containsExactly(ModelKey.anomaly("2004", "tvl", AnomalyMethod.ISOLATION_FOREST));
        // nothing escapes the root
        assertThat(Files.exists(root.resolve(ModelArtifactStore.FORECAST_DIR).resolve("%2E%2E"))).isTrue();
    }

    @Test
    void listKeys_emptyWhenNothingPersisted() {
        assertThat(store.listForecastKeys()).isEmpty();
        assertThat(store.listAnomalyKeys()).isEmpty();
    }

    @Test
    void encode_escapesDotsAndSeparators() {
        assertThat(ModelArtifactStore.encode("../a b")).isEqualTo("%2E%2E%2Fa+b");
        assertThat(ModelArtifactStore.decode("%2E%2E%2Fa+b")).isEqualTo("../a b");
    }
}
