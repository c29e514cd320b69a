package com.polkadot.analytics.service;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.config.MetricsConfig;
import com.polkadot.analytics.engine.features.FeaturePipeline;
import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.engine.forecast.ForecastArtifact;
import com.polkadot.analytics.engine.forecast.HorizonSynthesizer;
import com.polkadot.analytics.engine.forecast.Regressor;
import com.polkadot.analytics.engine.forecast.RegressorFactory;
import com.polkadot.analytics.exception.AnalyticsException;
import com.polkadot.analytics.exception.ComputationException;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.InsufficientDataException;
import com.polkadot.analytics.exception.ModelUnavailableException;
import com.polkadot.analytics.model.FeatureTable;
import com.polkadot.analytics.model.ForecastPoint;
import com.polkadot.analytics.model.ForecastResult;
import com.polkadot.analytics.model.ForecastTrainingReport;
import com.polkadot.analytics.model.ModelKey;
import com.polkadot.analytics.model.ModelKind;
import com.polkadot.analytics.model.RetrainSummary;
import com.polkadot.analytics.repository.ModelArtifactStore;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Trains, persists and serves forecast models keyed by (entity, metric, model kind).
 *
 * <p>Artifacts are cached in memory after training or the first load from the model
 * cache directory. Trains of the same key are serialized; different keys train
 * concurrently.
 */
@Service
@ConditionalOnProperty(prefix = "analytics.forecast", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ForecastModelManager {

    private static final Logger log = LoggerFactory.getLogger(ForecastModelManager.class);

    static final String MANAGER = "forecast";

    private final AnalyticsConfig config;
    private final RegressorFactory regressorFactory;
    private final ModelArtifactStore store;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<ModelKey, ForecastArtifact> cache = new ConcurrentHashMap<>();
    private final Map<ModelKey, ReentrantLock> trainLocks = new ConcurrentHashMap<>();
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public ForecastModelManager(AnalyticsConfig config, RegressorFactory regressorFactory,
                                ModelArtifactStore store, MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.regressorFactory = regressorFactory;
        this.store = store;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Loads every persisted artifact so the manager reports ready after a restart.
     */
    @PostConstruct
    public void loadPersisted() {
        int loaded = 0;
        for (ModelKey key : store.listForecastKeys()) {
            try {
                Optional<ForecastArtifact> artifact = store.loadForecast(key);
                if (artifact.isPresent()) {
                    cache.put(key, artifact.get());
                    loaded++;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable forecast artifact {}: {}", key, e.getMessage());
            }
        }
        if (loaded > 0) {
            ready.set(true);
        }
        metricsConfig.updateCachedModelCount(MANAGER, cache.size());
        log.info("Forecast model manager started with {} persisted models from {}", loaded, store.getRoot());
    }

    @PreDestroy
    public void shutdown() {
        cache.clear();
        metricsConfig.updateCachedModelCount(MANAGER, 0);
    }

    @Observed(name = "forecast.train", contextualName = "train-forecast-model")
    public ForecastTrainingReport train(FeatureTable table, String entityId, String metric, ModelKind kind) {
        ModelKey key = ModelKey.forecast(entityId, metric, kind);
        AnalyticsConfig.Forecast settings = config.getForecast();
        if (table.size() < settings.getMinTrainingRows()) {
            metricsConfig.recordTraining(MANAGER, kind.getCode(), "insufficient_data");
            throw new InsufficientDataException(key, table.size(), settings.getMinTrainingRows());
        }

        ReentrantLock lock = trainLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            ForecastArtifact artifact = fit(key, kind, table, settings);
            try {
                store.saveForecast(key, artifact);
            } catch (IOException e) {
                throw new ComputationException("Failed to persist forecast model", key, e);
            }
            cache.put(key, artifact);
            ready.set(true);
            metricsConfig.recordTraining(MANAGER, kind.getCode(), "success");
            metricsConfig.updateCachedModelCount(MANAGER, cache.size());

            log.info("Trained {} forecast model for {}/{}: train={}, test={}, MAE={}, RMSE={}",
                    kind.getCode(), entityId, metric, artifact.getTrainingSamples(), artifact.getTestSamples(),
                    String.format("%.4f", artifact.getHoldoutMae()), String.format("%.4f", artifact.getHoldoutRmse()));

            return ForecastTrainingReport.builder()
                    .entityId(entityId)
                    .metric(metric)
                    .modelKind(kind)
                    .mae(artifact.getHoldoutMae())
                    .rmse(artifact.getHoldoutRmse())
                    .trainingSamples(artifact.getTrainingSamples())
                    .testSamples(artifact.getTestSamples())
                    .featureCount(FeatureTable.FEATURE_COUNT)
                    .trainedAt(artifact.getTrainedAt())
                    .build();
        } catch (ComputationException e) {
            metricsConfig.recordTraining(MANAGER, kind.getCode(), "failure");
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private ForecastArtifact fit(ModelKey key, ModelKind kind, FeatureTable table, AnalyticsConfig.Forecast settings) {
        try {
            double[][] x = table.featureMatrix();
            double[] y = table.values();
            int split = (int) (table.size() * settings.getTrainSplit());

            double[][] xTrain = Arrays.copyOfRange(x, 0, split);
            double[] yTrain = Arrays.copyOfRange(y, 0, split);
            double[][] xTest = Arrays.copyOfRange(x, split, x.length);
            double[] yTest = Arrays.copyOfRange(y, split, y.length);

            FeatureScaler scaler = FeatureScaler.fit(xTrain);
            Regressor regressor = regressorFactory.fit(kind, scaler.transform(xTrain), yTrain);

            double[] predicted = regressor.predict(scaler.transform(xTest));
            double absolute = 0;
            double squared = 0;
            for (int i = 0; i < yTest.length; i++) {
                double error = yTest[i] - predicted[i];
                absolute += Math.abs(error);
                squared += error * error;
            }
            double mae = yTest.length == 0 ? 0.0 : absolute / yTest.length;
            double rmse = yTest.length == 0 ? 0.0 : Math.sqrt(squared / yTest.length);

            double[] recent = Arrays.copyOfRange(y, y.length - FeaturePipeline.MAX_LAG, y.length);
            return new ForecastArtifact(kind, regressor, scaler, recent, mae, rmse,
                    xTrain.length, xTest.length, clock.instant());
        } catch (AnalyticsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationException("Failed to fit forecast model", key, e);
        }
    }

    @Observed(name = "forecast.predict", contextualName = "predict-forecast")
    public ForecastResult predict(String entityId, String metric, int horizonDays, ModelKind kind) {
        int maxHorizon = config.getForecast().getMaxHorizonDays();
        if (horizonDays < 1 || horizonDays > maxHorizon) {
            throw new ConfigurationException("Forecast horizon must be between 1 and " + maxHorizon
                    + " days, got " + horizonDays);
        }
        ModelKey key = ModelKey.forecast(entityId, metric, kind);
        ForecastArtifact artifact = resolve(key).orElseThrow(() -> new ModelUnavailableException(key));

        HorizonSynthesizer.Synthesis synthesis;
        try {
            HorizonSynthesizer synthesizer = new HorizonSynthesizer(artifact.getRegressor(), artifact.getScaler());
            synthesis = synthesizer.synthesize(artifact.getRecentValues(), clock.instant(), horizonDays);
        } catch (RuntimeException e) {
            throw new ComputationException("Failed to synthesize forecast", key, e);
        }

        double confidence = HorizonSynthesizer.confidence(synthesis.standardizedRows());
        List<ForecastPoint> points = new ArrayList<>(horizonDays);
        for (int d = 0; d < horizonDays; d++) {
            points.add(ForecastPoint.builder()
                    .timestamp(synthesis.timestamps().get(d))
                    .predictedValue(synthesis.values()[d])
                    .confidence(confidence)
                    .build());
        }
        metricsConfig.recordForecast(kind.getCode(), confidence);
        log.debug("Forecast {} for {} days: confidence={}", key, horizonDays, confidence);

        return ForecastResult.builder()
                .entityId(entityId)
                .metric(metric)
                .values(points)
                .confidence(confidence)
                .modelKind(kind)
                .holdoutMae(artifact.getHoldoutMae())
                .holdoutRmse(artifact.getHoldoutRmse())
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Re-trains every known key with data supplied by {@code trainingData}. A failing key
     * is logged and counted; the sweep moves on. {@code cancelled} is polled between keys.
     */
    public RetrainSummary retrain(Function<ModelKey, FeatureTable> trainingData, BooleanSupplier cancelled) {
        List<ModelKey> keys = knownKeys();
        int succeeded = 0;
        int failed = 0;
        boolean wasCancelled = false;

        for (ModelKey key : keys) {
            if (cancelled.getAsBoolean()) {
                wasCancelled = true;
                log.info("Forecast retrain cancelled after {} of {} keys", succeeded + failed, keys.size());
                break;
            }
            try {
                train(trainingData.apply(key), key.entityId(), key.metric(), ModelKind.fromCode(key.variant()));
                succeeded++;
            } catch (Exception e) {
                failed++;
                log.error("Failed to retrain forecast model {}: {}", key, e.getMessage(), e);
            }
        }
        metricsConfig.recordRetrainSweep(MANAGER, succeeded, failed);
        return new RetrainSummary(succeeded + failed, succeeded, failed, wasCancelled);
    }

    /**
     * Per model kind: {@code loaded} (in memory), {@code available} (persisted only) or
     * {@code not_trained}.
     */
    public Map<String, String> describe(String entityId, String metric) {
        Map<String, String> status = new LinkedHashMap<>();
        for (ModelKind kind : ModelKind.values()) {
            ModelKey key = ModelKey.forecast(entityId, metric, kind);
            if (cache.containsKey(key)) {
                status.put(kind.getCode(), "loaded");
            } else if (store.forecastExists(key)) {
                status.put(kind.getCode(), "available");
            } else {
                status.put(kind.getCode(), "not_trained");
            }
        }
        return status;
    }

    public List<ModelKey> knownKeys() {
        TreeSet<ModelKey> keys = new TreeSet<>(Comparator.comparing(ModelKey::toString));
        keys.addAll(cache.keySet());
        keys.addAll(store.listForecastKeys());
        return new ArrayList<>(keys);
    }

    public boolean isAvailable(String entityId, String metric, ModelKind kind) {
        ModelKey key = ModelKey.forecast(entityId, metric, kind);
        return cache.containsKey(key) || store.forecastExists(key);
    }

    public boolean isReady() {
        return ready.get();
    }

    public int cachedModelCount() {
        return cache.size();
    }

    private Optional<ForecastArtifact> resolve(ModelKey key) {
        ForecastArtifact cached = cache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Optional<ForecastArtifact> loaded = store.loadForecast(key);
            loaded.ifPresent(artifact -> {
                cache.put(key, artifact);
                ready.set(true);
                metricsConfig.updateCachedModelCount(MANAGER, cache.size());
                log.info("Loaded forecast model {} from {}", key, store.getRoot());
            });
            return loaded;
        } catch (IOException e) {
            throw new ComputationException("Failed to load forecast model", key, e);
        }
    }
}
