package com.polkadot.analytics.service;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.config.MetricsConfig;
import com.polkadot.analytics.engine.anomaly.AnomalyArtifact;
import com.polkadot.analytics.engine.anomaly.BaselineStatistics;
import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.engine.isolationforest.IsolationForest;
import com.polkadot.analytics.exception.AnalyticsException;
import com.polkadot.analytics.exception.ComputationException;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.InsufficientDataException;
import com.polkadot.analytics.exception.ModelUnavailableException;
import com.polkadot.analytics.model.AnomalyBaseline;
import com.polkadot.analytics.model.AnomalyMethod;
import com.polkadot.analytics.model.AnomalyReport;
import com.polkadot.analytics.model.AnomalyTrainingReport;
import com.polkadot.analytics.model.DetectedAnomaly;
import com.polkadot.analytics.model.FeatureRow;
import com.polkadot.analytics.model.FeatureTable;
import com.polkadot.analytics.model.ModelKey;
import com.polkadot.analytics.model.RetrainSummary;
import com.polkadot.analytics.model.Severity;
import com.polkadot.analytics.repository.ModelArtifactStore;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Trains and serves anomaly baselines keyed by (entity, metric, method).
 *
 * <p>Every key carries a baseline of the training values. Isolation forest keys also
 * carry a forest over the standardized feature rows, calibrated so that the configured
 * contamination share of training rows scores as outliers.
 */
@Service
@ConditionalOnProperty(prefix = "analytics.anomaly", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AnomalyModelManager {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModelManager.class);

    static final String MANAGER = "anomaly";

    private final AnalyticsConfig config;
    private final ModelArtifactStore store;
    private final MetricsConfig metricsConfig;

    private final Map<ModelKey, AnomalyArtifact> cache = new ConcurrentHashMap<>();
    private final Map<ModelKey, ReentrantLock> trainLocks = new ConcurrentHashMap<>();
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public AnomalyModelManager(AnalyticsConfig config, ModelArtifactStore store, MetricsConfig metricsConfig) {
        this.config = config;
        this.store = store;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void loadPersisted() {
        int loaded = 0;
        for (ModelKey key : store.listAnomalyKeys()) {
            try {
                Optional<AnomalyArtifact> artifact = store.loadAnomaly(key);
                if (artifact.isPresent()) {
                    cache.put(key, artifact.get());
                    loaded++;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable anomaly artifact {}: {}", key, e.getMessage());
            }
        }
        if (loaded > 0) {
            ready.set(true);
        }
        metricsConfig.updateCachedModelCount(MANAGER, cache.size());
        log.info("Anomaly model manager started with {} persisted baselines from {}", loaded, store.getRoot());
    }

    @PreDestroy
    public void shutdown() {
        cache.clear();
        metricsConfig.updateCachedModelCount(MANAGER, 0);
    }

    @Observed(name = "anomaly.train", contextualName = "train-anomaly-model")
    public AnomalyTrainingReport train(FeatureTable table, String entityId, String metric, AnomalyMethod method) {
        ModelKey key = ModelKey.anomaly(entityId, metric, method);
        AnalyticsConfig.Anomaly settings = config.getAnomaly();
        if (table.size() < settings.getMinTrainingRows()) {
            metricsConfig.recordTraining(MANAGER, method.getCode(), "insufficient_data");
            throw new InsufficientDataException(key, table.size(), settings.getMinTrainingRows());
        }

        ReentrantLock lock = trainLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            AnomalyArtifact artifact = fit(key, method, table, settings);
            try {
                store.saveAnomaly(key, artifact);
            } catch (IOException e) {
                throw new ComputationException("Failed to persist anomaly model", key, e);
            }
            cache.put(key, artifact);
            ready.set(true);
            metricsConfig.recordTraining(MANAGER, method.getCode(), "success");
            metricsConfig.updateCachedModelCount(MANAGER, cache.size());

            AnomalyBaseline baseline = artifact.getBaseline();
            log.info("Trained {} anomaly model for {}/{}: samples={}, mean={}, std={}",
                    method.getCode(), entityId, metric, table.size(), baseline.getMean(), baseline.getStd());

            return AnomalyTrainingReport.builder()
                    .entityId(entityId)
                    .metric(metric)
                    .method(method)
                    .trainingSamples(table.size())
                    .baselineMean(baseline.getMean())
                    .baselineStd(baseline.getStd())
                    .featureCount(FeatureTable.FEATURE_COUNT)
                    .trainedAt(Instant.ofEpochMilli(artifact.getTrainedAtEpochMs()))
                    .build();
        } catch (ComputationException e) {
            metricsConfig.recordTraining(MANAGER, method.getCode(), "failure");
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private AnomalyArtifact fit(ModelKey key, AnomalyMethod method, FeatureTable table,
                                AnalyticsConfig.Anomaly settings) {
        try {
            AnomalyBaseline baseline = BaselineStatistics.compute(table.values(), method);
            double[][] features = table.featureMatrix();
            FeatureScaler scaler = FeatureScaler.fit(features);

            IsolationForest forest = null;
            if (method == AnomalyMethod.ISOLATION_FOREST) {
                forest = new IsolationForest();
                forest.train(scaler.transform(features), settings.getNumTrees(), settings.getSampleSize(),
                        settings.getContamination(), settings.getSeed());
            }
            return AnomalyArtifact.builder()
                    .method(method)
                    .baseline(baseline)
                    .scaler(scaler)
                    .forest(forest)
                    .trainingSamples(table.size())
                    .trainedAtEpochMs(System.currentTimeMillis())
                    .build();
        } catch (AnalyticsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationException("Failed to fit anomaly model", key, e);
        }
    }

    /**
     * Scores {@code window} against the trained key. Sensitivity is validated before
     * anything else and only affects the statistical method.
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public AnomalyReport detect(String entityId, String metric, double sensitivity, AnomalyMethod method,
                                FeatureTable window) {
        validateSensitivity(sensitivity);
        ModelKey key = ModelKey.anomaly(entityId, metric, method);
        AnomalyArtifact artifact = resolve(key).orElseThrow(() -> new ModelUnavailableException(key));
        AnomalyBaseline baseline = artifact.getBaseline();

        List<DetectedAnomaly> anomalies;
        try {
            if (method == AnomalyMethod.ISOLATION_FOREST && artifact.hasForest()) {
                anomalies = scoreWithForest(artifact, window, metric);
            } else {
                anomalies = scoreStatistically(baseline, window, sensitivity);
            }
        } catch (RuntimeException e) {
            throw new ComputationException("Failed to score recent window", key, e);
        }

        int total = window.size();
        double percentage = total > 0 ? 100.0 * anomalies.size() / total : 0.0;
        metricsConfig.recordDetection(method.getCode(), anomalies.size());
        log.debug("Detected {} anomalies in {} points for {}", anomalies.size(), total, key);

        return AnomalyReport.builder()
                .entityId(entityId)
                .metric(metric)
                .anomalies(anomalies)
                .totalPoints(total)
                .anomalyCount(anomalies.size())
                .anomalyPercentage(percentage)
                .method(method)
                .sensitivity(sensitivity)
                .baseline(baseline)
                .generatedAt(Instant.now())
                .build();
    }

    public static void validateSensitivity(double sensitivity) {
        if (!(sensitivity > 0.0 && sensitivity < 1.0)) {
            throw new ConfigurationException("Sensitivity must be between 0 and 1 (exclusive), got " + sensitivity);
        }
    }

    private List<DetectedAnomaly> scoreWithForest(AnomalyArtifact artifact, FeatureTable window, String metric) {
        double highSeverity = config.getAnomaly().getHighSeverityScore();
        List<DetectedAnomaly> anomalies = new ArrayList<>();
        for (FeatureRow row : window.getRows()) {
            double score = artifact.getForest().decisionFunction(artifact.getScaler().transform(row.features()));
            if (score < 0) {
                anomalies.add(DetectedAnomaly.builder()
                        .timestamp(row.timestamp())
                        .value(row.value())
                        .anomalyScore(score)
                        .severity(Math.abs(score) > highSeverity ? Severity.HIGH : Severity.MEDIUM)
                        .description("Unusual " + metric + " value detected")
                        .build());
            }
        }
        return anomalies;
    }

    private List<DetectedAnomaly> scoreStatistically(AnomalyBaseline baseline, FeatureTable window,
                                                     double sensitivity) {
        double threshold = new NormalDistribution().inverseCumulativeProbability(1.0 - sensitivity / 2.0);
        double highSeverity = config.getAnomaly().getHighSeverityZScore();
        List<DetectedAnomaly> anomalies = new ArrayList<>();
        for (FeatureRow row : window.getRows()) {
            double z = BaselineStatistics.zScore(row.value(), baseline);
            if (z > threshold) {
                anomalies.add(DetectedAnomaly.builder()
                        .timestamp(row.timestamp())
                        .value(row.value())
                        .zScore(z)
                        .severity(z > highSeverity ? Severity.HIGH : Severity.MEDIUM)
                        .description(String.format(Locale.ROOT, "Statistical anomaly detected (z-score: %.2f)", z))
                        .build());
            }
        }
        return anomalies;
    }

    public RetrainSummary retrain(Function<ModelKey, FeatureTable> trainingData, BooleanSupplier cancelled) {
        List<ModelKey> keys = knownKeys();
        int succeeded = 0;
        int failed = 0;
        boolean wasCancelled = false;

        for (ModelKey key : keys) {
            if (cancelled.getAsBoolean()) {
                wasCancelled = true;
                log.info("Anomaly retrain cancelled after {} of {} keys", succeeded + failed, keys.size());
                break;
            }
            try {
                train(trainingData.apply(key), key.entityId(), key.metric(), AnomalyMethod.fromCode(key.variant()));
                succeeded++;
            } catch (Exception e) {
                failed++;
                log.error("Failed to retrain anomaly model {}: {}", key, e.getMessage(), e);
            }
        }
        metricsConfig.recordRetrainSweep(MANAGER, succeeded, failed);
        return new RetrainSummary(succeeded + failed, succeeded, failed, wasCancelled);
    }

    public List<String> methods() {
        return Arrays.stream(AnomalyMethod.values())
                .map(AnomalyMethod::getCode)
                .collect(Collectors.toList());
    }

    public List<ModelKey> knownKeys() {
        TreeSet<ModelKey> keys = new TreeSet<>(Comparator.comparing(ModelKey::toString));
        keys.addAll(cache.keySet());
        keys.addAll(store.listAnomalyKeys());
        return new ArrayList<>(keys);
    }

    public boolean isReady() {
        return ready.get();
    }

    public int cachedModelCount() {
        return cache.size();
    }

    private Optional<AnomalyArtifact> resolve(ModelKey key) {
        AnomalyArtifact cached = cache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Optional<AnomalyArtifact> loaded = store.loadAnomaly(key);
            loaded.ifPresent(artifact -> {
                cache.put(key, artifact);
                ready.set(true);
                metricsConfig.updateCachedModelCount(MANAGER, cache.size());
                log.info("Loaded anomaly model {} from {}", key, store.getRoot());
            });
            return loaded;
        } catch (IOException e) {
            throw new ComputationException("Failed to load anomaly model", key, e);
        }
    }
}
