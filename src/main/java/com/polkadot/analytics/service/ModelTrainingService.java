package com.polkadot.analytics.service;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.engine.features.FeaturePipeline;
import com.polkadot.analytics.engine.features.FillMethod;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.ServiceUnavailableException;
import com.polkadot.analytics.model.AnomalyMethod;
import com.polkadot.analytics.model.AnomalyTrainingReport;
import com.polkadot.analytics.model.FeatureTable;
import com.polkadot.analytics.model.ForecastTrainingReport;
import com.polkadot.analytics.model.MetricSeries;
import com.polkadot.analytics.model.ModelKey;
import com.polkadot.analytics.model.ModelKind;
import com.polkadot.analytics.model.RetrainSummary;
import com.polkadot.analytics.model.TrainRequest;
import com.polkadot.analytics.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetches history from the metric store, derives features and hands them to the model
 * managers. Also owns the periodic retrain sweep and its cancellation flag.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final MetricDataSource dataSource;
    private final FeaturePipeline featurePipeline;
    private final ObjectProvider<ForecastModelManager> forecastManager;
    private final ObjectProvider<AnomalyModelManager> anomalyManager;
    private final AnalyticsConfig config;

    private final AtomicBoolean retraining = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public ModelTrainingService(MetricDataSource dataSource, FeaturePipeline featurePipeline,
                                ObjectProvider<ForecastModelManager> forecastManager,
                                ObjectProvider<AnomalyModelManager> anomalyManager,
                                AnalyticsConfig config) {
        this.dataSource = dataSource;
        this.featurePipeline = featurePipeline;
        this.forecastManager = forecastManager;
        this.anomalyManager = anomalyManager;
        this.config = config;
    }

    public ForecastTrainingReport trainForecast(TrainRequest request) {
        ForecastModelManager manager = forecastManager.getIfAvailable();
        if (manager == null) {
            throw new ServiceUnavailableException("Forecasting");
        }
        requireTarget(request);
        ModelKind kind = ModelKind.fromCode(orDefault(request.getVariant(), config.getForecast().getDefaultModelKind()));
        FeatureTable table = loadTrainingTable(request.getEntityId(), request.getMetric(),
                historyDays(request), fillMethod(request));
        return manager.train(table, request.getEntityId(), request.getMetric(), kind);
    }

    public AnomalyTrainingReport trainAnomaly(TrainRequest request) {
        AnomalyModelManager manager = anomalyManager.getIfAvailable();
        if (manager == null) {
            throw new ServiceUnavailableException("Anomaly detection");
        }
        requireTarget(request);
        AnomalyMethod method = AnomalyMethod.fromCode(orDefault(request.getVariant(), config.getAnomaly().getDefaultMethod()));
        FeatureTable table = loadTrainingTable(request.getEntityId(), request.getMetric(),
                historyDays(request), fillMethod(request));
        return manager.train(table, request.getEntityId(), request.getMetric(), method);
    }

    public FeatureTable loadTrainingTable(String entityId, String metric, int historyDays, FillMethod fillMethod) {
        Instant end = Instant.now();
        Instant start = end.minus(Duration.ofDays(historyDays));
        MetricSeries series = dataSource.fetchSeries(entityId, metric, start, end, config.getFetchLimit());
        FeatureTable table = featurePipeline.derive(series, fillMethod);
        log.info("Loaded {} points ({} feature rows) for {}/{} over {} days",
                series.size(), table.size(), entityId, metric, historyDays);
        return table;
    }

    @Scheduled(fixedRateString = "${analytics.retrain.interval-hours:24}",
               initialDelayString = "${analytics.retrain.interval-hours:24}",
               timeUnit = TimeUnit.HOURS)
    public void scheduledRetrain() {
        if (!config.getRetrain().isEnabled()) {
            log.debug("Scheduled retrain disabled. Skipping sweep.");
            return;
        }
        retrainAll();
    }

    /**
     * Re-trains every known forecast and anomaly key from fresh history.
     *
     * @return the summary per manager, or empty when another sweep already holds the flag
     */
    public Optional<Map<String, RetrainSummary>> retrainAll() {
        if (!retraining.compareAndSet(false, true)) {
            log.warn("Retrain sweep already running. Ignoring request.");
            return Optional.empty();
        }
        cancelRequested.set(false);
        try {
            log.info("=== Starting model retrain sweep ===");
            FillMethod fill = FillMethod.fromCode(config.getDefaultFillMethod());
            int days = config.getHistoricalDataDays();
            Map<String, RetrainSummary> summaries = new LinkedHashMap<>();

            ForecastModelManager forecasts = forecastManager.getIfAvailable();
            if (forecasts != null) {
                summaries.put(ForecastModelManager.MANAGER, forecasts.retrain(
                        key -> historyFor(key, days, fill), cancelRequested::get));
            }
            AnomalyModelManager anomalies = anomalyManager.getIfAvailable();
            if (anomalies != null) {
                summaries.put(AnomalyModelManager.MANAGER, cancelRequested.get()
                        ? new RetrainSummary(0, 0, 0, true)
                        : anomalies.retrain(key -> historyFor(key, days, fill), cancelRequested::get));
            }

            log.info("=== Retrain sweep complete: {} ===", summaries);
            return Optional.of(summaries);
        } finally {
            retraining.set(false);
        }
    }

    /**
     * @return true when a running sweep was asked to stop
     */
    public boolean cancelRetrain() {
        if (!retraining.get()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Retrain sweep cancellation requested");
        return true;
    }

    public boolean isRetraining() {
        return retraining.get();
    }

    private FeatureTable historyFor(ModelKey key, int days, FillMethod fill) {
        return loadTrainingTable(key.entityId(), key.metric(), days, fill);
    }

    private int historyDays(TrainRequest request) {
        int days = request.getHistoryDays() != null ? request.getHistoryDays() : config.getHistoricalDataDays();
        if (days < 1) {
            throw new ConfigurationException("historyDays must be positive, got " + days);
        }
        return days;
    }

    private FillMethod fillMethod(TrainRequest request) {
        return FillMethod.fromCode(orDefault(request.getFillMethod(), config.getDefaultFillMethod()));
    }

    static void requireTarget(TrainRequest request) {
        if (request.getEntityId() == null || request.getEntityId().isBlank()
                || request.getMetric() == null || request.getMetric().isBlank()) {
            throw new ConfigurationException("entityId and metric are required");
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
