package com.polkadot.analytics.service;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.engine.features.FeaturePipeline;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.ServiceUnavailableException;
import com.polkadot.analytics.model.AnomalyMethod;
import com.polkadot.analytics.model.AnomalyReport;
import com.polkadot.analytics.model.AnomalyRequest;
import com.polkadot.analytics.model.FeatureTable;
import com.polkadot.analytics.model.MetricSeries;
import com.polkadot.analytics.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Scores the most recent window of a metric. Extra warm-up history is fetched so the
 * lag features of the first scored rows are defined; only rows inside the lookback are
 * scored.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final MetricDataSource dataSource;
    private final FeaturePipeline featurePipeline;
    private final ObjectProvider<AnomalyModelManager> anomalyManager;
    private final AnalyticsConfig config;

    public AnomalyDetectionService(MetricDataSource dataSource, FeaturePipeline featurePipeline,
                                   ObjectProvider<AnomalyModelManager> anomalyManager, AnalyticsConfig config) {
        this.dataSource = dataSource;
        this.featurePipeline = featurePipeline;
        this.anomalyManager = anomalyManager;
        this.config = config;
    }

    public AnomalyReport detect(AnomalyRequest request) {
        AnomalyModelManager manager = anomalyManager.getIfAvailable();
        if (manager == null) {
            throw new ServiceUnavailableException("Anomaly detection");
        }
        if (request.getEntityId() == null || request.getEntityId().isBlank()
                || request.getMetric() == null || request.getMetric().isBlank()) {
            throw new ConfigurationException("entityId and metric are required");
        }
        AnalyticsConfig.Anomaly settings = config.getAnomaly();
        double sensitivity = request.getSensitivity() != null ? request.getSensitivity() : settings.getDefaultSensitivity();
        AnomalyModelManager.validateSensitivity(sensitivity);
        AnomalyMethod method = AnomalyMethod.fromCode(
                request.getMethod() != null ? request.getMethod() : settings.getDefaultMethod());
        int lookbackDays = request.getLookbackDays() != null ? request.getLookbackDays() : settings.getRecentLookbackDays();
        if (lookbackDays < 1) {
            throw new ConfigurationException("lookbackDays must be positive, got " + lookbackDays);
        }

        Instant now = Instant.now();
        Duration lookback = Duration.ofDays(lookbackDays);
        MetricSeries recent = dataSource.fetchRecentWindow(request.getEntityId(), request.getMetric(),
                lookback.plus(Duration.ofDays(settings.getWarmupDays())));
        FeatureTable window = featurePipeline.derive(recent, config.getDefaultFillMethod())
                .since(now.minus(lookback));

        log.debug("Scoring {} rows of {}/{} from the last {} days", window.size(),
                request.getEntityId(), request.getMetric(), lookbackDays);
        return manager.detect(request.getEntityId(), request.getMetric(), sensitivity, method, window);
    }
}
