package com.polkadot.analytics.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger cachedForecastModels;
    private final AtomicInteger cachedAnomalyModels;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.cachedForecastModels = registry.gauge("models.cached",
                Tags.of("manager", "forecast"), new AtomicInteger(0));
        this.cachedAnomalyModels = registry.gauge("models.cached",
                Tags.of("manager", "anomaly"), new AtomicInteger(0));
    }

    public void recordTraining(String manager, String variant, String outcome) {
        Counter.builder("model.training.count")
                .tag("manager", manager)
                .tag("variant", variant)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordForecast(String modelKind, double confidence) {
        Counter.builder("forecast.request.count")
                .tag("model_kind", modelKind)
                .register(registry)
                .increment();

        DistributionSummary.builder("forecast.confidence")
                .tag("model_kind", modelKind)
                .register(registry)
                .record(confidence);
    }

    public void recordDetection(String method, int anomalyCount) {
        Counter.builder("anomaly.detection.count")
                .tag("method", method)
                .register(registry)
                .increment();

        Counter.builder("anomaly.flagged.count")
                .tag("method", method)
                .register(registry)
                .increment(anomalyCount);
    }

    public void recordInsightRule(String category, int emitted) {
        Counter.builder("insight.emitted.count")
                .tag("category", category)
                .register(registry)
                .increment(emitted);
    }

    public void recordRetrainSweep(String manager, int succeeded, int failed) {
        Counter.builder("model.retrain.keys")
                .tag("manager", manager)
                .tag("outcome", "success")
                .register(registry)
                .increment(succeeded);
        Counter.builder("model.retrain.keys")
                .tag("manager", manager)
                .tag("outcome", "failure")
                .register(registry)
                .increment(failed);
    }

    public void updateCachedModelCount(String manager, int count) {
        if ("forecast".equals(manager)) {
            cachedForecastModels.set(count);
        } else {
            cachedAnomalyModels.set(count);
        }
    }
}
