package com.polkadot.analytics.service;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.engine.insight.InsightEngine;
import com.polkadot.analytics.engine.insight.InsightEnhancer;
import com.polkadot.analytics.engine.insight.InsightResult;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.ModelUnavailableException;
import com.polkadot.analytics.model.ForecastPoint;
import com.polkadot.analytics.model.ForecastResult;
import com.polkadot.analytics.model.InsightReport;
import com.polkadot.analytics.model.InsightsRequest;
import com.polkadot.analytics.model.MetricPoint;
import com.polkadot.analytics.model.MetricSeries;
import com.polkadot.analytics.model.MetricTable;
import com.polkadot.analytics.model.ModelKind;
import com.polkadot.analytics.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the daily metric table for one parachain (or the sum over all parachains),
 * runs the insight engine and the optional enhancement hook.
 */
@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    private final MetricDataSource dataSource;
    private final InsightEngine insightEngine;
    private final InsightEnhancer enhancer;
    private final ObjectProvider<ForecastModelManager> forecastManager;
    private final AnalyticsConfig config;

    public InsightService(MetricDataSource dataSource, InsightEngine insightEngine, InsightEnhancer enhancer,
                          ObjectProvider<ForecastModelManager> forecastManager, AnalyticsConfig config) {
        this.dataSource = dataSource;
        this.insightEngine = insightEngine;
        this.enhancer = enhancer;
        this.forecastManager = forecastManager;
        this.config = config;
    }

    public InsightReport generate(InsightsRequest request) {
        String entityId = request.getEntityId() == null || request.getEntityId().isBlank()
                ? null : request.getEntityId();
        int days = request.getTimeRangeDays() != null
                ? request.getTimeRangeDays() : config.getInsights().getDefaultTimeRangeDays();
        if (days < 1) {
            throw new ConfigurationException("timeRangeDays must be positive, got " + days);
        }

        MetricTable table = buildTable(entityId, days);
        List<String> outlook = !Boolean.FALSE.equals(request.getIncludePredictions()) && entityId != null
                ? outlook(entityId, table) : List.of();
        InsightResult result = insightEngine.generate(table, outlook);

        List<String> insights = result.insights();
        boolean enhanced = false;
        if (enhancer.isActive() && !table.isEmpty()) {
            List<String> rewritten = enhancer.enhance(insights, entityId, days);
            enhanced = !rewritten.equals(insights);
            insights = rewritten;
        }

        if (result.partial()) {
            log.warn("Insights for {} are partial; failed rules: {}",
                    entityId != null ? entityId : "all parachains", result.failedCategories());
        }
        log.info("Generated {} insights for {} over {} days (rows={}, enhanced={})", insights.size(),
                entityId != null ? entityId : "all parachains", days, table.size(), enhanced);

        return InsightReport.builder()
                .entityId(entityId)
                .insights(insights)
                .summary(enhanced ? InsightEngine.summarize(insights) : result.summary())
                .confidence(result.confidence())
                .dataPointsAnalyzed(table.size())
                .timeRangeDays(days)
                .aiEnhanced(enhanced)
                .partial(result.partial())
                .failedCategories(result.failedCategories().stream().map(Enum::name).collect(Collectors.toList()))
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * Daily means per metric for one entity, or the per-day sum of every entity's daily
     * mean when {@code entityId} is null. An aggregate day is kept only when every
     * parachain reporting the metric in the window has a value for it, so a parachain
     * joining mid-window does not read as growth.
     */
    MetricTable buildTable(String entityId, int days) {
        Instant end = Instant.now();
        Instant start = end.minus(Duration.ofDays(days));
        List<String> entities = entityId != null ? List.of(entityId) : dataSource.findAllEntityIds();

        Map<String, Map<LocalDate, Double>> byMetric = new LinkedHashMap<>();
        TreeSet<LocalDate> allDays = new TreeSet<>();
        for (String metric : config.getInsights().getTrackedMetrics()) {
            Map<LocalDate, Double> totals = new TreeMap<>();
            Map<LocalDate, Integer> contributors = new HashMap<>();
            int reporting = 0;
            for (String entity : entities) {
                MetricSeries series = dataSource.fetchSeries(entity, metric, start, end, Integer.MAX_VALUE);
                Map<LocalDate, Double> means = dailyMeans(series);
                if (!means.isEmpty()) {
                    reporting++;
                }
                means.forEach((day, mean) -> {
                    totals.merge(day, mean, Double::sum);
                    contributors.merge(day, 1, Integer::sum);
                });
            }
            int required = reporting;
            int before = totals.size();
            totals.keySet().removeIf(day -> contributors.get(day) < required);
            if (totals.size() < before) {
                log.debug("Dropped {} incomplete days of {} across {} parachains", before - totals.size(),
                        metric, required);
            }
            if (!totals.isEmpty()) {
                byMetric.put(metric, totals);
                allDays.addAll(totals.keySet());
            }
        }

        List<Instant> timestamps = new ArrayList<>(allDays.size());
        for (LocalDate day : allDays) {
            timestamps.add(day.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, Map<LocalDate, Double>> metric : byMetric.entrySet()) {
            double[] column = new double[allDays.size()];
            int i = 0;
            for (LocalDate day : allDays) {
                column[i++] = metric.getValue().getOrDefault(day, Double.NaN);
            }
            columns.put(metric.getKey(), column);
        }
        return new MetricTable(entityId, timestamps, columns);
    }

    private static Map<LocalDate, Double> dailyMeans(MetricSeries series) {
        Map<LocalDate, double[]> sums = new HashMap<>();
        for (MetricPoint point : series.getPoints()) {
            if (point.isGap()) continue;
            LocalDate day = point.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
            double[] acc = sums.computeIfAbsent(day, d -> new double[2]);
            acc[0] += point.value();
            acc[1]++;
        }
        Map<LocalDate, Double> means = new HashMap<>();
        sums.forEach((day, acc) -> means.put(day, acc[0] / acc[1]));
        return means;
    }

    private List<String> outlook(String entityId, MetricTable table) {
        ForecastModelManager manager = forecastManager.getIfAvailable();
        if (manager == null) {
            return List.of();
        }
        int horizon = config.getInsights().getOutlookHorizonDays();
        List<String> sentences = new ArrayList<>();
        for (String metric : config.getInsights().getTrackedMetrics()) {
            double[] observed = table.values(metric);
            if (observed.length == 0 || !manager.isAvailable(entityId, metric, ModelKind.ENSEMBLE)) {
                continue;
            }
            try {
                ForecastResult forecast = manager.predict(entityId, metric, horizon, ModelKind.ENSEMBLE);
                outlookSentence(metric, observed[observed.length - 1], forecast, horizon)
                        .ifPresent(sentences::add);
            } catch (ModelUnavailableException e) {
                // removed between the availability check and the prediction
                log.warn("Skipping {} outlook for {}: {}", metric, entityId, e.getMessage());
            }
        }
        return sentences;
    }

    static Optional<String> outlookSentence(String metric, double lastObserved,
                                            ForecastResult forecast, int horizon) {
        List<ForecastPoint> points = forecast.getValues();
        if (lastObserved == 0.0 || points == null || points.isEmpty()) {
            return Optional.empty();
        }
        double projected = points.get(points.size() - 1).getPredictedValue();
        double changePct = (projected - lastObserved) / lastObserved * 100.0;
        String name = metric.toUpperCase(Locale.ROOT);
        int confidencePct = (int) Math.round(forecast.getConfidence() * 100);
        if (Math.abs(changePct) < 1.0) {
            return Optional.of(String.format(Locale.ROOT,
                    "%s is forecast to remain stable over the next %d days (%d%% confidence).",
                    name, horizon, confidencePct));
        }
        return Optional.of(String.format(Locale.ROOT,
                "%s is forecast to %s by %.1f%% over the next %d days (%d%% confidence).",
                name, changePct > 0 ? "rise" : "fall", Math.abs(changePct), horizon, confidencePct));
    }
}
