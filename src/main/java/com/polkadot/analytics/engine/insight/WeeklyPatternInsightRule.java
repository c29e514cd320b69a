package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.model.MetricTable;
import org.apache.commons.math3.stat.inference.OneWayAnova;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One-way ANOVA of each tracked metric across UTC day-of-week buckets. A p-value
 * below 0.05 is reported together with the weekday that has the highest mean.
 */
@Component
public class WeeklyPatternInsightRule implements InsightRule {

    private static final Logger log = LoggerFactory.getLogger(WeeklyPatternInsightRule.class);

    static final int MIN_VALUES = 14;
    private static final double ALPHA = 0.05;

    private final AnalyticsConfig config;

    public WeeklyPatternInsightRule(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public InsightCategory getCategory() {
        return InsightCategory.PATTERN;
    }

    @Override
    public List<String> evaluate(MetricTable table) {
        List<String> insights = new ArrayList<>();
        for (String metric : config.getInsights().getTrackedMetrics()) {
            double[] values = table.values(metric);
            if (values.length < MIN_VALUES) {
                continue;
            }
            peakDay(values, table.timestampsOf(metric)).ifPresent(day -> insights.add(String.format(Locale.ROOT,
                    "%s shows a weekly pattern with peak activity typically on %ss.",
                    metric.toUpperCase(Locale.ROOT), day.getDisplayName(TextStyle.FULL, Locale.ENGLISH))));
        }
        return insights;
    }

    /**
     * The weekday with the highest mean, when the weekday effect is significant.
     */
    Optional<DayOfWeek> peakDay(double[] values, List<Instant> timestamps) {
        Map<DayOfWeek, List<Double>> buckets = new EnumMap<>(DayOfWeek.class);
        for (int i = 0; i < values.length; i++) {
            DayOfWeek day = timestamps.get(i).atZone(ZoneOffset.UTC).getDayOfWeek();
            buckets.computeIfAbsent(day, d -> new ArrayList<>()).add(values[i]);
        }

        List<double[]> groups = new ArrayList<>();
        for (List<Double> bucket : buckets.values()) {
            if (bucket.size() >= 2) {
                groups.add(bucket.stream().mapToDouble(Double::doubleValue).toArray());
            }
        }
        if (groups.size() < 2 || isFlat(values)) {
            return Optional.empty();
        }

        double pValue;
        try {
            pValue = new OneWayAnova().anovaPValue(groups);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.debug("Weekly pattern test not applicable: {}", e.getMessage());
            return Optional.empty();
        }
        if (Double.isNaN(pValue) || pValue >= ALPHA) {
            return Optional.empty();
        }

        DayOfWeek peak = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<DayOfWeek, List<Double>> bucket : buckets.entrySet()) {
            double mean = bucket.getValue().stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
            if (mean > best) {
                best = mean;
                peak = bucket.getKey();
            }
        }
        return Optional.ofNullable(peak);
    }

    private static boolean isFlat(double[] values) {
        for (double v : values) {
            if (v != values[0]) {
                return false;
            }
        }
        return true;
    }
}
