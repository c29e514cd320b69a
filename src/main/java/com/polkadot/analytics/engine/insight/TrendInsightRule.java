package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.model.MetricTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Compares the mean of the first and second half of each tracked metric and reports
 * changes larger than 5%.
 */
@Component
public class TrendInsightRule implements InsightRule {

    static final int MIN_VALUES = 7;
    private static final double SIGNIFICANT_CHANGE_PCT = 5.0;

    private final AnalyticsConfig config;

    public TrendInsightRule(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public InsightCategory getCategory() {
        return InsightCategory.TREND;
    }

    @Override
    public List<String> evaluate(MetricTable table) {
        List<String> insights = new ArrayList<>();
        for (String metric : config.getInsights().getTrackedMetrics()) {
            double[] values = table.values(metric);
            if (values.length < MIN_VALUES) {
                continue;
            }
            int half = values.length / 2;
            double firstHalf = mean(Arrays.copyOfRange(values, 0, half));
            double secondHalf = mean(Arrays.copyOfRange(values, half, values.length));
            if (firstHalf == 0.0) {
                continue;
            }
            double changePct = (secondHalf - firstHalf) / firstHalf * 100.0;
            if (Math.abs(changePct) > SIGNIFICANT_CHANGE_PCT) {
                boolean up = changePct > 0;
                insights.add(String.format(Locale.ROOT,
                        "%s has %s by %.1f%% over the past %d days, indicating %s momentum.",
                        metric.toUpperCase(Locale.ROOT), up ? "increased" : "decreased",
                        Math.abs(changePct), table.size(), up ? "growth" : "decline"));
            }
        }
        return insights;
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
