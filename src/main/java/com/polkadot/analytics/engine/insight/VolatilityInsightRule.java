package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.model.MetricTable;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coefficient of variation (sample std over mean, in percent) per tracked metric.
 * Above 30 is reported as volatile, below 10 as stable. A series without spread says
 * nothing about stability and is skipped.
 */
@Component
public class VolatilityInsightRule implements InsightRule {

    private static final double HIGH_CV = 30.0;
    private static final double LOW_CV = 10.0;

    private final AnalyticsConfig config;

    public VolatilityInsightRule(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public InsightCategory getCategory() {
        return InsightCategory.VOLATILITY;
    }

    @Override
    public List<String> evaluate(MetricTable table) {
        List<String> insights = new ArrayList<>();
        for (String metric : config.getInsights().getTrackedMetrics()) {
            double[] values = table.values(metric);
            if (values.length < TrendInsightRule.MIN_VALUES) {
                continue;
            }
            double mean = TrendInsightRule.mean(values);
            double std = new StandardDeviation(true).evaluate(values);
            if (mean <= 0 || std == 0.0) {
                continue;
            }
            double cv = std / mean * 100.0;
            String name = metric.toUpperCase(Locale.ROOT);
            if (cv > HIGH_CV) {
                insights.add(String.format(Locale.ROOT,
                        "%s shows high volatility (%.1f%% coefficient of variation), "
                                + "suggesting unstable market conditions.", name, cv));
            } else if (cv < LOW_CV) {
                insights.add(String.format(Locale.ROOT,
                        "%s is relatively stable (%.1f%% coefficient of variation), "
                                + "indicating consistent performance.", name, cv));
            }
        }
        return insights;
    }
}
