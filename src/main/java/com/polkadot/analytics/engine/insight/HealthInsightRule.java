package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.model.MetricTable;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Composite health of a single parachain from three indicators: TVL growth above 10%,
 * transaction CV below 50% and user growth above 5%. Only indicators with enough data
 * count towards the score. Not applied to ecosystem-wide tables.
 */
@Component
public class HealthInsightRule implements InsightRule {

    private static final double TVL_GROWTH = 0.10;
    private static final double MAX_TRANSACTION_CV = 0.5;
    private static final double USER_GROWTH = 0.05;

    private final AnalyticsConfig config;

    public HealthInsightRule(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public InsightCategory getCategory() {
        return InsightCategory.HEALTH;
    }

    @Override
    public List<String> evaluate(MetricTable table) {
        if (!table.isEntityScoped()) {
            return List.of();
        }
        AnalyticsConfig.Insights settings = config.getInsights();
        int positive = 0;
        int factors = 0;

        double[] tvl = table.values(settings.getTvlMetric());
        if (tvl.length > 1 && tvl[0] != 0.0) {
            if (growth(tvl) > TVL_GROWTH) positive++;
            factors++;
        }

        double[] transactions = table.values(settings.getTransactionsMetric());
        if (transactions.length > 1) {
            double mean = TrendInsightRule.mean(transactions);
            double cv = mean > 0 ? new StandardDeviation(true).evaluate(transactions) / mean : 1.0;
            if (cv < MAX_TRANSACTION_CV) positive++;
            factors++;
        }

        double[] users = table.values(settings.getUsersMetric());
        if (users.length > 1 && users[0] != 0.0) {
            if (growth(users) > USER_GROWTH) positive++;
            factors++;
        }

        if (factors == 0) {
            return List.of();
        }
        double healthPct = 100.0 * positive / factors;
        String entityId = table.getEntityId().orElseThrow();
        if (healthPct >= 70) {
            return List.of(String.format(Locale.ROOT,
                    "Parachain %s shows strong overall health with %.0f%% of indicators trending positively.",
                    entityId, healthPct));
        }
        if (healthPct <= 30) {
            return List.of(String.format(Locale.ROOT,
                    "Parachain %s requires attention with only %.0f%% of health indicators showing positive trends.",
                    entityId, healthPct));
        }
        return List.of();
    }

    private static double growth(double[] values) {
        return (values[values.length - 1] - values[0]) / values[0];
    }
}
