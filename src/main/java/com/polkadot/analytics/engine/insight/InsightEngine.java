package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.config.MetricsConfig;
import com.polkadot.analytics.model.MetricTable;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered {@link InsightRule} over a metric table and assembles the
 * report: rule output in category order, caller-supplied outlook sentences last,
 * capped at the configured maximum, plus a one-paragraph summary. A rule that throws
 * is logged and reported in {@link InsightResult#failedCategories()}; the other rules
 * still run.
 */
@Component
public class InsightEngine {

    private static final Logger log = LoggerFactory.getLogger(InsightEngine.class);

    static final String NO_DATA = "No data available for analysis";
    static final String NO_INSIGHTS = "No significant insights available at this time.";

    private final List<InsightRule> rules;
    private final AnalyticsConfig config;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public InsightEngine(List<InsightRule> rules, AnalyticsConfig config, Tracer tracer,
                         MetricsConfig metricsConfig) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparing(InsightRule::getCategory));
        this.config = config;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (InsightRule rule : this.rules) {
            log.info("Registered insight rule: {} -> {}", rule.getCategory(), rule.getClass().getSimpleName());
        }
    }

    public InsightResult generate(MetricTable table) {
        return generate(table, List.of());
    }

    @Observed(name = "insights.generate", contextualName = "generate-insights")
    public InsightResult generate(MetricTable table, List<String> outlook) {
        AnalyticsConfig.Insights settings = config.getInsights();
        if (table.isEmpty()) {
            List<String> none = List.of(NO_DATA);
            return new InsightResult(none, summarize(none), settings.getConfidence());
        }

        List<String> insights = new ArrayList<>();
        List<InsightCategory> failed = new ArrayList<>();
        for (InsightRule rule : rules) {
            Span span = tracer.nextSpan()
                    .name("insight.rule." + rule.getCategory())
                    .tag("insight.category", rule.getCategory().name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<String> emitted = rule.evaluate(table);
                insights.addAll(emitted);
                span.tag("insight.emitted", String.valueOf(emitted.size()));
                metricsConfig.recordInsightRule(rule.getCategory().name(), emitted.size());
            } catch (Exception e) {
                span.error(e);
                failed.add(rule.getCategory());
                log.error("Insight rule {} failed for {}: {}", rule.getCategory(),
                        table.getEntityId().orElse("all parachains"), e.getMessage(), e);
            } finally {
                span.end();
            }
        }
        insights.addAll(outlook);
        if (!outlook.isEmpty()) {
            metricsConfig.recordInsightRule(InsightCategory.OUTLOOK.name(), outlook.size());
        }

        List<String> capped = insights.size() > settings.getMaxInsights()
                ? List.copyOf(insights.subList(0, settings.getMaxInsights()))
                : List.copyOf(insights);
        return new InsightResult(capped, summarize(capped), settings.getConfidence(), List.copyOf(failed));
    }

    public static String summarize(List<String> insights) {
        if (insights.isEmpty()) {
            return NO_INSIGHTS;
        }
        if (insights.size() == 1) {
            return insights.get(0);
        }
        StringBuilder summary = new StringBuilder("Analysis revealed ")
                .append(insights.size())
                .append(" key insights: ")
                .append(String.join(", ", insights.subList(0, Math.min(3, insights.size()))));
        if (insights.size() > 3) {
            summary.append(", and ").append(insights.size() - 3).append(" additional observations.");
        }
        return summary.toString();
    }
}
