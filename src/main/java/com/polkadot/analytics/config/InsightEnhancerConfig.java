package com.polkadot.analytics.config;

import com.polkadot.analytics.engine.insight.GenerativeInsightEnhancer;
import com.polkadot.analytics.engine.insight.IdentityInsightEnhancer;
import com.polkadot.analytics.engine.insight.InsightEnhancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InsightEnhancerConfig {

    private static final Logger log = LoggerFactory.getLogger(InsightEnhancerConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "analytics.insights.enhancer", name = "enabled", havingValue = "true")
    public InsightEnhancer generativeInsightEnhancer(AnalyticsConfig config) {
        AnalyticsConfig.Enhancer enhancer = config.getInsights().getEnhancer();
        if (enhancer.getApiKey() == null || enhancer.getApiKey().isBlank()) {
            log.warn("Insight enhancer enabled without an API key; using rule-based insights only");
            return new IdentityInsightEnhancer();
        }
        log.info("Insight enhancer initialized. Model: {}, endpoint: {}", enhancer.getModel(), enhancer.getEndpoint());
        return new GenerativeInsightEnhancer(enhancer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "analytics.insights.enhancer", name = "enabled", havingValue = "false",
            matchIfMissing = true)
    public InsightEnhancer identityInsightEnhancer() {
        log.info("Insight enhancer is DISABLED.");
        return new IdentityInsightEnhancer();
    }
}
