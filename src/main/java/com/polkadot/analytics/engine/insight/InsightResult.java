package com.polkadot.analytics.engine.insight;

import java.util.List;

/**
 * Engine output. {@code failedCategories} lists the rules that threw; their insights
 * are missing from {@code insights}.
 */
public record InsightResult(List<String> insights, String summary, double confidence,
                            List<InsightCategory> failedCategories) {

    public InsightResult(List<String> insights, String summary, double confidence) {
        this(insights, summary, confidence, List.of());
    }

    public boolean partial() {
        return !failedCategories.isEmpty();
    }
}
