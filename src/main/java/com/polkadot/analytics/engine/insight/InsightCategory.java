package com.polkadot.analytics.engine.insight;

/**
 * Insight families, declared in the order their sentences appear in a report.
 */
public enum InsightCategory {
    TREND,
    VOLATILITY,
    PATTERN,
    HEALTH,
    OUTLOOK
}
