package com.polkadot.analytics.engine.insight;

import java.util.List;

/**
 * Optional rewrite step applied to rule-based insights before they are returned.
 * Implementations must fall back to the input list on any failure.
 */
public interface InsightEnhancer {

    List<String> enhance(List<String> insights, String entityId, int timeRangeDays);

    /**
     * Whether {@link #enhance} actually rewrites anything.
     */
    boolean isActive();
}
