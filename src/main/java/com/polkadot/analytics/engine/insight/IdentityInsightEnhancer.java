package com.polkadot.analytics.engine.insight;

import java.util.List;

public class IdentityInsightEnhancer implements InsightEnhancer {

    @Override
    public List<String> enhance(List<String> insights, String entityId, int timeRangeDays) {
        return insights;
    }

    @Override
    public boolean isActive() {
        return false;
    }
}
