package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.model.MetricTable;

import java.util.List;

/**
 * One family of rule-based observations over a metric table.
 * Each implementation handles a single {@link InsightCategory}.
 */
public interface InsightRule {

    InsightCategory getCategory();

    /**
     * @return the sentences this rule emits for {@code table}, possibly none
     */
    List<String> evaluate(MetricTable table);
}
