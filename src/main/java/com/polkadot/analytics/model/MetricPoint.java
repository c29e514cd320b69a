package com.polkadot.analytics.model;

import java.time.Instant;

/**
 * One observation of a metric. A {@code NaN} value marks a gap.
 */
public record MetricPoint(Instant timestamp, double value) {

    public boolean isGap() {
        return Double.isNaN(value);
    }
}
