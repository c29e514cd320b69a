package com.polkadot.analytics.model;

import java.time.Instant;

/**
 * One fully populated row of a {@link FeatureTable}.
 */
public record FeatureRow(Instant timestamp,
                         double value,
                         int hour,
                         int dayOfWeek,
                         int dayOfMonth,
                         int month,
                         int quarter,
                         int isWeekend,
                         double lag1,
                         double lag7,
                         double lag30,
                         double rollingMean7,
                         double rollingStd7,
                         double rollingMean30) {

    /**
     * Model inputs in {@link FeatureTable#FEATURE_NAMES} order (everything except {@code value}).
     */
    public double[] features() {
        return new double[]{
                hour, dayOfWeek, dayOfMonth, month, quarter, isWeekend,
                lag1, lag7, lag30,
                rollingMean7, rollingStd7, rollingMean30
        };
    }
}
