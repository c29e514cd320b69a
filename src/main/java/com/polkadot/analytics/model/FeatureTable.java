package com.polkadot.analytics.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Model-ready rows derived from a {@link MetricSeries}, ordered by timestamp ascending.
 * Every row is fully populated; rows without enough history are never zero-filled.
 */
public final class FeatureTable {

    public static final String VALUE_COLUMN = "value";

    public static final String[] FEATURE_NAMES = {
            "hour", "day_of_week", "day_of_month", "month", "quarter", "is_weekend",
            "lag_1", "lag_7", "lag_30",
            "rolling_mean_7", "rolling_std_7", "rolling_mean_30"
    };

    public static final int FEATURE_COUNT = FEATURE_NAMES.length;

    private final String entityId;
    private final String metric;
    private final List<FeatureRow> rows;

    public FeatureTable(String entityId, String metric, List<FeatureRow> rows) {
        this.entityId = entityId;
        this.metric = metric;
        this.rows = Collections.unmodifiableList(rows);
    }

    public static FeatureTable empty(String entityId, String metric) {
        return new FeatureTable(entityId, metric, List.of());
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetric() {
        return metric;
    }

    public List<FeatureRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public double[][] featureMatrix() {
        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            matrix[i] = rows.get(i).features();
        }
        return matrix;
    }

    public double[] values() {
        return rows.stream().mapToDouble(FeatureRow::value).toArray();
    }

    /**
     * Rows with a timestamp at or after {@code from}.
     */
    public FeatureTable since(Instant from) {
        List<FeatureRow> kept = rows.stream()
                .filter(row -> !row.timestamp().isBefore(from))
                .collect(Collectors.toList());
        return new FeatureTable(entityId, metric, kept);
    }
}
