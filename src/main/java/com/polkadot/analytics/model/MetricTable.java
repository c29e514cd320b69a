package com.polkadot.analytics.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Daily metric values aligned on a shared timestamp axis, one column per tracked
 * metric. A {@code NaN} cell means the metric had no observation that day. The
 * entity id is absent for aggregate (all-parachain) tables.
 */
public final class MetricTable {

    private final String entityId;
    private final List<Instant> timestamps;
    private final Map<String, double[]> columns;

    public MetricTable(String entityId, List<Instant> timestamps, Map<String, double[]> columns) {
        for (Map.Entry<String, double[]> column : columns.entrySet()) {
            if (column.getValue().length != timestamps.size()) {
                throw new IllegalArgumentException("Column " + column.getKey() + " has "
                        + column.getValue().length + " values for " + timestamps.size() + " timestamps");
            }
        }
        this.entityId = entityId;
        this.timestamps = List.copyOf(timestamps);
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public Optional<String> getEntityId() {
        return Optional.ofNullable(entityId);
    }

    public boolean isEntityScoped() {
        return entityId != null;
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public boolean hasMetric(String metric) {
        return columns.containsKey(metric);
    }

    /**
     * Defined values of a column, in timestamp order.
     */
    public double[] values(String metric) {
        double[] column = columns.get(metric);
        if (column == null) {
            return new double[0];
        }
        return Arrays.stream(column).filter(v -> !Double.isNaN(v)).toArray();
    }

    /**
     * Timestamps of the defined values of a column, aligned with {@link #values(String)}.
     */
    public List<Instant> timestampsOf(String metric) {
        double[] column = columns.get(metric);
        if (column == null) {
            return List.of();
        }
        List<Instant> defined = new ArrayList<>();
        for (int i = 0; i < column.length; i++) {
            if (!Double.isNaN(column[i])) {
                defined.add(timestamps.get(i));
            }
        }
        return defined;
    }
}
