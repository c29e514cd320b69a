package com.polkadot.analytics.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Time-ordered observations of one metric for one entity. Timestamps are strictly
 * increasing: points are sorted on construction and a repeated timestamp keeps the
 * value that appeared last in the input.
 */
public final class MetricSeries {

    private final String entityId;
    private final String metric;
    private final List<MetricPoint> points;

    private MetricSeries(String entityId, String metric, List<MetricPoint> points) {
        this.entityId = entityId;
        this.metric = metric;
        this.points = points;
    }

    public static MetricSeries of(String entityId, String metric, List<MetricPoint> points) {
        Objects.requireNonNull(points, "points");
        List<MetricPoint> sorted = new ArrayList<>(points);
        // stable sort keeps input order among equal timestamps
        sorted.sort(Comparator.comparing(MetricPoint::timestamp));

        List<MetricPoint> deduped = new ArrayList<>(sorted.size());
        for (MetricPoint point : sorted) {
            int last = deduped.size() - 1;
            if (last >= 0 && deduped.get(last).timestamp().equals(point.timestamp())) {
                deduped.set(last, point);
            } else {
                deduped.add(point);
            }
        }
        return new MetricSeries(entityId, metric, Collections.unmodifiableList(deduped));
    }

    public static MetricSeries empty(String entityId, String metric) {
        return new MetricSeries(entityId, metric, List.of());
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetric() {
        return metric;
    }

    public List<MetricPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
