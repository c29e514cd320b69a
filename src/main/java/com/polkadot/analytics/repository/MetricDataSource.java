package com.polkadot.analytics.repository;

import com.polkadot.analytics.model.MetricPoint;
import com.polkadot.analytics.model.MetricSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read (and seed) access to stored parachain metric observations.
 */
public interface MetricDataSource {

    /**
     * Observations with {@code start <= timestamp <= end}, keeping the latest {@code limit}
     * points when more are stored. The returned series is sorted ascending.
     */
    MetricSeries fetchSeries(String entityId, String metric, Instant start, Instant end, int limit);

    /**
     * Observations from the last {@code lookback} up to now.
     */
    default MetricSeries fetchRecentWindow(String entityId, String metric, Duration lookback) {
        Instant now = Instant.now();
        return fetchSeries(entityId, metric, now.minus(lookback), now, Integer.MAX_VALUE);
    }

    List<String> findAllEntityIds();

    List<String> findAvailableMetrics();

    void save(String entityId, String metric, MetricPoint point);
}
