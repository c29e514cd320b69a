package com.polkadot.analytics.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.polkadot.analytics.config.AerospikeConfig;
import com.polkadot.analytics.model.MetricPoint;
import com.polkadot.analytics.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Metric points live in {@link AerospikeConfig#SET_METRIC_POINTS}, one record per
 * (entity, metric, timestamp). Known parachains are registered in
 * {@link AerospikeConfig#SET_PARACHAINS} when their first point is written.
 */
@Repository
public class AerospikeMetricRepository implements MetricDataSource {

    private static final Logger log = LoggerFactory.getLogger(AerospikeMetricRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AerospikeMetricRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    @Override
    public void save(String entityId, String metric, MetricPoint point) {
        long ts = point.timestamp().toEpochMilli();
        Key key = new Key(namespace, AerospikeConfig.SET_METRIC_POINTS, pointKey(entityId, metric, ts));
        client.put(writePolicy, key,
                new Bin("entityId", entityId),
                new Bin("metric", metric),
                new Bin("ts", ts),
                new Bin("value", point.value()));

        Key parachain = new Key(namespace, AerospikeConfig.SET_PARACHAINS, entityId);
        client.put(writePolicy, parachain, new Bin("entityId", entityId));
    }

    @Override
    public MetricSeries fetchSeries(String entityId, String metric, Instant start, Instant end, int limit) {
        long from = start.toEpochMilli();
        long to = end.toEpochMilli();
        List<MetricPoint> points = new ArrayList<>();

        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_METRIC_POINTS,
                (key, record) -> {
                    if (!entityId.equals(record.getString("entityId"))
                            || !metric.equals(record.getString("metric"))) {
                        return;
                    }
                    long ts = record.getLong("ts");
                    if (ts < from || ts > to) return;
                    synchronized (points) {
                        points.add(new MetricPoint(Instant.ofEpochMilli(ts), record.getDouble("value")));
                    }
                });

        points.sort(Comparator.comparing(MetricPoint::timestamp));
        List<MetricPoint> window = points.size() > limit
                ? new ArrayList<>(points.subList(points.size() - limit, points.size()))
                : points;

        log.debug("Fetched {} points for {}/{} in [{}, {}]", window.size(), entityId, metric, start, end);
        return MetricSeries.of(entityId, metric, window);
    }

    @Override
    public List<String> findAllEntityIds() {
        Set<String> ids = new TreeSet<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_PARACHAINS,
                (key, record) -> {
                    synchronized (ids) {
                        ids.add(record.getString("entityId"));
                    }
                });
        return new ArrayList<>(ids);
    }

    @Override
    public List<String> findAvailableMetrics() {
        Set<String> metrics = new TreeSet<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_METRIC_POINTS,
                (key, record) -> {
                    String metric = record.getString("metric");
                    if (metric == null) return;
                    synchronized (metrics) {
                        metrics.add(metric);
                    }
                });
        return new ArrayList<>(metrics);
    }

    private static String pointKey(String entityId, String metric, long ts) {
        return entityId + "|" + metric + "|" + ts;
    }

    private static ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.maxRecords = 0;
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }
}
