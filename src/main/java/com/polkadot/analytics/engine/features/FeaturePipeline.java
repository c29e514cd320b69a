package com.polkadot.analytics.engine.features;

import com.polkadot.analytics.model.FeatureRow;
import com.polkadot.analytics.model.FeatureTable;
import com.polkadot.analytics.model.MetricPoint;
import com.polkadot.analytics.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw metric series into a model-ready {@link FeatureTable}.
 *
 * <p>Steps, in order: sort, fill gaps in the value column, drop values that are still
 * undefined, derive UTC calendar features, lag 1/7/30, trailing rolling statistics
 * over the observations before each row, then drop the rows whose lags are undefined.
 * The pipeline is stateless; rows are never zero-filled.
 *
 * <p>A row's features never contain its own value, so a forecast row can be built from
 * known and already-predicted values alone.
 */
@Component
public class FeaturePipeline {

    private static final Logger log = LoggerFactory.getLogger(FeaturePipeline.class);

    public static final int[] LAGS = {1, 7, 30};
    public static final int SHORT_WINDOW = 7;
    public static final int LONG_WINDOW = 30;
    public static final int MAX_LAG = 30;

    public FeatureTable derive(MetricSeries series, String fillMethod) {
        return derive(series, FillMethod.fromCode(fillMethod));
    }

    public FeatureTable derive(MetricSeries series, FillMethod fillMethod) {
        if (series.isEmpty()) {
            return FeatureTable.empty(series.getEntityId(), series.getMetric());
        }

        // MetricSeries is already sorted and free of duplicate timestamps
        List<MetricPoint> points = series.getPoints();
        double[] raw = new double[points.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = points.get(i).value();
        }
        double[] filled = fillMethod.fill(raw);

        List<Instant> timestamps = new ArrayList<>(filled.length);
        List<Double> kept = new ArrayList<>(filled.length);
        for (int i = 0; i < filled.length; i++) {
            if (!Double.isNaN(filled[i])) {
                timestamps.add(points.get(i).timestamp());
                kept.add(filled[i]);
            }
        }
        double[] values = kept.stream().mapToDouble(Double::doubleValue).toArray();

        List<FeatureRow> rows = new ArrayList<>(Math.max(0, values.length - MAX_LAG));
        for (int i = MAX_LAG; i < values.length; i++) {
            rows.add(buildRow(timestamps.get(i), values, i));
        }

        log.debug("Derived {} feature rows from {} points for {}/{} (fill={}, dropped={})",
                rows.size(), points.size(), series.getEntityId(), series.getMetric(),
                fillMethod.getCode(), values.length - rows.size());
        return new FeatureTable(series.getEntityId(), series.getMetric(), rows);
    }

    /**
     * Builds the row for position {@code i} of {@code values}. Requires at least
     * {@link #MAX_LAG} values before {@code i}.
     */
    public static FeatureRow buildRow(Instant timestamp, double[] values, int i) {
        ZonedDateTime t = timestamp.atZone(ZoneOffset.UTC);
        int dayOfWeek = t.getDayOfWeek().getValue() - 1;
        return new FeatureRow(
                timestamp,
                values[i],
                t.getHour(),
                dayOfWeek,
                t.getDayOfMonth(),
                t.getMonthValue(),
                (t.getMonthValue() - 1) / 3 + 1,
                dayOfWeek >= 5 ? 1 : 0,
                values[i - 1],
                values[i - 7],
                values[i - 30],
                rollingMean(values, i, SHORT_WINDOW),
                rollingStd(values, i, SHORT_WINDOW),
                rollingMean(values, i, LONG_WINDOW));
    }

    // mean of the up-to-window values before position end
    static double rollingMean(double[] values, int end, int window) {
        int start = Math.max(0, end - window);
        if (start >= end) {
            return Double.NaN;
        }
        double sum = 0;
        for (int j = start; j < end; j++) {
            sum += values[j];
        }
        return sum / (end - start);
    }

    // sample standard deviation of the same window; a single observation has std 0
    static double rollingStd(double[] values, int end, int window) {
        int start = Math.max(0, end - window);
        int n = end - start;
        if (n < 1) {
            return Double.NaN;
        }
        if (n < 2) {
            return 0.0;
        }
        double mean = rollingMean(values, end, window);
        double squares = 0;
        for (int j = start; j < end; j++) {
            double d = values[j] - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (n - 1));
    }
}
