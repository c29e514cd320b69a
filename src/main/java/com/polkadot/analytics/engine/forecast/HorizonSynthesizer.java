package com.polkadot.analytics.engine.forecast;

import com.polkadot.analytics.engine.features.FeaturePipeline;
import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.model.FeatureRow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds future feature rows one day at a time and predicts them recursively.
 *
 * <p>Each predicted value is appended to the history and feeds the lags and rolling
 * statistics of the following days. A row only reads values before its own position,
 * so every future row is built once, exactly as the pipeline would have built it.
 */
public final class HorizonSynthesizer {

    private final Regressor regressor;
    private final FeatureScaler scaler;

    public HorizonSynthesizer(Regressor regressor, FeatureScaler scaler) {
        this.regressor = regressor;
        this.scaler = scaler;
    }

    /**
     * @param history observed values in time order, at least {@link FeaturePipeline#MAX_LAG} long
     * @param anchor  instant the horizon starts from; day {@code d} is {@code anchor + d days}
     * @param horizon number of days to predict
     */
    public Synthesis synthesize(double[] history, Instant anchor, int horizon) {
        if (history.length < FeaturePipeline.MAX_LAG) {
            throw new IllegalArgumentException("Need at least " + FeaturePipeline.MAX_LAG
                    + " historical values, got " + history.length);
        }
        double[] values = Arrays.copyOf(history, history.length + horizon);
        List<Instant> timestamps = new ArrayList<>(horizon);
        double[] predictions = new double[horizon];
        double[][] standardized = new double[horizon][];

        for (int d = 0; d < horizon; d++) {
            int position = history.length + d;
            Instant timestamp = anchor.plus(Duration.ofDays(d + 1L));

            FeatureRow row = FeaturePipeline.buildRow(timestamp, values, position);
            double[] scaled = scaler.transform(row.features());
            double predicted = regressor.predict(scaled);
            if (!Double.isFinite(predicted)) {
                throw new IllegalStateException("Non-finite prediction for day " + (d + 1));
            }
            values[position] = predicted;
            standardized[d] = scaled;
            predictions[d] = predicted;
            timestamps.add(timestamp);
        }
        return new Synthesis(timestamps, predictions, standardized);
    }

    /**
     * Heuristic confidence from the dispersion of the standardized future rows:
     * {@code clamp(1 - meanColumnVariance / 10, 0.1, 0.95)}.
     */
    public static double confidence(double[][] standardizedRows) {
        if (standardizedRows.length == 0) {
            return 0.1;
        }
        int width = standardizedRows[0].length;
        double totalVariance = 0;
        for (int c = 0; c < width; c++) {
            double mean = 0;
            for (double[] row : standardizedRows) {
                mean += row[c];
            }
            mean /= standardizedRows.length;
            double squares = 0;
            for (double[] row : standardizedRows) {
                double d = row[c] - mean;
                squares += d * d;
            }
            totalVariance += squares / standardizedRows.length;
        }
        double confidence = 1.0 - (totalVariance / width) / 10.0;
        return Math.max(0.1, Math.min(0.95, confidence));
    }

    public record Synthesis(List<Instant> timestamps, double[] values, double[][] standardizedRows) {
    }
}
