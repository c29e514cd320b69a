package com.polkadot.analytics.engine.features;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Per-column standardization {@code (x - mean) / scale}. Scale is the population
 * standard deviation of the fitted column, or 1 for a constant column. A column whose
 * spread is only rounding noise relative to its mean counts as constant.
 */
public class FeatureScaler implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final double CONSTANT_TOLERANCE = 1e-9;

    @JsonProperty("mean")
    private final double[] mean;

    @JsonProperty("scale")
    private final double[] scale;

    @JsonCreator
    public FeatureScaler(@JsonProperty("mean") double[] mean, @JsonProperty("scale") double[] scale) {
        if (mean.length != scale.length) {
            throw new IllegalArgumentException("mean and scale must have the same width");
        }
        this.mean = mean;
        this.scale = scale;
    }

    public static FeatureScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty matrix");
        }
        int width = data[0].length;
        double[] mean = new double[width];
        double[] scale = new double[width];
        for (int c = 0; c < width; c++) {
            double sum = 0;
            for (double[] row : data) {
                sum += row[c];
            }
            mean[c] = sum / data.length;

            double squares = 0;
            for (double[] row : data) {
                double d = row[c] - mean[c];
                squares += d * d;
            }
            double std = Math.sqrt(squares / data.length);
            scale[c] = std <= CONSTANT_TOLERANCE * Math.max(1.0, Math.abs(mean[c])) ? 1.0 : std;
        }
        return new FeatureScaler(mean, scale);
    }

    public double[] transform(double[] row) {
        if (row.length != mean.length) {
            throw new IllegalArgumentException("Expected " + mean.length + " features, got " + row.length);
        }
        double[] out = new double[row.length];
        for (int c = 0; c < row.length; c++) {
            out[c] = (row[c] - mean[c]) / scale[c];
        }
        return out;
    }

    public double[][] transform(double[][] data) {
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = transform(data[i]);
        }
        return out;
    }

    public int width() {
        return mean.length;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getScale() {
        return scale.clone();
    }
}
