package com.polkadot.analytics.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over standardized feature rows.
 *
 * <p>After training, the forest is calibrated against its own training data: the
 * offset is chosen so that roughly {@code contamination} of the training rows get a
 * negative decision value. Scoring then follows the usual convention where a negative
 * {@link #decisionFunction(double[])} means outlier.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest {

    private List<IsolationTree> trees;
    private int sampleSize;
    private double offset = -0.5;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * Train the forest and calibrate its decision threshold.
     *
     * @param data          training samples, each row is a feature vector
     * @param numTrees      number of trees in the forest (typically 100)
     * @param sampleSize    sub-sampling size per tree (typically 256)
     * @param contamination expected share of outliers in {@code data}, in (0, 0.5]
     * @param seed          random seed for reproducibility
     */
    public void train(double[][] data, int numTrees, int sampleSize, double contamination, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on no data");
        }
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(2, this.sampleSize)) / Math.log(2));
        this.trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, this.sampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }

        calibrate(data, contamination);
    }

    private void calibrate(double[][] data, double contamination) {
        double[] negated = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            negated[i] = -anomalyScore(data[i]);
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        this.offset = percentile.evaluate(negated, 100.0 * contamination);
    }

    /**
     * Raw anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous)
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * Calibrated decision value: negative for outliers, positive for inliers.
     */
    public double decisionFunction(double[] point) {
        return -anomalyScore(point) - offset;
    }

    public boolean isOutlier(double[] point) {
        return decisionFunction(point) < 0;
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    // Getters/setters for serialization
    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
    public double getOffset() { return offset; }
    public void setOffset(double offset) { this.offset = offset; }
}
