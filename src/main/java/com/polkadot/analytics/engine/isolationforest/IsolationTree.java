package com.polkadot.analytics.engine.isolationforest;

import java.util.Random;

/**
 * One randomly split tree of an {@link IsolationForest}.
 */
public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(split(data, 0, maxDepth, random));
    }

    private static IsolationNode split(double[][] rows, int depth, int maxDepth, Random random) {
        int n = rows.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        int feature = random.nextInt(rows[0].length);

        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            lo = Math.min(lo, row[feature]);
            hi = Math.max(hi, row[feature]);
        }

        // constant on the chosen feature: cannot be split further
        if (lo >= hi) {
            return IsolationNode.externalNode(n);
        }

        double threshold = lo + random.nextDouble() * (hi - lo);

        int below = 0;
        for (double[] row : rows) {
            if (row[feature] < threshold) below++;
        }
        double[][] left = new double[below][];
        double[][] right = new double[n - below][];
        int li = 0;
        int ri = 0;
        for (double[] row : rows) {
            if (row[feature] < threshold) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }

        return IsolationNode.internalNode(feature, threshold,
                split(left, depth + 1, maxDepth, random),
                split(right, depth + 1, maxDepth, random));
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
