package com.polkadot.analytics.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tree node, serialized with short property names to keep anomaly artifacts compact.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    // samples that reached a leaf
    @JsonProperty("s")
    private int size;

    @JsonProperty("e")
    private boolean external;

    public IsolationNode() {}

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        return node;
    }

    public static IsolationNode externalNode(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.external = true;
        return node;
    }

    public double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful BST search over {@code n} items:
     * c(n) = 2H(n-1) - 2(n-1)/n with H(i) approximated by ln(i) + gamma.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isExternal() { return external; }
}
