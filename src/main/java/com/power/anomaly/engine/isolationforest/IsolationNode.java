package com.power.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One slot of an {@link IsolationTree} arena. Internal nodes reference their children by
 * index into the same arena; leaves keep the number of training rows that ended there.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IsolationNode {

    public enum Type { INTERNAL, LEAF }

    @JsonProperty("t")
    private final Type type;

    @JsonProperty("f")
    private final int splitFeature;

    @JsonProperty("v")
    private final double splitValue;

    @JsonProperty("l")
    private final int left;

    @JsonProperty("r")
    private final int right;

    @JsonProperty("s")
    private final int size;

    @JsonCreator
    IsolationNode(@JsonProperty("t") Type type,
                  @JsonProperty("f") int splitFeature,
                  @JsonProperty("v") double splitValue,
                  @JsonProperty("l") int left,
                  @JsonProperty("r") int right,
                  @JsonProperty("s") int size) {
        this.type = type;
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    public static IsolationNode internal(int splitFeature, double splitValue, int left, int right) {
        return new IsolationNode(Type.INTERNAL, splitFeature, splitValue, left, right, 0);
    }

    public static IsolationNode leaf(int size) {
        return new IsolationNode(Type.LEAF, -1, 0.0, -1, -1, size);
    }

    @JsonIgnore
    public boolean isLeaf() { return type == Type.LEAF; }

    /**
     * Index of the child a point descends into.
     */
    int next(double[] point) {
        return point[splitFeature] < splitValue ? left : right;
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public Type getType() { return type; }
    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public int getLeft() { return left; }
    public int getRight() { return right; }
    public int getSize() { return size; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IsolationNode n)) return false;
        return type == n.type && splitFeature == n.splitFeature
                && Double.compare(splitValue, n.splitValue) == 0
                && left == n.left && right == n.right && size == n.size;
    }

    @Override
    public int hashCode() {
        int h = type.hashCode();
        h = 31 * h + splitFeature;
        h = 31 * h + Double.hashCode(splitValue);
        h = 31 * h + left;
        h = 31 * h + right;
        return 31 * h + size;
    }
}
