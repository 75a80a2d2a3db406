package com.power.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A single isolation tree stored as a flat arena of nodes, root at index 0.
 */
public final class IsolationTree {

    private final List<IsolationNode> nodes;

    @JsonCreator
    public IsolationTree(@JsonProperty("nodes") List<IsolationNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("An isolation tree needs at least a root node");
        }
        this.nodes = List.copyOf(nodes);
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        List<IsolationNode> arena = new ArrayList<>();
        buildNode(data, 0, maxDepth, random, arena);
        return new IsolationTree(arena);
    }

    private static int buildNode(double[][] data, int depth, int maxDepth, Random random,
                                 List<IsolationNode> arena) {
        int n = data.length;
        int index = arena.size();

        if (depth >= maxDepth || n <= 1) {
            arena.add(IsolationNode.leaf(n));
            return index;
        }

        int numFeatures = data[0].length;
        int featureIdx = random.nextInt(numFeatures);

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double[] row : data) {
            if (row[featureIdx] < min) min = row[featureIdx];
            if (row[featureIdx] > max) max = row[featureIdx];
        }

        // constant feature over this node: nothing left to split on
        if (min >= max) {
            arena.add(IsolationNode.leaf(n));
            return index;
        }

        double splitValue = min + random.nextDouble() * (max - min);

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        // reserve the slot so children land after their parent
        arena.add(null);
        int left = buildNode(leftData, depth + 1, maxDepth, random, arena);
        int right = buildNode(rightData, depth + 1, maxDepth, random, arena);
        arena.set(index, IsolationNode.internal(featureIdx, splitValue, left, right));
        return index;
    }

    /**
     * Edges from the root to the leaf the point falls into, plus the expected remaining
     * depth c(size) for leaves that still hold several training rows.
     */
    public double pathLength(double[] point) {
        int depth = 0;
        IsolationNode node = nodes.get(0);
        while (!node.isLeaf()) {
            node = nodes.get(node.next(point));
            depth++;
        }
        return depth + IsolationNode.averagePathLength(node.getSize());
    }

    public List<IsolationNode> getNodes() { return nodes; }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof IsolationTree t && nodes.equals(t.nodes));
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }
}
