package com.power.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.power.anomaly.exception.ModelNotTrainedException;

import java.util.List;

/**
 * A trained isolation forest together with the score threshold fixed at training time.
 * Instances are immutable; {@link IsolationForestTrainer} creates them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double contamination;
    private final double threshold;
    private final long seed;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize,
                           @JsonProperty("contamination") double contamination,
                           @JsonProperty("threshold") double threshold,
                           @JsonProperty("seed") long seed) {
        this.trees = trees == null ? List.of() : List.copyOf(trees);
        this.sampleSize = sampleSize;
        this.contamination = contamination;
        this.threshold = threshold;
        this.seed = seed;
    }

    /**
     * Compute anomaly score for a single (scaled) point.
     *
     * @return score in (0, 1]; values near 1 are easy to isolate (anomalous),
     *         values well below 0.5 are normal
     * @throws ModelNotTrainedException if the forest holds no trees
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) {
            throw new ModelNotTrainedException("Isolation forest has not been trained");
        }

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // IF scoring formula: s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * A score is anomalous when it lies strictly above the stored threshold.
     */
    public boolean isAnomaly(double score) {
        return score > threshold;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
    public double getContamination() { return contamination; }
    public double getThreshold() { return threshold; }
    public long getSeed() { return seed; }
}
