package com.power.anomaly.engine.isolationforest;

/**
 * Hyper-parameters of one isolation forest training run.
 *
 * @param numTrees      number of trees in the forest (typically 100)
 * @param maxSamples    cap on the sub-sampling size per tree (typically 256)
 * @param contamination expected fraction of anomalies in the training set, in (0, 0.5]
 * @param seed          master seed; the same seed and data give identical trees
 */
public record TrainingParameters(int numTrees, int maxSamples, double contamination, long seed) {

    public TrainingParameters {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be at least 1, got " + numTrees);
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("maxSamples must be at least 2, got " + maxSamples);
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
    }
}
