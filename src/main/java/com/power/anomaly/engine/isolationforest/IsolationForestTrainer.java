package com.power.anomaly.engine.isolationforest;

import com.power.anomaly.exception.EmptyTrainingSetException;
import com.power.anomaly.exception.TrainingCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Builds {@link IsolationForest}s. Trees are independent, so they are built on the supplied
 * worker pool when there is one; every tree draws from its own {@link Random} seeded from the
 * master seed in tree order, which keeps the forest identical regardless of scheduling.
 */
public class IsolationForestTrainer {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestTrainer.class);

    private static final long CANCEL_POLL_MS = 50;

    private final ExecutorService executor;

    /** Sequential trainer building every tree on the calling thread. */
    public IsolationForestTrainer() {
        this(null);
    }

    public IsolationForestTrainer(ExecutorService executor) {
        this.executor = executor;
    }

    public IsolationForest train(double[][] data, TrainingParameters params) {
        return train(data, params, () -> false);
    }

    /**
     * Train a forest and fix its threshold so that the top {@code contamination} fraction of the
     * training rows score as anomalous.
     *
     * @param data      scaled training matrix, one row per record
     * @param cancelled polled between trees; once true the build is abandoned
     * @throws EmptyTrainingSetException  if {@code data} has no rows
     * @throws TrainingCancelledException if {@code cancelled} flips or the thread is interrupted
     */
    public IsolationForest train(double[][] data, TrainingParameters params, BooleanSupplier cancelled) {
        if (data == null || data.length == 0) {
            throw new EmptyTrainingSetException("Cannot train an isolation forest on an empty training set");
        }

        int sampleSize = Math.min(params.maxSamples(), data.length);
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        Random master = new Random(params.seed());
        long[] treeSeeds = new long[params.numTrees()];
        for (int i = 0; i < treeSeeds.length; i++) {
            treeSeeds[i] = master.nextLong();
        }

        List<IsolationTree> trees = executor == null
                ? buildSequentially(data, sampleSize, maxDepth, treeSeeds, cancelled)
                : buildInParallel(data, sampleSize, maxDepth, treeSeeds, cancelled);

        IsolationForest unthresholded = new IsolationForest(trees, sampleSize, params.contamination(),
                Double.POSITIVE_INFINITY, params.seed());
        double threshold = contaminationThreshold(unthresholded, data, params.contamination());

        log.info("Trained isolation forest: {} trees, sample size {}, {} rows, threshold {}",
                trees.size(), sampleSize, data.length, threshold);
        return new IsolationForest(trees, sampleSize, params.contamination(), threshold, params.seed());
    }

    private List<IsolationTree> buildSequentially(double[][] data, int sampleSize, int maxDepth,
                                                  long[] treeSeeds, BooleanSupplier cancelled) {
        List<IsolationTree> trees = new ArrayList<>(treeSeeds.length);
        for (long treeSeed : treeSeeds) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                throw new TrainingCancelledException("Training cancelled after " + trees.size() + " trees");
            }
            trees.add(buildTree(data, sampleSize, maxDepth, treeSeed));
        }
        return trees;
    }

    private List<IsolationTree> buildInParallel(double[][] data, int sampleSize, int maxDepth,
                                                long[] treeSeeds, BooleanSupplier cancelled) {
        List<Future<IsolationTree>> futures = new ArrayList<>(treeSeeds.length);
        for (long treeSeed : treeSeeds) {
            Callable<IsolationTree> task = () -> cancelled.getAsBoolean()
                    ? null
                    : buildTree(data, sampleSize, maxDepth, treeSeed);
            futures.add(executor.submit(task));
        }

        List<IsolationTree> trees = new ArrayList<>(treeSeeds.length);
        try {
            for (Future<IsolationTree> future : futures) {
                trees.add(awaitTree(future, cancelled));
            }
            return trees;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrainingCancelledException("Training interrupted after " + trees.size() + " trees");
        } finally {
            if (trees.size() < futures.size()) {
                futures.forEach(f -> f.cancel(true));
            }
        }
    }

    private IsolationTree awaitTree(Future<IsolationTree> future, BooleanSupplier cancelled)
            throws InterruptedException {
        while (true) {
            if (cancelled.getAsBoolean()) {
                throw new TrainingCancelledException("Training cancelled");
            }
            IsolationTree tree;
            try {
                tree = future.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                continue;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                if (cause instanceof Error err) throw err;
                throw new IllegalStateException("Tree construction failed", cause);
            }
            if (tree == null) {
                throw new TrainingCancelledException("Training cancelled");
            }
            return tree;
        }
    }

    private static IsolationTree buildTree(double[][] data, int sampleSize, int maxDepth, long treeSeed) {
        Random random = new Random(treeSeed);
        return IsolationTree.build(subsample(data, sampleSize, random), maxDepth, random);
    }

    /**
     * Score every training row and return the highest score below the top k, k = max(1, round(c * n)).
     * Rows labeled anomalous are those scoring strictly above it, so rows tied across the k-th
     * position are all left normal and at most k training rows are ever flagged.
     */
    static double contaminationThreshold(IsolationForest forest, double[][] data, double contamination) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = forest.anomalyScore(data[i]);
        }
        Arrays.sort(scores);
        int k = (int) Math.max(1, Math.round(contamination * data.length));
        int below = data.length - k - 1;
        // every training row flagged; scores are never negative
        if (below < 0) return 0.0;
        return scores[below];
    }

    static double[][] subsample(double[][] data, int size, Random random) {
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
}
