package com.power.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Number of isolation trees per forest.
    private int numTrees = 100;

    // Cap on the sub-sampling size per tree; the full training set is used when smaller.
    private int maxSamples = 256;

    // Expected fraction of anomalies in the training set. Fixes the score threshold at train time.
    private double contamination = 0.01;

    // Master seed for subsampling and split selection. Same seed + same data = same model.
    private long seed = 42L;

    // Minimum number of valid rows that must survive parsing before a model is trained.
    private int minTrainingRows = 50;

    // Worker threads used to build trees in parallel. 1 builds on the request thread.
    private int trainingThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    // How long a second train for the same tag waits for the first before failing.
    private Duration trainingLockTimeout = Duration.ofSeconds(5);

    // Directory holding one persisted snapshot per model tag.
    private String modelDirectory = "models";

    // Tag used when a request does not name one.
    private String defaultModelTag = "default";

    // Spring resource location of the built-in reference dataset.
    private String defaultDataFile = "file:household_power_consumption.txt";

    // Upper bound on anomalies returned by a date-range query; the count is not capped.
    private int maxQueryAnomalies = 1000;
}
