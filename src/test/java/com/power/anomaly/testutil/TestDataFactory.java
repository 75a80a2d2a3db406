package com.power.anomaly.testutil;

import com.power.anomaly.config.DetectionConfig;
import com.power.anomaly.engine.isolationforest.IsolationForest;
import com.power.anomaly.engine.isolationforest.IsolationForestTrainer;
import com.power.anomaly.engine.isolationforest.TrainingParameters;
import com.power.anomaly.engine.scaler.FeatureScaler;
import com.power.anomaly.engine.scaler.ScalerState;
import com.power.anomaly.model.Feature;
import com.power.anomaly.model.ModelSnapshot;
import com.power.anomaly.model.PowerRecord;
import com.power.anomaly.model.ScaledRecord;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant START = LocalDateTime.of(2007, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);

    public static final String HEADER = "Date;Time;Global_active_power;Global_reactive_power;Voltage;"
            + "Global_intensity;Sub_metering_1;Sub_metering_2;Sub_metering_3";

    // Means and spreads of the tight "normal" cluster, in Feature order
    private static final double[] MEANS = {1.0, 0.1, 240.0, 4.5, 1.0, 1.0, 10.0};
    private static final double[] SPREADS = {0.05, 0.01, 0.5, 0.2, 0.1, 0.1, 0.5};

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("d/M/yyyy", Locale.ROOT);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

    private TestDataFactory() {}

    public static PowerRecord createRecord(Instant timestamp, double... values) {
        return PowerRecord.builder()
                .timestamp(timestamp)
                .globalActivePower(values[0])
                .globalReactivePower(values[1])
                .voltage(values[2])
                .globalIntensity(values[3])
                .subMetering1(values[4])
                .subMetering2(values[5])
                .subMetering3(values[6])
                .build();
    }

    /**
     * One record per minute starting at {@link #START}, drawn from a tight Gaussian cluster.
     */
    public static List<PowerRecord> normalRecords(int count, long seed) {
        Random random = new Random(seed);
        List<PowerRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double[] values = new double[Feature.COUNT];
            for (int f = 0; f < Feature.COUNT; f++) {
                values[f] = MEANS[f] + random.nextGaussian() * SPREADS[f];
            }
            records.add(createRecord(START.plus(Duration.ofMinutes(i)), values));
        }
        return records;
    }

    /**
     * A far outlier: two features pushed 30+ spreads away from the cluster, in a direction
     * that differs per {@code index} so outliers do not mask each other.
     */
    public static PowerRecord outlier(int index, Instant timestamp) {
        double[] values = MEANS.clone();
        int first = index % Feature.COUNT;
        int second = (index + 3) % Feature.COUNT;
        double sign = index % 2 == 0 ? 1.0 : -1.0;
        values[first] += sign * (30 + 5 * index) * SPREADS[first];
        values[second] -= sign * (40 + 3 * index) * SPREADS[second];
        return createRecord(timestamp, values);
    }

    /**
     * {@code normal} clustered records with {@code outliers} far outliers spread evenly among them.
     * Outliers are the records at positions {@link #outlierPositions(int, int)}.
     */
    public static List<PowerRecord> datasetWithOutliers(int normal, int outliers, long seed) {
        List<PowerRecord> records = new ArrayList<>(normalRecords(normal + outliers, seed));
        int[] positions = outlierPositions(normal + outliers, outliers);
        for (int i = 0; i < positions.length; i++) {
            int p = positions[i];
            records.set(p, outlier(i, records.get(p).getTimestamp()));
        }
        return records;
    }

    public static int[] outlierPositions(int total, int outliers) {
        int[] positions = new int[outliers];
        int stride = total / outliers;
        for (int i = 0; i < outliers; i++) {
            positions[i] = i * stride + stride / 2;
        }
        return positions;
    }

    /**
     * Render records in the semicolon separated household power consumption layout.
     */
    public static String toText(List<PowerRecord> records) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (PowerRecord r : records) {
            sb.append(line(r)).append('\n');
        }
        return sb.toString();
    }

    public static String line(PowerRecord r) {
        LocalDateTime ts = LocalDateTime.ofInstant(r.getTimestamp(), ZoneOffset.UTC);
        return String.join(";",
                DATE.format(ts),
                TIME.format(ts),
                Double.toString(r.getGlobalActivePower()),
                Double.toString(r.getGlobalReactivePower()),
                Double.toString(r.getVoltage()),
                Double.toString(r.getGlobalIntensity()),
                Double.toString(r.getSubMetering1()),
                Double.toString(r.getSubMetering2()),
                Double.toString(r.getSubMetering3()));
    }

    public static double[][] scaledMatrix(ScalerState state, List<PowerRecord> records) {
        List<ScaledRecord> scaled = new FeatureScaler().transform(state, records);
        double[][] matrix = new double[scaled.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = scaled.get(i).scaled();
        }
        return matrix;
    }

    public static ModelSnapshot trainSnapshot(String tag, List<PowerRecord> records, TrainingParameters params) {
        FeatureScaler scaler = new FeatureScaler();
        ScalerState state = scaler.fit(records);
        IsolationForest forest = new IsolationForestTrainer().train(scaledMatrix(state, records), params);
        return ModelSnapshot.builder()
                .formatVersion(1)
                .tag(tag)
                .modelVersion(1)
                .trainedAt(System.currentTimeMillis())
                .trainingRows(records.size())
                .scaler(state)
                .forest(forest)
                .build();
    }

    public static DetectionConfig createConfig(Path modelDirectory) {
        DetectionConfig config = new DetectionConfig();
        config.setModelDirectory(modelDirectory.toString());
        config.setNumTrees(100);
        config.setMaxSamples(256);
        config.setContamination(0.01);
        config.setSeed(42L);
        config.setMinTrainingRows(50);
        config.setTrainingThreads(1);
        config.setTrainingLockTimeout(Duration.ofMillis(200));
        return config;
    }
}
