package com.power.anomaly.engine.scaler;

import com.power.anomaly.exception.InsufficientDataException;
import com.power.anomaly.model.Feature;
import com.power.anomaly.model.PowerRecord;
import com.power.anomaly.model.ScaledRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Standardizes feature vectors: (value - mean) / std, with statistics fitted once on a training corpus.
 */
@Component
public class FeatureScaler {

    private static final Logger log = LoggerFactory.getLogger(FeatureScaler.class);

    /**
     * Fit mean and population standard deviation for each of the 7 features.
     * A feature with zero variance is given a standard deviation of 1.0, so it scales to a
     * constant 0 rather than to non-finite values.
     *
     * @throws InsufficientDataException if {@code records} is empty
     */
    public ScalerState fit(List<PowerRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException("Cannot fit scaler on an empty record set");
        }

        int n = records.size();
        double[] means = new double[Feature.COUNT];
        double[] m2 = new double[Feature.COUNT];

        // Welford's online update
        int count = 0;
        for (PowerRecord record : records) {
            count++;
            for (Feature feature : Feature.values()) {
                int i = feature.ordinal();
                double value = feature.valueOf(record);
                double delta = value - means[i];
                means[i] += delta / count;
                m2[i] += delta * (value - means[i]);
            }
        }

        double[] stdDevs = new double[Feature.COUNT];
        for (int i = 0; i < Feature.COUNT; i++) {
            double variance = m2[i] / n;
            if (variance > 0) {
                stdDevs[i] = Math.sqrt(variance);
            } else {
                stdDevs[i] = 1.0;
                log.warn("Feature {} has zero variance over {} records; using std dev 1.0",
                        Feature.values()[i].getColumnName(), n);
            }
        }

        return new ScalerState(Feature.columnNames(), means, stdDevs);
    }

    /**
     * Apply a fitted state. Never derives statistics from the input.
     */
    public List<ScaledRecord> transform(ScalerState state, List<PowerRecord> records) {
        List<ScaledRecord> scaled = new ArrayList<>(records.size());
        for (PowerRecord record : records) {
            scaled.add(new ScaledRecord(record, transform(state, record.toFeatureVector())));
        }
        return scaled;
    }

    public double[] transform(ScalerState state, double[] vector) {
        if (vector.length != state.dimensions()) {
            throw new IllegalArgumentException("Expected " + state.dimensions()
                    + " features but got " + vector.length);
        }
        double[] out = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (vector[i] - state.mean(i)) / state.stdDev(i);
        }
        return out;
    }
}
