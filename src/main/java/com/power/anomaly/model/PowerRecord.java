package com.power.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single timestamped household power consumption reading.
 * All feature values are finite; rows that fail this are dropped by the parser.
 */
@Value
@Builder
public class PowerRecord {

    Instant timestamp;
    double globalActivePower;
    double globalReactivePower;
    double voltage;
    double globalIntensity;
    double subMetering1;
    double subMetering2;
    double subMetering3;

    public double[] toFeatureVector() {
        double[] vector = new double[Feature.COUNT];
        for (Feature feature : Feature.values()) {
            vector[feature.ordinal()] = feature.valueOf(this);
        }
        return vector;
    }
}
