package com.power.anomaly.exception;

import com.power.anomaly.model.Feature;

public class InvalidFeatureException extends AnomalyDetectionException {

    public InvalidFeatureException(String name) {
        super(ErrorKind.INVALID_FEATURE,
                "Unknown feature '" + name + "'. Valid features: " + Feature.columnNames());
    }
}
