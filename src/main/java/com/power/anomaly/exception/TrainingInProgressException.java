package com.power.anomaly.exception;

public class TrainingInProgressException extends AnomalyDetectionException {

    public TrainingInProgressException(String message) {
        super(ErrorKind.TRAINING_IN_PROGRESS, message);
    }
}
