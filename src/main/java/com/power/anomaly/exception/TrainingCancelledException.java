package com.power.anomaly.exception;

public class TrainingCancelledException extends AnomalyDetectionException {

    public TrainingCancelledException(String message) {
        super(ErrorKind.TRAINING_CANCELLED, message);
    }
}
