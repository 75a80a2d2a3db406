package com.power.anomaly.exception;

public class EmptyTrainingSetException extends AnomalyDetectionException {

    public EmptyTrainingSetException(String message) {
        super(ErrorKind.EMPTY_TRAINING_SET, message);
    }
}
