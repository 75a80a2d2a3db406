package com.power.anomaly.exception;

public class ModelNotTrainedException extends AnomalyDetectionException {

    public ModelNotTrainedException(String message) {
        super(ErrorKind.MODEL_NOT_TRAINED, message);
    }
}
