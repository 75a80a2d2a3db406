package com.power.anomaly.exception;

public class ModelStoreException extends AnomalyDetectionException {

    public ModelStoreException(String message, Throwable cause) {
        super(ErrorKind.MODEL_STORE_FAILURE, message, cause);
    }
}
