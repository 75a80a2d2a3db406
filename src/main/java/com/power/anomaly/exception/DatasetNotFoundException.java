package com.power.anomaly.exception;

public class DatasetNotFoundException extends AnomalyDetectionException {

    public DatasetNotFoundException(String location) {
        super(ErrorKind.DATASET_NOT_FOUND, "Default dataset not found at " + location);
    }

    public DatasetNotFoundException(String location, Throwable cause) {
        super(ErrorKind.DATASET_NOT_FOUND, "Default dataset could not be read from " + location, cause);
    }
}
