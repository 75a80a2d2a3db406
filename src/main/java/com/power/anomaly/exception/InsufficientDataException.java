package com.power.anomaly.exception;

public class InsufficientDataException extends AnomalyDetectionException {

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }
}
