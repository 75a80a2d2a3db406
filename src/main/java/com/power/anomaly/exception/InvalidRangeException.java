package com.power.anomaly.exception;

public class InvalidRangeException extends AnomalyDetectionException {

    public InvalidRangeException(String message) {
        super(ErrorKind.INVALID_RANGE, message);
    }
}
