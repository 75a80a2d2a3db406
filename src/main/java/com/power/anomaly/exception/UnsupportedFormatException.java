package com.power.anomaly.exception;

public class UnsupportedFormatException extends AnomalyDetectionException {

    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }
}
