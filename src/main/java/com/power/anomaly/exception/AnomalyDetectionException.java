package com.power.anomaly.exception;

/**
 * Base class for every request-level failure of the detection engine.
 * None of these leave the published model in a modified state.
 */
public abstract class AnomalyDetectionException extends RuntimeException {

    private final ErrorKind kind;

    protected AnomalyDetectionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnomalyDetectionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
