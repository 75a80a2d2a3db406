package com.power.anomaly.exception;

/**
 * Stable machine-readable error kinds surfaced to callers.
 */
public enum ErrorKind {
    INSUFFICIENT_DATA,
    EMPTY_TRAINING_SET,
    MODEL_NOT_TRAINED,
    MODEL_NOT_FOUND,
    INVALID_RANGE,
    INVALID_FEATURE,
    UNSUPPORTED_FORMAT,
    MISSING_FEATURES,
    INCOMPATIBLE_MODEL_VERSION,
    TRAINING_IN_PROGRESS,
    TRAINING_CANCELLED,
    DATASET_NOT_FOUND,
    MODEL_STORE_FAILURE
}
