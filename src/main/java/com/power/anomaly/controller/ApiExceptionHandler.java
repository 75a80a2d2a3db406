package com.power.anomaly.controller;

import com.power.anomaly.exception.AnomalyDetectionException;
import com.power.anomaly.exception.IncompatibleModelVersionException;
import com.power.anomaly.exception.MissingFeaturesException;
import com.power.anomaly.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingFeaturesException.class)
    public ResponseEntity<ErrorResponse> handleMissingFeatures(MissingFeaturesException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getKind().name(), ex.getMessage(),
                Map.of("missing", ex.getMissingColumns()));
    }

    @ExceptionHandler(IncompatibleModelVersionException.class)
    public ResponseEntity<ErrorResponse> handleIncompatibleModel(IncompatibleModelVersionException ex) {
        return build(HttpStatus.CONFLICT, ex.getKind().name(), ex.getMessage(), Map.of(
                "foundVersion", ex.getFoundVersion(),
                "expectedVersion", ex.getExpectedVersion(),
                "action", "POST /api/v1/train to retrain the model"));
    }

    @ExceptionHandler(AnomalyDetectionException.class)
    public ResponseEntity<ErrorResponse> handleDetection(AnomalyDetectionException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case INVALID_RANGE, INVALID_FEATURE, UNSUPPORTED_FORMAT, MISSING_FEATURES -> HttpStatus.BAD_REQUEST;
            case MODEL_NOT_FOUND, DATASET_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_DATA, EMPTY_TRAINING_SET -> HttpStatus.UNPROCESSABLE_ENTITY;
            case MODEL_NOT_TRAINED, INCOMPATIBLE_MODEL_VERSION, TRAINING_IN_PROGRESS, TRAINING_CANCELLED ->
                    HttpStatus.CONFLICT;
            case MODEL_STORE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", ex.getKind(), ex);
        }
        return build(status, ex.getKind().name(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT",
                "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String kind, String message,
                                                Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(kind, message, details));
    }
}
