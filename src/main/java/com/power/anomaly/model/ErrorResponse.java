package com.power.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Error payload: a stable machine-readable kind plus a human-readable message")
public record ErrorResponse(
        @Schema(example = "INVALID_RANGE") String kind,
        @Schema(example = "start_date 2007-02-01T00:00 is after end_date 2007-01-01T00:00") String message,
        Map<String, Object> details) {}
