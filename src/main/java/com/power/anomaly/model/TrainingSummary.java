package com.power.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a training run")
public class TrainingSummary {

    @Schema(description = "Human-readable completion message", example = "Model trained and saved successfully")
    @JsonProperty("message")
    private String message;

    @Schema(description = "Rows that parsed into valid readings", example = "2049280")
    @JsonProperty("rows_parsed")
    private int rowsParsed;

    @Schema(description = "Rows dropped as malformed or incomplete", example = "25979")
    @JsonProperty("rows_dropped")
    private int rowsDropped;

    @Schema(description = "Model tag the snapshot was published under", example = "default")
    @JsonProperty("model_tag")
    private String modelTag;

    @Schema(description = "Version of the published snapshot", example = "3")
    @JsonProperty("model_version")
    private long modelVersion;

    @Schema(description = "Score threshold fixed from the contamination rate", example = "0.62")
    @JsonProperty("threshold")
    private double threshold;

    @Schema(description = "Training completion time in epoch milliseconds", example = "1739886764000")
    @JsonProperty("trained_at")
    private long trainedAt;
}
