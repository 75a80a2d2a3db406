package com.power.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomalies found in a set of readings plus summary statistics")
public class PredictionResult {

    @Schema(description = "Anomalous readings")
    @JsonProperty("anomalies")
    private List<AnomalyEntry> anomalies;

    @Schema(description = "Number of readings labeled anomalous", example = "12")
    @JsonProperty("anomaly_count")
    private int anomalyCount;

    @Schema(description = "Number of readings scored", example = "1440")
    @JsonProperty("total_records")
    private int totalRecords;

    @Schema(description = "100 * anomaly_count / total_records, 0.0 when nothing was scored", example = "0.83")
    @JsonProperty("anomaly_percentage")
    private double anomalyPercentage;

    public static PredictionResult empty() {
        return new PredictionResult(List.of(), 0, 0, 0.0);
    }
}
