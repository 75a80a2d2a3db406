package com.power.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An anomalous reading with its raw (unscaled) feature values")
public class AnomalyEntry {

    @Schema(description = "Reading timestamp (ISO local date-time)", example = "2007-03-11T18:42:00")
    @JsonProperty("datetime")
    private LocalDateTime datetime;

    @Schema(description = "Household global minute-averaged active power (kW)", example = "7.706")
    @JsonProperty("global_active_power")
    private double globalActivePower;

    @Schema(description = "Household global minute-averaged reactive power (kW)", example = "0.418")
    @JsonProperty("global_reactive_power")
    private double globalReactivePower;

    @Schema(description = "Minute-averaged voltage (V)", example = "232.41")
    @JsonProperty("voltage")
    private double voltage;

    @Schema(description = "Household global minute-averaged current intensity (A)", example = "33.4")
    @JsonProperty("global_intensity")
    private double globalIntensity;

    @Schema(description = "Sub-metering 1: kitchen (Wh)", example = "38.0")
    @JsonProperty("sub_metering_1")
    private double subMetering1;

    @Schema(description = "Sub-metering 2: laundry room (Wh)", example = "1.0")
    @JsonProperty("sub_metering_2")
    private double subMetering2;

    @Schema(description = "Sub-metering 3: water heater and air conditioner (Wh)", example = "17.0")
    @JsonProperty("sub_metering_3")
    private double subMetering3;

    @Schema(description = "Isolation forest anomaly score in (0, 1]; higher is more anomalous", example = "0.71")
    @JsonProperty("anomaly_score")
    private double anomalyScore;

    public static AnomalyEntry from(ScoredRecord scored) {
        PowerRecord r = scored.record();
        return AnomalyEntry.builder()
                .datetime(LocalDateTime.ofInstant(r.getTimestamp(), ZoneOffset.UTC))
                .globalActivePower(r.getGlobalActivePower())
                .globalReactivePower(r.getGlobalReactivePower())
                .voltage(r.getVoltage())
                .globalIntensity(r.getGlobalIntensity())
                .subMetering1(r.getSubMetering1())
                .subMetering2(r.getSubMetering2())
                .subMetering3(r.getSubMetering3())
                .anomalyScore(scored.anomalyScore())
                .build();
    }
}
