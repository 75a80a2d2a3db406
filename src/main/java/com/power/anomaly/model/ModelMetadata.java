package com.power.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Metadata of the currently published model for a tag")
public class ModelMetadata {

    @Schema(example = "default")
    private String tag;

    @Schema(description = "Snapshot version, incremented on every successful training", example = "3")
    private long modelVersion;

    @Schema(description = "Persisted format version", example = "1")
    private int formatVersion;

    @Schema(example = "100")
    private int treeCount;

    @Schema(description = "Sub-sampling size per tree", example = "256")
    private int sampleSize;

    @Schema(example = "0.01")
    private double contamination;

    @Schema(example = "0.62")
    private double threshold;

    @Schema(example = "2049280")
    private int trainingRows;

    @Schema(description = "Training completion time in epoch milliseconds", example = "1739886764000")
    private long trainedAt;
}
