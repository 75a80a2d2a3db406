package com.power.anomaly.model;

import com.power.anomaly.engine.isolationforest.IsolationForest;
import com.power.anomaly.engine.scaler.ScalerState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The persisted unit of a trained model: the scaler and the forest trained in its space,
 * always saved and loaded together.
 */
@Value
@Builder
@Jacksonized
public class ModelSnapshot {

    int formatVersion;
    String tag;
    long modelVersion;
    long trainedAt;
    int trainingRows;
    ScalerState scaler;
    IsolationForest forest;

    public ModelMetadata toMetadata() {
        return ModelMetadata.builder()
                .tag(tag)
                .modelVersion(modelVersion)
                .formatVersion(formatVersion)
                .treeCount(forest.getTrees().size())
                .sampleSize(forest.getSampleSize())
                .contamination(forest.getContamination())
                .threshold(forest.getThreshold())
                .trainingRows(trainingRows)
                .trainedAt(trainedAt)
                .build();
    }
}
