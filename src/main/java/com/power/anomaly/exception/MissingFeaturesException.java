package com.power.anomaly.exception;

import java.util.List;

public class MissingFeaturesException extends AnomalyDetectionException {

    private final List<String> missingColumns;

    public MissingFeaturesException(List<String> missingColumns) {
        super(ErrorKind.MISSING_FEATURES, "Missing required columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() { return missingColumns; }
}
