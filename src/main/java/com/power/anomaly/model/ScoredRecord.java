package com.power.anomaly.model;

/**
 * A scaled record with its isolation forest score. Higher scores are more anomalous.
 */
public record ScoredRecord(ScaledRecord scaledRecord, double anomalyScore, boolean anomaly) {

    public PowerRecord record() {
        return scaledRecord.record();
    }
}
