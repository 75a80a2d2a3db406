package com.power.anomaly.model;

/**
 * A record paired with its standardized feature vector (indexed by {@link Feature#ordinal()}).
 */
public record ScaledRecord(PowerRecord record, double[] scaled) {}
