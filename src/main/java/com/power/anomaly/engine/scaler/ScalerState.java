package com.power.anomaly.engine.scaler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Fitted per-feature standardization parameters. Immutable once fitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScalerState {

    private final List<String> featureNames;
    private final double[] means;
    private final double[] stdDevs;

    @JsonCreator
    public ScalerState(@JsonProperty("featureNames") List<String> featureNames,
                       @JsonProperty("means") double[] means,
                       @JsonProperty("stdDevs") double[] stdDevs) {
        if (means.length != stdDevs.length || featureNames.size() != means.length) {
            throw new IllegalArgumentException("Scaler dimensions disagree: " + featureNames.size()
                    + " names, " + means.length + " means, " + stdDevs.length + " std devs");
        }
        this.featureNames = List.copyOf(featureNames);
        this.means = means.clone();
        this.stdDevs = stdDevs.clone();
    }

    public int dimensions() {
        return means.length;
    }

    public double mean(int feature) { return means[feature]; }
    public double stdDev(int feature) { return stdDevs[feature]; }

    public List<String> getFeatureNames() { return featureNames; }
    public double[] getMeans() { return means.clone(); }
    public double[] getStdDevs() { return stdDevs.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalerState other)) return false;
        return featureNames.equals(other.featureNames)
                && Arrays.equals(means, other.means)
                && Arrays.equals(stdDevs, other.stdDevs);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * featureNames.hashCode() + Arrays.hashCode(means)) + Arrays.hashCode(stdDevs);
    }
}
