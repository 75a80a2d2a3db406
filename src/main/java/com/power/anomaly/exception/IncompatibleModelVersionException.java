package com.power.anomaly.exception;

public class IncompatibleModelVersionException extends AnomalyDetectionException {

    private final int foundVersion;
    private final int expectedVersion;

    public IncompatibleModelVersionException(String tag, int foundVersion, int expectedVersion) {
        super(ErrorKind.INCOMPATIBLE_MODEL_VERSION,
                "Model '" + tag + "' was saved with format version " + foundVersion
                        + " but this engine reads version " + expectedVersion + ". Retrain the model to continue.");
        this.foundVersion = foundVersion;
        this.expectedVersion = expectedVersion;
    }

    /**
     * The format version matches but the persisted scaler or forest does not fit this engine's features.
     */
    public IncompatibleModelVersionException(String tag, int formatVersion, String reason) {
        super(ErrorKind.INCOMPATIBLE_MODEL_VERSION,
                "Model '" + tag + "' is incompatible with this engine: " + reason + ". Retrain the model to continue.");
        this.foundVersion = formatVersion;
        this.expectedVersion = formatVersion;
    }

    public int getFoundVersion() { return foundVersion; }
    public int getExpectedVersion() { return expectedVersion; }
}
