package com.power.anomaly.exception;

public class ModelNotFoundException extends AnomalyDetectionException {

    private final String tag;

    public ModelNotFoundException(String tag) {
        super(ErrorKind.MODEL_NOT_FOUND,
                "No trained model found for tag '" + tag + "'. Please train the model first.");
        this.tag = tag;
    }

    public String getTag() { return tag; }
}
