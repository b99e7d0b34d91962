package com.chicu.aifinetune.ai.tuning.error;

public class ModelNotFoundException extends RuntimeException {

    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super("Model not found: " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
