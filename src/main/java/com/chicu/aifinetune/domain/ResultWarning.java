package com.chicu.aifinetune.domain;

public record ResultWarning(
        String type,
        String message
) {
    public static ResultWarning overfitting() {
        return new ResultWarning("overfitting", "Model showed signs of overfitting and was optimized");
    }

    public static ResultWarning evaluationFailed(String reason) {
        return new ResultWarning("evaluation_failed", "Model evaluation failed: " + reason);
    }
}
