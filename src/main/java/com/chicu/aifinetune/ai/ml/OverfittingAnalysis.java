package com.chicu.aifinetune.ai.ml;

public record OverfittingAnalysis(
        boolean overfitting,
        double recommendedPruningThreshold,
        String reason
) {
    public static OverfittingAnalysis none() {
        return new OverfittingAnalysis(false, 0.0, "OK");
    }
}
