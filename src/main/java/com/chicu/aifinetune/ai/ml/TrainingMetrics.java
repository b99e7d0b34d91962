package com.chicu.aifinetune.ai.ml;

public record TrainingMetrics(
        int epochs,
        double finalLoss,
        double validationLoss,
        long trainingTimeMs
) {}
