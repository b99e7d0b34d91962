package com.chicu.aifinetune.ai.ml;

/** Что возвращает тренер после обучения или оптимизации */
public record TrainedModel(
        String modelId,
        long modelSize,
        TrainingMetrics trainingMetrics
) {}
