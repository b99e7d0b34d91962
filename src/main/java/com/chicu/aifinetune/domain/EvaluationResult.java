package com.chicu.aifinetune.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Итог оценки модели.
 * success=false не роняет конвейер: метрики берутся какие есть (или пустые), error: текст причины.
 */
public record EvaluationResult(
        String modelId,
        boolean success,
        Map<String, Double> metrics,
        String error
) {
    public EvaluationResult {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static EvaluationResult ok(String modelId, Map<String, Double> metrics) {
        return new EvaluationResult(modelId, true, metrics, null);
    }

    public static EvaluationResult failed(String modelId, String error) {
        return new EvaluationResult(modelId, false, Map.of(), error);
    }

    public Double metric(String name) {
        return metrics.get(name);
    }
}
