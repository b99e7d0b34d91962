package com.chicu.aifinetune.domain;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итог заявки на дообучение.
 * Инвариант: success=false ⇒ error задан и modelId пустой; success=true ⇒ modelId непустой.
 */
@Builder(toBuilder = true)
public record FineTuningResult(
        String modelId,
        String originalModelType,
        String purpose,
        boolean success,
        Map<String, Double> metrics,
        EvaluationResult evaluation,
        List<ResultWarning> warnings,
        ResultError error,
        ResultMetadata metadata,
        DeploymentOutcome deployment
) {
    public FineTuningResult {
        modelId = modelId == null ? "" : modelId;
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        deployment = deployment == null ? DeploymentOutcome.notRegistered() : deployment;

        if (success && modelId.isEmpty()) {
            throw new IllegalArgumentException("successful result must carry modelId");
        }
        if (!success && (error == null || !modelId.isEmpty())) {
            throw new IllegalArgumentException("failed result must carry error and empty modelId");
        }
    }
}
