package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Запись реестра, как её видят клиенты сервиса */
@Builder
public record ModelInfo(
        String modelId,
        ModelCategory baseModelType,
        String purpose,
        String targetDomain,
        String learnerSkillLevel,
        ModelStatus status,
        Map<String, Double> metrics,
        long modelSize,
        int trainingDatasetSize,
        ExecutionMode operationMode,
        boolean optimized,
        List<String> tags,
        Instant createdAt,
        Instant lastUsed,
        long usageCount,
        Map<String, Object> deploymentDetails
) {
    public ModelInfo {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        tags = tags == null ? List.of() : List.copyOf(tags);
        deploymentDetails = deploymentDetails == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(deploymentDetails));
    }
}
