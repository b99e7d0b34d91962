package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import lombok.Builder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Заявка на дообучение. Неизменяемая после создания.
 */
@Builder(toBuilder = true)
public record FineTuningRequest(

        // text-classification / text-generation / image-classification / multimodal
        // строкой: неизвестная категория: ошибка валидации внутри конвейера
        String modelType,

        String purpose,
        String targetDomain,
        LearnerProfile learnerProfile,

        List<Map<String, Object>> trainingData,
        List<Map<String, Object>> validationData,
        List<Map<String, Object>> evaluationData,

        TrainingParameters trainingParameters,

        // null = оптимизацию явно не просили
        OptimizationOptions optimizationOptions,

        ExecutionMode preferredMode,
        boolean forceRetrain,

        // null трактуется как true
        Boolean enableCaching,

        DeploymentOptions deployment,
        List<String> tags,

        // null = дефолтный дедлайн из конфигурации
        Duration timeout
) {
    public FineTuningRequest {
        trainingData = frozen(trainingData);
        validationData = frozen(validationData);
        evaluationData = frozen(evaluationData);
        tags = tags == null ? List.of() : List.copyOf(tags);
        preferredMode = preferredMode == null ? ExecutionMode.AUTO : preferredMode;
    }

    public boolean cachingEnabled() {
        return enableCaching == null || enableCaching;
    }

    public int combinedExampleCount() {
        return trainingData.size() + validationData.size();
    }

    // записи могут содержать null (их отфильтрует препроцессор), поэтому не List.copyOf
    private static List<Map<String, Object>> frozen(List<Map<String, Object>> src) {
        return src == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(src));
    }
}
