package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import com.chicu.aifinetune.domain.EvaluationResult;
import com.chicu.aifinetune.domain.LearnerProfile;
import com.chicu.aifinetune.domain.ModelInfo;
import com.chicu.aifinetune.domain.ModelListFilters;
import com.chicu.aifinetune.domain.ModelMetadata;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр дообученных моделей. Хранение: забота реализации.
 */
public interface ModelRegistry {

    /**
     * Модель той же категории, цели, домена и уровня ученика, пригодная для повторного использования.
     */
    Optional<ModelInfo> findSimilarModel(
            ModelCategory category,
            String purpose,
            String targetDomain,
            LearnerProfile learnerProfile
    );

    void recordModelUsage(String modelId);

    void registerModel(String modelId, ModelMetadata metadata, EvaluationResult evaluation, long modelSize);

    void updateModelStatus(String modelId, ModelStatus status, Map<String, Object> details);

    Optional<ModelInfo> getModelInfo(String modelId);

    List<ModelInfo> listModels(ModelListFilters filters);

    boolean deleteModel(String modelId);
}
