package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.DeploymentOptions;
import com.chicu.aifinetune.domain.OptimizationOptions;
import com.chicu.aifinetune.domain.TrainingParameters;

import java.util.List;
import java.util.Map;

/**
 * Внешний тренер: само численное обучение, оптимизация и выкладка.
 * Оркестратор только вызывает методы в нужном порядке.
 */
public interface ModelTrainer {

    TrainedModel trainModel(
            ModelCategory category,
            List<Map<String, Object>> data,
            TrainingParameters params,
            ExecutionMode mode,
            List<Map<String, Object>> validationData
    );

    /**
     * Если ни одна техника не запрошена: тренер вправе вернуть исходную модель (тот же modelId).
     */
    TrainedModel optimizeModel(String modelId, OptimizationOptions options);

    void deployModelLocally(String modelId, DeploymentOptions options);

    void deployModelToCloud(String modelId, DeploymentOptions options);

    void deployModelToEdge(String modelId, DeploymentOptions options);
}
