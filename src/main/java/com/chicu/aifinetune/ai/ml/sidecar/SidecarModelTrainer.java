package com.chicu.aifinetune.ai.ml.sidecar;

import com.chicu.aifinetune.ai.ml.ModelTrainer;
import com.chicu.aifinetune.ai.ml.TrainedModel;
import com.chicu.aifinetune.ai.ml.TrainingMetrics;
import com.chicu.aifinetune.ai.ml.sidecar.dto.DeployRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.DeployResponseDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.OptimizeRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.TrainRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.TrainResponseDto;
import com.chicu.aifinetune.common.enums.DeploymentEnvironment;
import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.DeploymentOptions;
import com.chicu.aifinetune.domain.OptimizationOptions;
import com.chicu.aifinetune.domain.TrainingParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SidecarModelTrainer implements ModelTrainer {

    private final MlSidecarClient client;

    @Override
    public TrainedModel trainModel(ModelCategory category,
                                   List<Map<String, Object>> data,
                                   TrainingParameters params,
                                   ExecutionMode mode,
                                   List<Map<String, Object>> validationData) {
        if (category == null) throw new IllegalArgumentException("category=null");
        if (mode == null) throw new IllegalArgumentException("mode=null");

        TrainRequestDto req = TrainRequestDto.builder()
                .modelType(category.value())
                .mode(mode.value())
                .data(data != null ? data : List.of())
                .validationData(validationData != null ? validationData : List.of())
                .params(params != null ? params.toMap() : Map.of())
                .build();

        TrainResponseDto resp = client.train(req);
        return toTrainedModel("TRAIN", category.value(), resp);
    }

    /**
     * Если ни одна техника не запрошена, sidecar отдаёт исходную модель: ответ пробрасываем как есть.
     */
    @Override
    public TrainedModel optimizeModel(String modelId, OptimizationOptions options) {
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("modelId пустой");

        OptimizeRequestDto req = OptimizeRequestDto.builder()
                .modelId(modelId)
                .options(options != null ? options.toMap() : Map.of())
                .build();

        TrainResponseDto resp = client.optimize(req);
        return toTrainedModel("OPTIMIZE", modelId, resp);
    }

    @Override
    public void deployModelLocally(String modelId, DeploymentOptions options) {
        deploy(modelId, DeploymentEnvironment.LOCAL, options);
    }

    @Override
    public void deployModelToCloud(String modelId, DeploymentOptions options) {
        deploy(modelId, DeploymentEnvironment.CLOUD, options);
    }

    @Override
    public void deployModelToEdge(String modelId, DeploymentOptions options) {
        deploy(modelId, DeploymentEnvironment.EDGE, options);
    }

    private void deploy(String modelId, DeploymentEnvironment env, DeploymentOptions options) {
        DeployRequestDto req = DeployRequestDto.builder()
                .modelId(modelId)
                .environment(env.value())
                .endpointName(options != null ? options.endpointName() : null)
                .config(options != null ? options.config() : Map.of())
                .build();

        DeployResponseDto resp = client.deploy(req);
        if (resp == null || !resp.isOk()) {
            log.warn("🧠 DEPLOY FAIL modelId={} env={} resp={}", modelId, env.value(), resp);
            throw new IllegalStateException("ML sidecar deploy failed: " + (resp != null ? resp.getMessage() : "null"));
        }

        log.info("🧠 DEPLOY OK modelId={} env={} endpoint={}", modelId, env.value(), resp.getEndpoint());
    }

    private static TrainedModel toTrainedModel(String op, String subject, TrainResponseDto resp) {
        if (resp == null || !resp.isOk()) {
            log.warn("🧠 {} FAIL subject={} resp={}", op, subject, resp);
            throw new IllegalStateException("ML sidecar " + op.toLowerCase() + " failed: "
                    + (resp != null ? resp.getMessage() : "null"));
        }
        if (resp.getModelId() == null || resp.getModelId().isBlank()) {
            throw new IllegalStateException("ML sidecar " + op.toLowerCase() + " вернул пустой modelId");
        }

        log.info("🧠 {} OK subject={} modelId={} size={} loss={} valLoss={} msg={}",
                op, subject, resp.getModelId(), resp.getModelSize(),
                resp.getFinalLoss(), resp.getValidationLoss(), resp.getMessage());

        return new TrainedModel(
                resp.getModelId(),
                resp.getModelSize(),
                new TrainingMetrics(resp.getEpochs(), resp.getFinalLoss(), resp.getValidationLoss(), resp.getTrainingTimeMs())
        );
    }
}
