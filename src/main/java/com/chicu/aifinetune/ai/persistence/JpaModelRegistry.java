package com.chicu.aifinetune.ai.persistence;

import com.chicu.aifinetune.ai.ml.ModelRegistry;
import com.chicu.aifinetune.ai.tuning.error.ModelNotFoundException;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import com.chicu.aifinetune.domain.EvaluationResult;
import com.chicu.aifinetune.domain.LearnerProfile;
import com.chicu.aifinetune.domain.ModelInfo;
import com.chicu.aifinetune.domain.ModelListFilters;
import com.chicu.aifinetune.domain.ModelMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Реестр моделей поверх JPA (таблица ft_model_record).
 * Метрики, теги, профиль и детали выкладки лежат JSON-строками.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class JpaModelRegistry implements ModelRegistry {

    private static final Set<ModelStatus> REUSABLE = Arrays.stream(ModelStatus.values())
            .filter(ModelStatus::isReusable)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(ModelStatus.class)));

    private static final TypeReference<Map<String, Double>> METRICS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAGS = new TypeReference<>() {};

    private final ModelRecordRepository repo;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<ModelInfo> findSimilarModel(ModelCategory category,
                                                String purpose,
                                                String targetDomain,
                                                LearnerProfile learnerProfile) {
        if (category == null) return Optional.empty();

        String level = learnerProfile != null ? learnerProfile.skillLevel() : null;

        return repo.findByBaseModelTypeAndPurposeAndStatusInOrderByLastUsedDesc(category, purpose, REUSABLE)
                .stream()
                .filter(e -> Objects.equals(e.getTargetDomain(), targetDomain))
                .filter(e -> Objects.equals(e.getLearnerSkillLevel(), level))
                .findFirst()
                .map(this::toInfo);
    }

    @Override
    public void recordModelUsage(String modelId) {
        Optional<ModelRecordEntity> found = repo.findByModelId(modelId);
        if (found.isEmpty()) {
            log.warn("⚠️ REGISTRY usage для неизвестной модели modelId={}", modelId);
            return;
        }

        ModelRecordEntity e = found.get();
        e.setUsageCount(e.getUsageCount() + 1);
        e.setLastUsed(Instant.now());
        repo.save(e);
    }

    @Override
    public void registerModel(String modelId, ModelMetadata metadata, EvaluationResult evaluation, long modelSize) {
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("modelId пустой");
        if (metadata == null) throw new IllegalArgumentException("metadata=null");

        ModelRecordEntity e = repo.findByModelId(modelId).orElseGet(ModelRecordEntity::new);
        boolean fresh = e.getId() == null;

        LearnerProfile profile = metadata.learnerProfileTarget();
        Instant now = Instant.now();

        e.setModelId(modelId);
        e.setBaseModelType(metadata.baseModelType());
        e.setPurpose(metadata.purpose());
        e.setTargetDomain(metadata.targetDomain());
        e.setLearnerSkillLevel(profile != null ? profile.skillLevel() : null);
        e.setLearnerProfileJson(profile != null ? write(profile) : null);
        e.setStatus(ModelStatus.REGISTERED);
        e.setOperationMode(metadata.operationMode());
        e.setModelSize(modelSize);
        e.setTrainingDatasetSize(metadata.trainingDatasetSize());
        e.setOptimized(metadata.optimized());
        e.setMetricsJson(write(evaluation != null ? evaluation.metrics() : Map.of()));
        e.setTagsJson(write(metadata.tags()));
        e.setCreatedAt(metadata.createdAt() != null ? metadata.createdAt() : now);
        e.setLastUsed(metadata.lastUsed() != null ? metadata.lastUsed() : now);

        repo.save(e);

        log.info("🗂️ REGISTRY {} modelId={} type={} purpose={} size={}",
                fresh ? "register" : "re-register", modelId, metadata.baseModelType(), metadata.purpose(), modelSize);
    }

    @Override
    public void updateModelStatus(String modelId, ModelStatus status, Map<String, Object> details) {
        if (status == null) throw new IllegalArgumentException("status=null");

        ModelRecordEntity e = repo.findByModelId(modelId)
                .orElseThrow(() -> new ModelNotFoundException(modelId));

        e.setStatus(status);
        if (details != null && !details.isEmpty()) {
            e.setDeploymentJson(write(details));
        }
        repo.save(e);

        log.info("🗂️ REGISTRY status modelId={} → {}", modelId, status.value());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ModelInfo> getModelInfo(String modelId) {
        if (modelId == null) return Optional.empty();
        return repo.findByModelId(modelId).map(this::toInfo);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ModelInfo> listModels(ModelListFilters filters) {
        ModelListFilters f = filters != null ? filters : ModelListFilters.NONE;
        return repo.findAllByOrderByCreatedAtDesc().stream()
                .map(this::toInfo)
                .filter(f::matches)
                .toList();
    }

    @Override
    public boolean deleteModel(String modelId) {
        if (modelId == null) return false;
        boolean deleted = repo.deleteByModelId(modelId) > 0;
        log.info("🗂️ REGISTRY delete modelId={} deleted={}", modelId, deleted);
        return deleted;
    }

    // =========================================================
    // mapping
    // =========================================================

    private ModelInfo toInfo(ModelRecordEntity e) {
        return ModelInfo.builder()
                .modelId(e.getModelId())
                .baseModelType(e.getBaseModelType())
                .purpose(e.getPurpose())
                .targetDomain(e.getTargetDomain())
                .learnerSkillLevel(e.getLearnerSkillLevel())
                .status(e.getStatus())
                .metrics(read(e.getMetricsJson(), METRICS))
                .modelSize(e.getModelSize())
                .trainingDatasetSize(e.getTrainingDatasetSize())
                .operationMode(e.getOperationMode())
                .optimized(e.isOptimized())
                .tags(read(e.getTagsJson(), TAGS))
                .createdAt(e.getCreatedAt())
                .lastUsed(e.getLastUsed())
                .usageCount(e.getUsageCount())
                .deploymentDetails(read(e.getDeploymentJson(), DETAILS))
                .build();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("registry json write failed: " + ex.getMessage(), ex);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("registry json read failed: " + ex.getMessage(), ex);
        }
    }
}
