package com.chicu.aifinetune.ai.persistence;

import com.chicu.aifinetune.ai.tuning.error.ModelNotFoundException;
import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import com.chicu.aifinetune.domain.EvaluationResult;
import com.chicu.aifinetune.domain.LearnerProfile;
import com.chicu.aifinetune.domain.ModelInfo;
import com.chicu.aifinetune.domain.ModelListFilters;
import com.chicu.aifinetune.domain.ModelMetadata;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaModelRegistry.class)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class JpaModelRegistryTest {

    @Autowired
    private JpaModelRegistry registry;

    @Autowired
    private ModelRecordRepository repo;

    private static final Instant T0 = Instant.parse("2020-03-01T10:00:00Z");

    private static ModelMetadata meta(String domain, String level, Instant createdAt, String... tags) {
        return ModelMetadata.builder()
                .baseModelType(ModelCategory.TEXT_CLASSIFICATION)
                .purpose("quiz")
                .targetDomain(domain)
                .learnerProfileTarget(level != null ? LearnerProfile.builder().skillLevel(level).build() : null)
                .createdAt(createdAt)
                .lastUsed(createdAt)
                .trainingDatasetSize(120)
                .operationMode(ExecutionMode.LOCAL)
                .optimized(false)
                .tags(List.of(tags))
                .build();
    }

    private static EvaluationResult accuracy(String modelId, double acc) {
        return EvaluationResult.ok(modelId, Map.of("accuracy", acc));
    }

    @Test
    void registerModel_shouldBeReadableBack() {
        registry.registerModel("m1", meta("lsf", "beginner", T0, "fr", "a1"), accuracy("m1", 0.91), 4096);

        ModelInfo info = registry.getModelInfo("m1").orElseThrow();

        assertEquals(ModelCategory.TEXT_CLASSIFICATION, info.baseModelType());
        assertEquals("quiz", info.purpose());
        assertEquals("lsf", info.targetDomain());
        assertEquals("beginner", info.learnerSkillLevel());
        assertEquals(ModelStatus.REGISTERED, info.status());
        assertEquals(0.91, info.metrics().get("accuracy"));
        assertEquals(4096, info.modelSize());
        assertEquals(120, info.trainingDatasetSize());
        assertEquals(ExecutionMode.LOCAL, info.operationMode());
        assertEquals(List.of("fr", "a1"), info.tags());
        assertEquals(0, info.usageCount());
    }

    @Test
    void registerModel_twice_shouldUpsert() {
        registry.registerModel("m1", meta("lsf", null, T0), accuracy("m1", 0.5), 100);
        registry.registerModel("m1", meta("lsf", null, T0), accuracy("m1", 0.8), 80);

        assertEquals(1, repo.count(), "тот же modelId: одна запись");
        assertEquals(80, registry.getModelInfo("m1").orElseThrow().modelSize());
    }

    @Test
    void findSimilarModel_shouldMatchDomainAndLevel() {
        registry.registerModel("m-lsf-beg", meta("lsf", "beginner", T0), accuracy("m-lsf-beg", 0.9), 10);
        registry.registerModel("m-lsf-adv", meta("lsf", "advanced", T0), accuracy("m-lsf-adv", 0.9), 10);
        registry.registerModel("m-asl-beg", meta("asl", "beginner", T0), accuracy("m-asl-beg", 0.9), 10);

        LearnerProfile beginner = LearnerProfile.builder().skillLevel("beginner").build();

        assertEquals("m-lsf-beg", registry.findSimilarModel(ModelCategory.TEXT_CLASSIFICATION, "quiz", "lsf", beginner)
                .map(ModelInfo::modelId).orElse(null));
        assertTrue(registry.findSimilarModel(ModelCategory.TEXT_CLASSIFICATION, "quiz", "lsf", null).isEmpty(),
                "без профиля ищется модель без уровня");
        assertTrue(registry.findSimilarModel(ModelCategory.IMAGE_CLASSIFICATION, "quiz", "lsf", beginner).isEmpty());
        assertTrue(registry.findSimilarModel(ModelCategory.TEXT_CLASSIFICATION, "chat", "lsf", beginner).isEmpty());
    }

    @Test
    void findSimilarModel_shouldIgnoreNonReusableStatuses() {
        registry.registerModel("m1", meta("lsf", null, T0), accuracy("m1", 0.9), 10);
        registry.updateModelStatus("m1", ModelStatus.ARCHIVED, null);

        assertTrue(registry.findSimilarModel(ModelCategory.TEXT_CLASSIFICATION, "quiz", "lsf", null).isEmpty());
    }

    @Test
    void recordModelUsage_shouldIncrementCounter() {
        registry.registerModel("m1", meta("lsf", null, T0), accuracy("m1", 0.9), 10);

        registry.recordModelUsage("m1");
        registry.recordModelUsage("m1");
        registry.recordModelUsage("unknown");

        ModelInfo info = registry.getModelInfo("m1").orElseThrow();
        assertEquals(2, info.usageCount());
        assertTrue(info.lastUsed().isAfter(T0));
    }

    @Test
    void updateModelStatus_shouldStoreDeploymentDetails() {
        registry.registerModel("m1", meta("lsf", null, T0), accuracy("m1", 0.9), 10);

        registry.updateModelStatus("m1", ModelStatus.DEPLOYED, Map.of(
                "deploymentEnvironment", "cloud",
                "deploymentTimestamp", "2020-03-01T11:00:00Z"));

        ModelInfo info = registry.getModelInfo("m1").orElseThrow();
        assertEquals(ModelStatus.DEPLOYED, info.status());
        assertEquals("cloud", info.deploymentDetails().get("deploymentEnvironment"));

        assertThrows(ModelNotFoundException.class,
                () -> registry.updateModelStatus("ghost", ModelStatus.DEPLOYED, Map.of()));
    }

    @Test
    void listModels_shouldApplyFilters_newestFirst() {
        registry.registerModel("old", meta("lsf", null, T0, "fr"), accuracy("old", 0.95), 10);
        registry.registerModel("new", meta("lsf", null, T0.plusSeconds(3600), "fr", "a1"), accuracy("new", 0.7), 10);
        registry.registerModel("asl", meta("asl", null, T0.plusSeconds(7200)), accuracy("asl", 0.99), 10);

        assertEquals(List.of("asl", "new", "old"),
                registry.listModels(ModelListFilters.NONE).stream().map(ModelInfo::modelId).toList());

        assertEquals(List.of("new", "old"), registry.listModels(ModelListFilters.builder()
                .targetDomain("lsf").build()).stream().map(ModelInfo::modelId).toList());

        assertEquals(List.of("old"), registry.listModels(ModelListFilters.builder()
                .targetDomain("lsf").minAccuracy(0.9).build()).stream().map(ModelInfo::modelId).toList());

        assertEquals(List.of("new"), registry.listModels(ModelListFilters.builder()
                .tags(List.of("a1")).build()).stream().map(ModelInfo::modelId).toList());

        assertEquals(List.of("asl"), registry.listModels(ModelListFilters.builder()
                .createdAfter(T0.plusSeconds(3600)).build()).stream().map(ModelInfo::modelId).toList());
    }

    @Test
    void deleteModel_shouldReportWhetherItExisted() {
        registry.registerModel("m1", meta("lsf", null, T0), accuracy("m1", 0.9), 10);

        assertTrue(registry.deleteModel("m1"));
        assertFalse(registry.deleteModel("m1"));
        assertTrue(registry.getModelInfo("m1").isEmpty());
    }
}
