package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.TrainingParameters;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterConfigurerTest {

    private final ParameterConfigurer configurer = new ParameterConfigurer();

    @Test
    void smallTextClassification_local_shouldCapBatch_andAddMixedPrecision() {
        TrainingParameters p = configurer.configure(null, ModelCategory.TEXT_CLASSIFICATION, 100, ExecutionMode.LOCAL);

        assertEquals(8, p.batchSize(), "local режет batch категории (32) до 8");
        assertEquals(5, p.epochs(), "малый датасет text-classification → 5 эпох");
        assertEquals(2e-5, p.learningRate());
        assertEquals("epoch", p.evaluationStrategy());
        assertEquals(500, p.warmupSteps());
        assertEquals(0.01, p.weightDecay());
        assertTrue(p.fp16());
        assertEquals(2, p.gradientAccumulationSteps());
        assertEquals(6, p.cpuThreads());
    }

    @Test
    void largeTextClassification_cloud_shouldDoubleCategoryBatch() {
        TrainingParameters p = configurer.configure(null, ModelCategory.TEXT_CLASSIFICATION, 5000, ExecutionMode.CLOUD);

        assertEquals(64, p.batchSize());
        assertEquals(3, p.epochs());
        assertTrue(p.fp16());
        assertNull(p.gradientAccumulationSteps(), "cloud не трогает накопление градиентов");
    }

    @Test
    void userBatch_shouldWinOverCloudDoubling() {
        TrainingParameters user = TrainingParameters.builder().batchSize(12).build();

        TrainingParameters p = configurer.configure(user, ModelCategory.TEXT_CLASSIFICATION, 5000, ExecutionMode.CLOUD);

        assertEquals(12, p.batchSize());
        assertEquals(3, p.epochs(), "остальные поля остаются из нижних слоёв");
    }

    @Test
    void hybridMultimodal_shouldOffloadAndCheckpoint() {
        TrainingParameters p = configurer.configure(null, ModelCategory.MULTIMODAL, 100, ExecutionMode.HYBRID);

        assertEquals(4, p.batchSize());
        assertEquals(2, p.epochs());
        assertEquals(1e-5, p.learningRate());
        assertTrue(p.offloadOptimizer());
        assertTrue(p.gradientCheckpointing());
        assertTrue(p.fp16());
    }

    @Test
    void textGeneration_shouldUseItsOwnLearningRateAndEpochs() {
        TrainingParameters small = configurer.configure(null, ModelCategory.TEXT_GENERATION, 100, ExecutionMode.LOCAL);
        TrainingParameters big = configurer.configure(null, ModelCategory.TEXT_GENERATION, 800, ExecutionMode.LOCAL);

        assertEquals(5e-5, small.learningRate());
        assertEquals(4, small.epochs());
        assertEquals(2, big.epochs());
        assertEquals(8, small.batchSize());
    }

    @Test
    void imageClassification_shouldUseTenEpochs() {
        TrainingParameters p = configurer.configure(null, ModelCategory.IMAGE_CLASSIFICATION, 100, ExecutionMode.CLOUD);

        assertEquals(10, p.epochs());
        assertEquals(1e-4, p.learningRate());
        assertEquals(32, p.batchSize());
    }

    @Test
    void userExtra_shouldReachTrainerMap() {
        TrainingParameters user = TrainingParameters.builder()
                .learningRate(3e-4)
                .extra(Map.of("seed", 42))
                .build();

        Map<String, Object> m = configurer
                .configure(user, ModelCategory.TEXT_CLASSIFICATION, 100, ExecutionMode.HYBRID)
                .toMap();

        assertEquals(3e-4, m.get("learningRate"));
        assertEquals(42, m.get("seed"));
        assertEquals(32, m.get("batchSize"), "hybrid не меняет batch категории");
    }

    @Test
    void autoMode_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> configurer.configure(null, ModelCategory.TEXT_CLASSIFICATION, 10, ExecutionMode.AUTO));
    }
}
