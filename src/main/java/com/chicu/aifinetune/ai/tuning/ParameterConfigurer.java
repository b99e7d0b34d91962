package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.TrainingParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Слои параметров, от слабого к сильному:
 * defaults → категория → режим → пользователь (пользователь побеждает по каждому полю).
 */
@Slf4j
@Component
public class ParameterConfigurer {

    static final TrainingParameters DEFAULTS = TrainingParameters.builder()
            .epochs(3)
            .batchSize(16)
            .learningRate(2e-5)
            .evaluationStrategy("epoch")
            .warmupSteps(500)
            .weightDecay(0.01)
            .build();

    /** категория → оверрайды в зависимости от размера датасета */
    private static final Map<ModelCategory, IntFunction<TrainingParameters>> CATEGORY_OVERRIDES =
            new EnumMap<>(ModelCategory.class);

    static {
        CATEGORY_OVERRIDES.put(ModelCategory.TEXT_CLASSIFICATION, size -> TrainingParameters.builder()
                .batchSize(32)
                .epochs(size < 1000 ? 5 : 3)
                .build());

        CATEGORY_OVERRIDES.put(ModelCategory.TEXT_GENERATION, size -> TrainingParameters.builder()
                .batchSize(8)
                .learningRate(5e-5)
                .epochs(size < 500 ? 4 : 2)
                .build());

        CATEGORY_OVERRIDES.put(ModelCategory.IMAGE_CLASSIFICATION, size -> TrainingParameters.builder()
                .batchSize(16)
                .epochs(10)
                .learningRate(1e-4)
                .build());

        CATEGORY_OVERRIDES.put(ModelCategory.MULTIMODAL, size -> TrainingParameters.builder()
                .batchSize(4)
                .epochs(2)
                .learningRate(1e-5)
                .build());
    }

    public TrainingParameters configure(TrainingParameters userParams,
                                        ModelCategory category,
                                        int datasetSize,
                                        ExecutionMode mode) {

        if (category == null) throw new IllegalArgumentException("category=null");
        if (mode == null || !mode.isConcrete()) {
            throw new IllegalArgumentException("mode must be resolved before configuring parameters: " + mode);
        }

        IntFunction<TrainingParameters> override = CATEGORY_OVERRIDES.get(category);
        TrainingParameters categoryLayer = override != null ? override.apply(datasetSize) : TrainingParameters.EMPTY;

        int categoryBatch = categoryLayer.batchSize() != null ? categoryLayer.batchSize() : DEFAULTS.batchSize();

        TrainingParameters effective = DEFAULTS
                .overlay(categoryLayer)
                .overlay(modeLayer(mode, categoryBatch))
                .overlay(userParams);

        log.debug("⚙️ PARAMS type={} mode={} size={} → {}", category.value(), mode.value(), datasetSize, effective.toMap());
        return effective;
    }

    private static TrainingParameters modeLayer(ExecutionMode mode, int categoryBatch) {
        return switch (mode) {
            // локально: маленький batch, смешанная точность, накопление градиентов
            case LOCAL -> TrainingParameters.builder()
                    .batchSize(Math.min(categoryBatch, 8))
                    .fp16(true)
                    .gradientAccumulationSteps(2)
                    .cpuThreads(6)
                    .build();
            case HYBRID -> TrainingParameters.builder()
                    .fp16(true)
                    .offloadOptimizer(true)
                    .gradientCheckpointing(true)
                    .build();
            case CLOUD -> TrainingParameters.builder()
                    .batchSize(categoryBatch * 2)
                    .fp16(true)
                    .build();
            case AUTO -> throw new IllegalArgumentException("AUTO is not a concrete mode");
        };
    }
}
