package com.chicu.aifinetune.domain;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Параметры обучения.
 * null в поле = "не задано": при наложении слоёв (defaults → категория → режим → пользователь)
 * побеждает последний слой, где поле задано.
 */
@Builder(toBuilder = true)
public record TrainingParameters(
        Integer epochs,
        Integer batchSize,
        Double learningRate,
        String evaluationStrategy,
        Integer warmupSteps,
        Double weightDecay,

        // режимные
        Boolean fp16,
        Integer gradientAccumulationSteps,
        Integer cpuThreads,
        Boolean offloadOptimizer,
        Boolean gradientCheckpointing,

        // всё, чего нет в полях выше (передаётся тренеру как есть)
        Map<String, Object> extra
) {
    public static final TrainingParameters EMPTY = TrainingParameters.builder().build();

    public TrainingParameters {
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Накладывает top поверх this: каждое заданное поле top побеждает.
     * extra сливается по ключам.
     */
    public TrainingParameters overlay(TrainingParameters top) {
        if (top == null) return this;

        Map<String, Object> mergedExtra = new LinkedHashMap<>(extra);
        mergedExtra.putAll(top.extra());

        return new TrainingParameters(
                pick(top.epochs, epochs),
                pick(top.batchSize, batchSize),
                pick(top.learningRate, learningRate),
                pick(top.evaluationStrategy, evaluationStrategy),
                pick(top.warmupSteps, warmupSteps),
                pick(top.weightDecay, weightDecay),
                pick(top.fp16, fp16),
                pick(top.gradientAccumulationSteps, gradientAccumulationSteps),
                pick(top.cpuThreads, cpuThreads),
                pick(top.offloadOptimizer, offloadOptimizer),
                pick(top.gradientCheckpointing, gradientCheckpointing),
                mergedExtra
        );
    }

    /** Плоский вид для передачи во внешний тренер (только заданные поля) */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        putIfSet(m, "epochs", epochs);
        putIfSet(m, "batchSize", batchSize);
        putIfSet(m, "learningRate", learningRate);
        putIfSet(m, "evaluationStrategy", evaluationStrategy);
        putIfSet(m, "warmupSteps", warmupSteps);
        putIfSet(m, "weightDecay", weightDecay);
        putIfSet(m, "fp16", fp16);
        putIfSet(m, "gradientAccumulationSteps", gradientAccumulationSteps);
        putIfSet(m, "cpuThreads", cpuThreads);
        putIfSet(m, "offloadOptimizer", offloadOptimizer);
        putIfSet(m, "gradientCheckpointing", gradientCheckpointing);
        m.putAll(extra);
        return m;
    }

    private static <T> T pick(T top, T base) {
        return top != null ? top : base;
    }

    private static void putIfSet(Map<String, Object> m, String k, Object v) {
        if (v != null) m.put(k, v);
    }
}
