package com.chicu.aifinetune.domain;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

@Builder(toBuilder = true)
public record OptimizationOptions(
        Boolean pruning,
        Boolean quantization,
        Boolean distillation,
        Boolean compression,

        // выставляются оркестратором по результату детектора переобучения
        Boolean addressOverfitting,
        Double pruningThreshold
) {

    public boolean wantsQuantization() {
        return Boolean.TRUE.equals(quantization);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        if (pruning != null) m.put("pruning", pruning);
        if (quantization != null) m.put("quantization", quantization);
        if (distillation != null) m.put("distillation", distillation);
        if (compression != null) m.put("compression", compression);
        if (addressOverfitting != null) m.put("addressOverfitting", addressOverfitting);
        if (pruningThreshold != null) m.put("pruningThreshold", pruningThreshold);
        return m;
    }
}
