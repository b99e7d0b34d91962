package com.chicu.aifinetune.ai.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizeRequestDto {

    private String modelId;

    // pruning / quantization / distillation / compression / addressOverfitting / pruningThreshold
    @Builder.Default
    private Map<String, Object> options = Map.of();
}
