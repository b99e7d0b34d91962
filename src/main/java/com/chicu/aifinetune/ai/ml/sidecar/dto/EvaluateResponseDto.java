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
public class EvaluateResponseDto {

    private boolean ok;

    private String modelId;

    // accuracy, f1Score, precision, recall ...
    @Builder.Default
    private Map<String, Double> metrics = Map.of();

    private String message;
}
