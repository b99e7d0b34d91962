package com.chicu.aifinetune.ai.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequestDto {

    private String modelId;
    private String modelType;

    @Builder.Default
    private List<Map<String, Object>> data = List.of();
}
