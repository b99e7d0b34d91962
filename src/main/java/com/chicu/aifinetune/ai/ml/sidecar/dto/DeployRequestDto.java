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
public class DeployRequestDto {

    private String modelId;

    // local / cloud / edge
    private String environment;

    private String endpointName;

    @Builder.Default
    private Map<String, Object> config = Map.of();
}
