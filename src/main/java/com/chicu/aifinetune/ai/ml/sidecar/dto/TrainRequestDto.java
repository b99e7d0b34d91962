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
public class TrainRequestDto {

    // text-classification / text-generation / ...
    private String modelType;

    // local / hybrid / cloud
    private String mode;

    @Builder.Default
    private List<Map<String, Object>> data = List.of();

    @Builder.Default
    private List<Map<String, Object>> validationData = List.of();

    @Builder.Default
    private Map<String, Object> params = Map.of();
}
