package com.chicu.aifinetune.ai.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeployResponseDto {

    private boolean ok;

    private String endpoint;
    private String message;
}
