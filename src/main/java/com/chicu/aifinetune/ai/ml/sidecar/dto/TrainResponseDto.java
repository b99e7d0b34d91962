package com.chicu.aifinetune.ai.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ и на /train, и на /optimize.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainResponseDto {

    private boolean ok;

    private String modelId;
    private long modelSize;

    private int epochs;
    private double finalLoss;
    private double validationLoss;
    private long trainingTimeMs;

    private String message;
}
