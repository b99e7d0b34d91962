package com.chicu.aifinetune.ai.ml.analysis;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ai.finetune.overfitting")
public class OverfittingProperties {

    /**
     * Переобучение, если validationLoss > finalLoss * (1 + lossGapRatio).
     */
    private double lossGapRatio = 0.15;

    /**
     * Переобучение, если оценка прошла и accuracy ниже порога. 0 = проверка выключена.
     */
    private double minAccuracy = 0.0;

    /**
     * Рекомендуемый порог прунинга: base + gap/2, в пределах [base..max].
     */
    private double basePruningThreshold = 0.1;
    private double maxPruningThreshold = 0.5;
}
