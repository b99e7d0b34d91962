package com.chicu.aifinetune.ai.ml.analysis;

import com.chicu.aifinetune.ai.ml.OverfittingAnalysis;
import com.chicu.aifinetune.ai.ml.OverfittingDetector;
import com.chicu.aifinetune.ai.ml.TrainingMetrics;
import com.chicu.aifinetune.domain.EvaluationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Переобучение по разрыву loss'ов:
 * validationLoss > finalLoss * (1 + lossGapRatio), либо оценка прошла, но accuracy ниже minAccuracy.
 * <p>
 * Порог прунинга растёт с относительным разрывом: clamp(base + gap / 2, base, max).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LossGapOverfittingDetector implements OverfittingDetector {

    private final OverfittingProperties props;

    @Override
    public OverfittingAnalysis detectOverfitting(TrainingMetrics trainingMetrics, EvaluationResult evaluation) {
        if (trainingMetrics == null) {
            return OverfittingAnalysis.none();
        }

        double train = trainingMetrics.finalLoss();
        double val = trainingMetrics.validationLoss();

        double relativeGap = train > 0 ? (val - train) / train : 0.0;
        boolean lossGap = train > 0 && val > train * (1.0 + props.getLossGapRatio());

        boolean lowAccuracy = false;
        if (props.getMinAccuracy() > 0 && evaluation != null && evaluation.success()) {
            Double acc = evaluation.metric("accuracy");
            lowAccuracy = acc != null && acc < props.getMinAccuracy();
        }

        if (!lossGap && !lowAccuracy) {
            return OverfittingAnalysis.none();
        }

        double base = props.getBasePruningThreshold();
        double threshold = clamp(base + Math.max(0.0, relativeGap) / 2.0, base, props.getMaxPruningThreshold());

        String reason = lossGap
                ? String.format(Locale.ROOT, "validationLoss %.4f > finalLoss %.4f (gap %.1f%%)", val, train, relativeGap * 100)
                : "accuracy below " + props.getMinAccuracy();

        log.info("📉 OVERFIT detected loss={} valLoss={} gap={} pruning={} reason={}",
                train, val, relativeGap, threshold, reason);

        return new OverfittingAnalysis(true, threshold, reason);
    }

    private static double clamp(double v, double min, double max) {
        if (max < min) return min;
        return Math.max(min, Math.min(max, v));
    }
}
