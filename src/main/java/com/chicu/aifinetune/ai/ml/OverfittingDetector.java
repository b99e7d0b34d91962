package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.domain.EvaluationResult;

public interface OverfittingDetector {

    OverfittingAnalysis detectOverfitting(TrainingMetrics trainingMetrics, EvaluationResult evaluation);
}
