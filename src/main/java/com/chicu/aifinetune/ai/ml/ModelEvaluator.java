package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.EvaluationResult;

import java.util.List;
import java.util.Map;

public interface ModelEvaluator {

    EvaluationResult evaluateModel(String modelId, List<Map<String, Object>> data, ModelCategory category);
}
