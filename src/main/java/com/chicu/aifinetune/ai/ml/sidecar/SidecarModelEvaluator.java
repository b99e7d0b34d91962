package com.chicu.aifinetune.ai.ml.sidecar;

import com.chicu.aifinetune.ai.ml.ModelEvaluator;
import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateResponseDto;
import com.chicu.aifinetune.ai.tuning.error.EvaluationException;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.EvaluationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SidecarModelEvaluator implements ModelEvaluator {

    private final MlSidecarClient client;

    /**
     * ok=false от sidecar → EvaluationResult с success=false и теми метриками, что успели посчитаться.
     * Пустой ответ → EvaluationException (Retry её не повторяет).
     * Сбой транспорта → IllegalStateException из клиента (повторяется).
     */
    @Override
    public EvaluationResult evaluateModel(String modelId, List<Map<String, Object>> data, ModelCategory category) {
        EvaluateRequestDto req = EvaluateRequestDto.builder()
                .modelId(modelId)
                .modelType(category != null ? category.value() : null)
                .data(data != null ? data : List.of())
                .build();

        EvaluateResponseDto resp = client.evaluate(req);
        if (resp == null) {
            throw new EvaluationException("ML sidecar evaluation failed: no response", null);
        }
        if (!resp.isOk()) {
            String reason = "ML sidecar evaluation failed: " + (resp.getMessage() != null ? resp.getMessage() : "unknown");
            log.warn("⚠️ EVAL NOT OK modelId={} partialMetrics={} : {}", modelId, resp.getMetrics(), reason);
            return new EvaluationResult(modelId, false, resp.getMetrics(), reason);
        }

        log.info("🧠 EVAL OK modelId={} samples={} metrics={}", modelId, req.getData().size(), resp.getMetrics());
        return EvaluationResult.ok(modelId, resp.getMetrics());
    }
}
