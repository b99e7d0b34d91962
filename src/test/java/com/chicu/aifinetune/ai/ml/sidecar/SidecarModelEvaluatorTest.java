package com.chicu.aifinetune.ai.ml.sidecar;

import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateResponseDto;
import com.chicu.aifinetune.ai.tuning.error.EvaluationException;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.domain.EvaluationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SidecarModelEvaluatorTest {

    @Mock
    private MlSidecarClient client;

    @InjectMocks
    private SidecarModelEvaluator evaluator;

    @Test
    void okResponse_shouldBecomeSuccessfulEvaluation() {
        when(client.evaluate(any())).thenReturn(EvaluateResponseDto.builder()
                .ok(true).modelId("m1").metrics(Map.of("accuracy", 0.93, "f1", 0.9)).build());

        EvaluationResult res = evaluator.evaluateModel("m1", List.of(), ModelCategory.TEXT_CLASSIFICATION);

        assertTrue(res.success());
        assertEquals(0.93, res.metric("accuracy"));
        assertNull(res.error());
    }

    @Test
    void notOkResponse_shouldKeepPartialMetrics() {
        when(client.evaluate(any())).thenReturn(EvaluateResponseDto.builder()
                .ok(false).message("bad labels").metrics(Map.of("accuracy", 0.41)).build());

        EvaluationResult res = evaluator.evaluateModel("m1", null, ModelCategory.MULTIMODAL);

        assertFalse(res.success());
        assertEquals("m1", res.modelId());
        assertEquals(0.41, res.metric("accuracy"), "посчитанные sidecar'ом метрики не теряются");
        assertTrue(res.error().contains("bad labels"));
    }

    @Test
    void missingResponse_shouldThrowEvaluationException() {
        when(client.evaluate(any())).thenReturn(null);

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> evaluator.evaluateModel("m1", List.of(), ModelCategory.TEXT_CLASSIFICATION));

        assertTrue(e.getMessage().contains("no response"));
    }
}
