package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ErrorType;
import com.chicu.aifinetune.common.enums.ExecutionMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FineTuningResultTest {

    @Test
    void successfulResult_mustCarryModelId() {
        assertThrows(IllegalArgumentException.class, () -> FineTuningResult.builder().success(true).build());
    }

    @Test
    void failedResult_mustCarryErrorAndEmptyModelId() {
        ResultError err = new ResultError(ErrorType.VALIDATION, "bad", null);

        assertThrows(IllegalArgumentException.class, () -> FineTuningResult.builder().success(false).build(),
                "без error");
        assertThrows(IllegalArgumentException.class,
                () -> FineTuningResult.builder().success(false).error(err).modelId("m1").build(),
                "с непустым modelId");

        FineTuningResult ok = FineTuningResult.builder().success(false).error(err).build();
        assertEquals("", ok.modelId(), "null modelId нормализуется в пустую строку");
        assertFalse(ok.deployment().registered(), "по умолчанию: не зарегистрирована");
    }

    @Test
    void collections_shouldBeDefensiveCopies() {
        List<ResultWarning> warnings = new ArrayList<>();
        warnings.add(ResultWarning.overfitting());

        FineTuningResult r = FineTuningResult.builder()
                .modelId("m1")
                .success(true)
                .warnings(warnings)
                .build();
        warnings.clear();

        assertEquals(1, r.warnings().size());
        assertThrows(UnsupportedOperationException.class, () -> r.metrics().put("x", 1.0));
    }

    @Test
    void request_shouldDefaultOptionalFields() {
        FineTuningRequest req = FineTuningRequest.builder().modelType("multimodal").build();

        assertTrue(req.trainingData().isEmpty());
        assertTrue(req.tags().isEmpty());
        assertTrue(req.cachingEnabled(), "enableCaching=null → true");
        assertEquals(ExecutionMode.AUTO, req.preferredMode());
        assertEquals(0, req.combinedExampleCount());
    }
}
