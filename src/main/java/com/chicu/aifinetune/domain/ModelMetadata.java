package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/** Что оркестратор передаёт реестру при регистрации модели */
@Builder
public record ModelMetadata(
        ModelCategory baseModelType,
        String purpose,
        String targetDomain,
        LearnerProfile learnerProfileTarget,
        Instant createdAt,
        Instant lastUsed,
        int trainingDatasetSize,
        ExecutionMode operationMode,
        boolean optimized,
        List<String> tags
) {
    public ModelMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
