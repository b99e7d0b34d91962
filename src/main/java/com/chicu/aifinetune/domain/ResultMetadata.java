package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import lombok.Builder;

import java.time.Instant;

@Builder
public record ResultMetadata(
        Instant createdAt,
        Instant lastUsed,

        // при ошибке до выбора режима: закреплённый режим (может быть auto)
        ExecutionMode operationMode,

        boolean existingModel,
        long processingTimeMs,

        // null, если до оптимизации не дошли
        Boolean optimized
) {}
