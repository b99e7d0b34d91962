package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ErrorType;

public record ResultError(
        ErrorType type,
        String message,

        // stack trace / доп. подробности, может быть null
        String details
) {}
