package com.chicu.aifinetune.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Классы ошибок конвейера дообучения */
public enum ErrorType {
    VALIDATION,
    EVALUATION,
    DEPLOYMENT,
    TIMEOUT,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
