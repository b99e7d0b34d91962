package com.chicu.aifinetune.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Где и как выполняется дообучение.
 * AUTO: только предпочтение, после ModeSelector всегда один из LOCAL/HYBRID/CLOUD.
 */
public enum ExecutionMode {
    AUTO,
    LOCAL,
    HYBRID,
    CLOUD;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) return AUTO;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution mode: " + raw, e);
        }
    }

    public boolean isConcrete() {
        return this != AUTO;
    }
}
