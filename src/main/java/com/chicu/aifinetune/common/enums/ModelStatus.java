package com.chicu.aifinetune.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Статус модели в реестре */
public enum ModelStatus {
    TRAINING,
    REGISTERED,
    DEPLOYED,
    FAILED,
    ARCHIVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModelStatus> fromValue(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Такую модель можно переиспользовать вместо повторного обучения */
    public boolean isReusable() {
        return this == REGISTERED || this == DEPLOYED;
    }
}
