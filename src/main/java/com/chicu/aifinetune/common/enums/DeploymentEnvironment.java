package com.chicu.aifinetune.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Куда можно выкатить дообученную модель */
public enum DeploymentEnvironment {
    LOCAL,
    CLOUD,
    EDGE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DeploymentEnvironment> fromValue(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (DeploymentEnvironment e : values()) {
            if (e.name().equals(v)) return Optional.of(e);
        }
        return Optional.empty();
    }
}
