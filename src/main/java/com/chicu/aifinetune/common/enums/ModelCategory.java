package com.chicu.aifinetune.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Категории базовых моделей, которые умеет дообучать сервис */
public enum ModelCategory {
    TEXT_CLASSIFICATION("text-classification"),
    TEXT_GENERATION("text-generation"),
    IMAGE_CLASSIFICATION("image-classification"),
    MULTIMODAL("multimodal");

    private final String value;

    ModelCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Разбор "проводного" значения (text-classification и т.п.).
     * Неизвестное значение → empty, решение об ошибке принимает вызывающий.
     */
    public static Optional<ModelCategory> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (ModelCategory c : values()) {
            if (c.value.equals(v)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
