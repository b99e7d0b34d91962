package com.chicu.aifinetune.domain;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Builder
public record LearnerProfile(
        String learnerId,

        // beginner / intermediate / advanced ...: входит в ключ кэша
        String skillLevel,

        String nativeLanguage,

        Map<String, Object> preferences
) {
    public LearnerProfile {
        preferences = preferences == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
    }
}
