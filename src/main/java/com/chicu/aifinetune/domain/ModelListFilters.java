package com.chicu.aifinetune.domain;

import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Фильтры списка моделей. Каждое null-поле не ограничивает выборку.
 * tags: у модели должны быть ВСЕ перечисленные теги.
 */
@Builder
public record ModelListFilters(
        String purpose,
        String targetDomain,
        ModelCategory modelType,
        Double minAccuracy,
        ModelStatus status,
        Instant createdAfter,
        List<String> tags
) {
    public static final ModelListFilters NONE = ModelListFilters.builder().build();

    public ModelListFilters {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean matches(ModelInfo m) {
        if (m == null) return false;
        if (purpose != null && !purpose.equals(m.purpose())) return false;
        if (targetDomain != null && !targetDomain.equals(m.targetDomain())) return false;
        if (modelType != null && modelType != m.baseModelType()) return false;
        if (status != null && status != m.status()) return false;
        if (createdAfter != null && (m.createdAt() == null || !m.createdAt().isAfter(createdAfter))) return false;

        if (minAccuracy != null) {
            Double acc = m.metrics().get("accuracy");
            if (acc == null || acc < minAccuracy) return false;
        }

        return m.tags().containsAll(tags);
    }
}
