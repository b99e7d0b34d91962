package com.chicu.aifinetune.ai.tuning.preprocess;

import com.chicu.aifinetune.ai.tuning.error.ValidationException;
import com.chicu.aifinetune.common.enums.ModelCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Валидация и нормализация обучающих записей.
 * Пустой вход: ошибка сразу; отдельные плохие записи молча отбрасываются.
 */
@Slf4j
@Service
public class DataPreprocessor {

    private final Map<ModelCategory, RecordNormalizer> normalizers = new EnumMap<>(ModelCategory.class);

    public DataPreprocessor(List<RecordNormalizer> normalizerList) {
        for (RecordNormalizer n : normalizerList) {
            ModelCategory category = n.getCategory();
            if (category == null) continue;

            RecordNormalizer prev = normalizers.put(category, n);
            if (prev != null) {
                log.warn("⚠️ Найдено 2 нормализатора для {}: {} и {}. Использую последний.",
                        category.value(), prev.getClass().getSimpleName(), n.getClass().getSimpleName());
            }
        }

        log.info("📦 DataPreprocessor поднят. Категорий: {}", normalizers.size());
    }

    public List<Map<String, Object>> process(List<Map<String, Object>> rawRecords, String modelType) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            throw new ValidationException("Empty training dataset provided");
        }

        ModelCategory category = ModelCategory.fromValue(modelType)
                .orElseThrow(() -> new ValidationException("Unsupported model type: " + modelType));

        return process(rawRecords, category);
    }

    public List<Map<String, Object>> process(List<Map<String, Object>> rawRecords, ModelCategory category) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            throw new ValidationException("Empty training dataset provided");
        }

        RecordNormalizer normalizer = normalizers.get(category);
        if (normalizer == null) {
            throw new ValidationException("Unsupported model type: " + (category == null ? null : category.value()));
        }

        List<Map<String, Object>> out = new ArrayList<>(rawRecords.size());
        for (Map<String, Object> record : rawRecords) {
            if (record == null) continue;
            Optional<Map<String, Object>> normalized = normalizer.normalize(record);
            normalized.ifPresent(out::add);
        }

        int dropped = rawRecords.size() - out.size();
        if (dropped > 0) {
            log.warn("⚠️ PREPROCESS type={} in={} out={} dropped={}",
                    category.value(), rawRecords.size(), out.size(), dropped);
        }

        return out;
    }
}
