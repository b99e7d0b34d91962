package com.chicu.aifinetune.ai.tuning.preprocess;

import com.chicu.aifinetune.common.enums.ModelCategory;

import java.util.Map;
import java.util.Optional;

/**
 * Фильтр + нормализация одной записи датасета для своей категории.
 * empty = запись молча отбрасывается.
 */
public interface RecordNormalizer {

    ModelCategory getCategory();

    Optional<Map<String, Object>> normalize(Map<String, Object> record);
}
