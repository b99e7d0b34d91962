package com.chicu.aifinetune.ai.tuning.preprocess;

import java.util.Map;

/**
 * Общие проверки полей записи.
 */
final class RecordFields {

    private RecordFields() {}

    /** Непустая строка (пробелы считаются содержимым, обрезка: после фильтра) */
    static boolean isNonEmptyString(Object v) {
        return v instanceof String s && !s.isEmpty();
    }

    /** Поле задано: ключ есть и значение не null */
    static boolean isDefined(Map<String, Object> record, String field) {
        return record.get(field) != null;
    }

    /**
     * "Есть что-то осмысленное": не null, не пустая строка, не false, не 0.
     */
    static boolean isPresent(Object v) {
        if (v == null) return false;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        return true;
    }

    static String labelOf(Map<String, Object> record) {
        return String.valueOf(record.get("label"));
    }

    static Object metadataOf(Map<String, Object> record) {
        Object m = record.get("metadata");
        return isPresent(m) ? m : Map.of();
    }
}
