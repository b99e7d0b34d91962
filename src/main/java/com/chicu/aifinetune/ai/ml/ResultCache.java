package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.domain.FineTuningResult;

import java.util.Optional;
import java.util.Set;

/**
 * Кэш готовых результатов по отпечатку заявки.
 * Каждая операция атомарна по ключу; запись: last-write-wins.
 */
public interface ResultCache {

    Optional<FineTuningResult> get(String key);

    /**
     * Чтение без побочных эффектов: запись не поднимается между уровнями, TTL не трогается.
     */
    Optional<FineTuningResult> peek(String key);

    void set(String key, FineTuningResult value);

    boolean delete(String key);

    Set<String> listKeys();

    void clear();
}
