package com.chicu.aifinetune.domain;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Инструкции по выкладке.
 * environment хранится строкой "как прислали": неподдерживаемое значение: ошибка выкладки, а не парсинга запроса.
 */
@Builder
public record DeploymentOptions(
        String environment,
        String endpointName,
        Map<String, Object> config
) {
    public DeploymentOptions {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("environment", environment);
        if (endpointName != null) m.put("endpointName", endpointName);
        if (!config.isEmpty()) m.put("config", config);
        return m;
    }
}
