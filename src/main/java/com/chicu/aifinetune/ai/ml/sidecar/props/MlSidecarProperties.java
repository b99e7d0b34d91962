package com.chicu.aifinetune.ai.ml.sidecar.props;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.sidecar")
public class MlSidecarProperties {

    /**
     * Пример: http://127.0.0.1:8001
     */
    private String baseUrl = "http://127.0.0.1:8001";

    /**
     * Защита sidecar (если включена на его стороне).
     */
    private String apiKey = "";

    private long connectTimeoutMs = 1000;

    /**
     * Обучение длинное: читать ответ ждём долго, дедлайн заявки всё равно ограничит сверху.
     */
    private long readTimeoutMs = 600_000;

    /**
     * Пинговать /health при старте (только лог, старт не блокирует).
     */
    private boolean healthCheckOnStartup = true;
}
