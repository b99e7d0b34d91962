package com.chicu.aifinetune.ai.tuning.config;

import com.chicu.aifinetune.ai.cache.ResultCacheProperties;
import com.chicu.aifinetune.ai.ml.analysis.OverfittingProperties;
import com.chicu.aifinetune.ai.ml.hardware.HardwareProperties;
import com.chicu.aifinetune.ai.tuning.FineTuningProperties;
import com.chicu.aifinetune.ai.tuning.error.FineTuningException;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        FineTuningProperties.class,
        ResultCacheProperties.class,
        HardwareProperties.class,
        OverfittingProperties.class
})
public class FineTuningConfig {

    /**
     * Повторы вокруг trainModel / evaluateModel.
     * FineTuningException (валидация, таймаут, отказ оценки) не повторяется.
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryRegistry fineTuningRetryRegistry(FineTuningProperties props) {
        FineTuningProperties.Retry r = props.getRetry();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, r.getMaxAttempts()))
                .waitDuration(r.getWait() != null ? r.getWait() : Duration.ofMillis(500))
                .ignoreExceptions(FineTuningException.class, IllegalArgumentException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.getEventPublisher().onEntryAdded(e -> e.getAddedEntry().getEventPublisher()
                .onRetry(ev -> log.warn("🔁 RETRY {} attempt={} wait={} : {}",
                        ev.getName(), ev.getNumberOfRetryAttempts(), ev.getWaitInterval(),
                        ev.getLastThrowable() != null ? ev.getLastThrowable().getMessage() : null)));

        log.info("🔁 RetryRegistry поднят. maxAttempts={} wait={}", config.getMaxAttempts(), r.getWait());
        return registry;
    }
}
