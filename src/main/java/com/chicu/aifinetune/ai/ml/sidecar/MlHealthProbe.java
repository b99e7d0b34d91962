package com.chicu.aifinetune.ai.ml.sidecar;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ml.sidecar", name = "health-check-on-startup", havingValue = "true", matchIfMissing = true)
public class MlHealthProbe implements ApplicationRunner {

    private final MlSidecarClient client;

    @Override
    public void run(ApplicationArguments args) {
        try {
            var node = client.health();
            log.info("✅ ML sidecar OK: {}", node.toString());
        } catch (Exception e) {
            // старт не валим
            log.warn("⚠️ ML sidecar NOT available: {}", e.getMessage());
        }
    }
}
