package com.chicu.aifinetune.ai.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ai.finetune.cache")
public class ResultCacheProperties {

    /**
     * L1: "горячие" результаты.
     */
    private Tier l1 = new Tier(20, Duration.ofMinutes(5));

    /**
     * L2: "тёплые".
     */
    private Tier l2 = new Tier(50, Duration.ofMinutes(30));

    /**
     * L3: "холодные".
     */
    private Tier l3 = new Tier(100, Duration.ofHours(2));

    @Data
    public static class Tier {
        private long maxSize;
        private Duration ttl;

        public Tier() {
        }

        public Tier(long maxSize, Duration ttl) {
            this.maxSize = maxSize;
            this.ttl = ttl;
        }
    }
}
