package com.chicu.aifinetune.ai.ml.hardware;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ai.finetune.hardware")
public class HardwareProperties {

    /**
     * GPU и температуры JVM не видит: берём из конфига.
     */
    private boolean gpuAvailable = false;
    private String gpuModel;
    private Long gpuMemoryMb;
    private Double cpuTemperature;
    private Double gpuTemperature;

    /**
     * Что подставлять, если платформа не отдаёт показатель.
     */
    private int fallbackCpuCores = 8;
    private double fallbackCpuUtilization = 0.4;
    private long fallbackMemoryTotalMb = 32_768;
    private long fallbackMemoryAvailableMb = 18_432;
}
