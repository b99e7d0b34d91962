package com.chicu.aifinetune.domain;

import lombok.Builder;

/**
 * Снимок железа на момент выбора режима. Нигде не сохраняется.
 * Память: в мегабайтах, загрузка: доля 0..1.
 */
@Builder
public record HardwareSnapshot(
        int cpuCores,
        double cpuUtilization,

        long memoryTotalMb,
        long memoryAvailableMb,
        double memoryUtilization,

        boolean gpuAvailable,
        String gpuModel,
        Long gpuMemoryMb,

        Double cpuTemperature,
        Double gpuTemperature
) {}
