package com.chicu.aifinetune.ai.ml.hardware;

import com.chicu.aifinetune.ai.ml.HardwareSnapshotProvider;
import com.chicu.aifinetune.domain.HardwareSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Снимок железа из JVM: ядра, загрузка CPU, физическая память.
 * GPU и температуры берутся из конфига. Недоступные показатели подменяются fallback-значениями.
 */
@Slf4j
@Component
public class JvmHardwareSnapshotProvider implements HardwareSnapshotProvider {

    private static final long MB = 1024L * 1024L;

    private final HardwareProperties props;
    private final OperatingSystemMXBean os;

    @Autowired
    public JvmHardwareSnapshotProvider(HardwareProperties props) {
        this(props, ManagementFactory.getOperatingSystemMXBean());
    }

    JvmHardwareSnapshotProvider(HardwareProperties props, OperatingSystemMXBean os) {
        this.props = props;
        this.os = os;
    }

    @Override
    public HardwareSnapshot snapshot() {
        int cores = os != null ? os.getAvailableProcessors() : -1;
        if (cores <= 0) cores = props.getFallbackCpuCores();

        double cpu = -1.0;
        long totalMb = -1;
        long freeMb = -1;

        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            try {
                cpu = sun.getCpuLoad();
                totalMb = sun.getTotalMemorySize() / MB;
                freeMb = sun.getFreeMemorySize() / MB;
            } catch (RuntimeException e) {
                log.debug("🖥️ HW platform metrics unavailable: {}", e.getMessage());
            }
        }

        // getCpuLoad() < 0: "пока не знаю" (первый вызов, контейнер и т.п.)
        if (cpu < 0 || Double.isNaN(cpu)) cpu = props.getFallbackCpuUtilization();
        if (totalMb <= 0) totalMb = props.getFallbackMemoryTotalMb();
        if (freeMb < 0) freeMb = props.getFallbackMemoryAvailableMb();

        double memUtil = totalMb > 0 ? 1.0 - ((double) freeMb / totalMb) : 0.0;

        HardwareSnapshot snap = HardwareSnapshot.builder()
                .cpuCores(cores)
                .cpuUtilization(cpu)
                .memoryTotalMb(totalMb)
                .memoryAvailableMb(freeMb)
                .memoryUtilization(memUtil)
                .gpuAvailable(props.isGpuAvailable())
                .gpuModel(props.getGpuModel())
                .gpuMemoryMb(props.getGpuMemoryMb())
                .cpuTemperature(props.getCpuTemperature())
                .gpuTemperature(props.getGpuTemperature())
                .build();

        log.debug("🖥️ HW cores={} cpu={} memTotalMb={} memAvailMb={} gpu={}",
                cores, cpu, totalMb, freeMb, props.isGpuAvailable());
        return snap;
    }
}
