package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.domain.FineTuningRequest;
import com.chicu.aifinetune.domain.HardwareSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Выбор режима: заявка → закреплённый режим → таблица порогов по железу.
 * Чистая функция от входов, никакого скрытого состояния.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModeSelector {

    private final FineTuningProperties props;

    public ExecutionMode resolve(FineTuningRequest request, ExecutionMode pinnedMode, HardwareSnapshot hardware) {
        return resolve(request, pinnedMode, () -> hardware);
    }

    /**
     * Железо читается только если до таблицы порогов реально дошли.
     * Никогда не возвращает AUTO.
     */
    public ExecutionMode resolve(FineTuningRequest request,
                                 ExecutionMode pinnedMode,
                                 Supplier<HardwareSnapshot> hardware) {

        if (request == null) throw new IllegalArgumentException("request=null");

        if (request.preferredMode() != null && request.preferredMode().isConcrete()) {
            return request.preferredMode();
        }

        if (pinnedMode != null && pinnedMode.isConcrete()) {
            return pinnedMode;
        }

        int examples = request.combinedExampleCount();
        HardwareSnapshot hw = hardware.get();
        if (hw == null) {
            log.warn("⚠️ Нет снимка железа: режим cloud (examples={})", examples);
            return ExecutionMode.CLOUD;
        }

        ExecutionMode mode;
        if (fits(props.getLocal(), examples, hw)) {
            mode = ExecutionMode.LOCAL;
        } else if (fits(props.getHybrid(), examples, hw)) {
            mode = ExecutionMode.HYBRID;
        } else {
            mode = ExecutionMode.CLOUD;
        }

        log.debug("🧭 MODE auto → {} examples={} cores={} cpu={} memAvailMb={}",
                mode, examples, hw.cpuCores(), hw.cpuUtilization(), hw.memoryAvailableMb());
        return mode;
    }

    private static boolean fits(FineTuningProperties.ModeThresholds t, int examples, HardwareSnapshot hw) {
        return examples < t.getMaxExamples()
                && hw.cpuCores() >= t.getMinCpuCores()
                && hw.cpuUtilization() < t.getMaxCpuUtilization()
                && hw.memoryAvailableMb() > t.getMinAvailableMemoryMb();
    }
}
