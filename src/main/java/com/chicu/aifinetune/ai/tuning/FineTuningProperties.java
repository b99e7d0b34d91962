package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ai.finetune")
public class FineTuningProperties {

    /**
     * Режим, закреплённый "снаружи" (не из заявки). auto = решает ModeSelector.
     */
    private ExecutionMode pinnedMode = ExecutionMode.AUTO;

    /**
     * Дедлайн заявки, если она не прислала свой.
     */
    private Duration defaultTimeout = Duration.ofMinutes(30);

    /**
     * Одинаковые одновременные заявки (тот же отпечаток) ждут одно вычисление.
     */
    private boolean singleFlight = true;

    /**
     * true: ошибка выкладки пробрасывается вызывающему как DeploymentException.
     * false: возвращается двухфазный результат (registered=true, deployed=false).
     */
    private boolean propagateDeploymentErrors = false;

    /**
     * Потоки, на которых крутится конвейер.
     */
    private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    private Retry retry = new Retry();

    private ModeThresholds local = new ModeThresholds(500, 6, 0.7, 8192);
    private ModeThresholds hybrid = new ModeThresholds(5000, 4, 0.8, 4096);

    @Data
    public static class Retry {
        /**
         * Сколько всего попыток на trainModel / evaluateModel (1 = без повторов).
         */
        private int maxAttempts = 3;
        private Duration wait = Duration.ofMillis(500);
    }

    /**
     * Порог одного яруса таблицы режимов. Все условия строгие, кроме minCpuCores (>=).
     */
    @Data
    public static class ModeThresholds {
        private int maxExamples;
        private int minCpuCores;
        private double maxCpuUtilization;
        private long minAvailableMemoryMb;

        public ModeThresholds() {
        }

        public ModeThresholds(int maxExamples, int minCpuCores, double maxCpuUtilization, long minAvailableMemoryMb) {
            this.maxExamples = maxExamples;
            this.minCpuCores = minCpuCores;
            this.maxCpuUtilization = maxCpuUtilization;
            this.minAvailableMemoryMb = minAvailableMemoryMb;
        }
    }
}
