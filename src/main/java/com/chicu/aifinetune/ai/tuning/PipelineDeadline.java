package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.ai.tuning.error.PipelineTimeoutException;

import java.time.Duration;

/**
 * Дедлайн одной заявки. Проверяется перед каждым вызовом внешнего компонента.
 */
public final class PipelineDeadline {

    private final long deadlineNanos;
    private final Duration budget;

    private PipelineDeadline(long deadlineNanos, Duration budget) {
        this.deadlineNanos = deadlineNanos;
        this.budget = budget;
    }

    public static PipelineDeadline after(Duration budget) {
        if (budget == null || budget.isNegative()) budget = Duration.ZERO;
        return new PipelineDeadline(System.nanoTime() + budget.toNanos(), budget);
    }

    public static PipelineDeadline none() {
        return new PipelineDeadline(Long.MAX_VALUE, null);
    }

    public boolean isUnbounded() {
        return budget == null;
    }

    public boolean isExpired() {
        return !isUnbounded() && System.nanoTime() - deadlineNanos >= 0;
    }

    public long remainingMillis() {
        if (isUnbounded()) return Long.MAX_VALUE;
        return Math.max(0L, Duration.ofNanos(deadlineNanos - System.nanoTime()).toMillis());
    }

    /**
     * Бросает PipelineTimeoutException, если время вышло или поток прервали (отмена снаружи).
     */
    public void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineTimeoutException("Fine-tuning cancelled before stage '" + stage + "'");
        }
        if (isExpired()) {
            throw new PipelineTimeoutException("Fine-tuning deadline of " + budget + " exceeded before stage '" + stage + "'");
        }
    }
}
