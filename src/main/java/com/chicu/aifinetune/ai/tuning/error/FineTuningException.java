package com.chicu.aifinetune.ai.tuning.error;

import com.chicu.aifinetune.common.enums.ErrorType;

/**
 * Базовая ошибка конвейера. Тип определяет, как оркестратор её отразит в результате.
 */
public class FineTuningException extends RuntimeException {

    private final ErrorType type;

    public FineTuningException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public FineTuningException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }
}
