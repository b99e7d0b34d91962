package com.chicu.aifinetune.ai.tuning.error;

import com.chicu.aifinetune.common.enums.ErrorType;

/** Пустой датасет, неизвестная категория и т.п.: фатально для заявки */
public class ValidationException extends FineTuningException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION, message);
    }
}
