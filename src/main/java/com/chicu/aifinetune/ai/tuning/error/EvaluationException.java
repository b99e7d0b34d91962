package com.chicu.aifinetune.ai.tuning.error;

import com.chicu.aifinetune.common.enums.ErrorType;

/** Не фатальна: оркестратор превращает её в EvaluationResult с success=false */
public class EvaluationException extends FineTuningException {

    public EvaluationException(String message, Throwable cause) {
        super(ErrorType.EVALUATION, message, cause);
    }
}
