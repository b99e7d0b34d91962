package com.chicu.aifinetune.ai.tuning.error;

import com.chicu.aifinetune.common.enums.ErrorType;
import com.chicu.aifinetune.domain.FineTuningResult;

/**
 * Выкладка упала ПОСЛЕ успешной регистрации.
 * result: уже собранный двухфазный итог (registered=true, deployed=false).
 */
public class DeploymentException extends FineTuningException {

    private final transient FineTuningResult result;

    public DeploymentException(String message) {
        this(message, null, null);
    }

    public DeploymentException(String message, Throwable cause, FineTuningResult result) {
        super(ErrorType.DEPLOYMENT, message, cause);
        this.result = result;
    }

    public FineTuningResult getResult() {
        return result;
    }
}
