package com.chicu.aifinetune.ai.tuning.error;

import com.chicu.aifinetune.common.enums.ErrorType;

public class PipelineTimeoutException extends FineTuningException {

    public PipelineTimeoutException(String message) {
        super(ErrorType.TIMEOUT, message);
    }
}
