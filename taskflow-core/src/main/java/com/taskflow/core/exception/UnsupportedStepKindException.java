package com.taskflow.core.exception;

import com.taskflow.core.model.StepKind;

/**
 * Thrown for step kinds the engine cannot run. Never retried.
 */
public class UnsupportedStepKindException extends StepExecutionException {

    public static final String ERROR_CODE = "UNSUPPORTED_STEP_KIND";

    public UnsupportedStepKindException(StepKind kind) {
        super(ERROR_CODE, "Unsupported step kind: " + kind.value(), false);
    }
}
