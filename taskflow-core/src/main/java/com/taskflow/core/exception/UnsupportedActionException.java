package com.taskflow.core.exception;

import com.taskflow.core.model.ActionType;

/**
 * Thrown when no handler is registered for an action type.
 * This is a configuration error and is never retried.
 */
public class UnsupportedActionException extends StepExecutionException {

    public static final String ERROR_CODE = "UNSUPPORTED_ACTION";

    public UnsupportedActionException(ActionType type) {
        super(ERROR_CODE, "Unsupported action type: " + type.value(), false);
    }
}
