package com.taskflow.core.exception;

import com.taskflow.core.model.ActionType;

/**
 * Thrown when an action handler fails.
 */
public class ActionExecutionException extends StepExecutionException {

    public static final String ERROR_CODE = "ACTION_EXECUTION_FAILED";

    public ActionExecutionException(ActionType type, String message, boolean retryable) {
        super(ERROR_CODE, String.format("Action %s failed: %s", type.value(), message), retryable);
    }

    public ActionExecutionException(ActionType type, String message, Throwable cause, boolean retryable) {
        super(ERROR_CODE, String.format("Action %s failed: %s", type.value(), message), cause, retryable);
    }
}
