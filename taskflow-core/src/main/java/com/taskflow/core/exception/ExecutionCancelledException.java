package com.taskflow.core.exception;

/**
 * Thrown out of a cooperative suspension when the owning execution is cancelled.
 */
public class ExecutionCancelledException extends TaskflowException {

    public static final String ERROR_CODE = "EXECUTION_CANCELLED";

    public ExecutionCancelledException(Object executionId) {
        super(ERROR_CODE, "Execution cancelled: " + executionId);
    }
}
