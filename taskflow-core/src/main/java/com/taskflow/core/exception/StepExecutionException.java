package com.taskflow.core.exception;

/**
 * Failure raised by a step handler.
 * Carries whether the runner may retry the step.
 */
public class StepExecutionException extends TaskflowException {

    public static final String ERROR_CODE = "STEP_EXECUTION_FAILED";

    private final boolean retryable;

    public StepExecutionException(String errorCode, String message, boolean retryable) {
        super(errorCode, message);
        this.retryable = retryable;
    }

    public StepExecutionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(errorCode, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static StepExecutionException permanent(String errorCode, String message) {
        return new StepExecutionException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static StepExecutionException transient_(String errorCode, String message) {
        return new StepExecutionException(errorCode, message, true);
    }
}
