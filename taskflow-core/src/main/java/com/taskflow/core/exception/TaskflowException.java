package com.taskflow.core.exception;

/**
 * Base exception for all taskflow errors.
 */
public class TaskflowException extends RuntimeException {

    private final String errorCode;

    public TaskflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
