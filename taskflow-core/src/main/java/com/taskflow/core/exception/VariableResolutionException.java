package com.taskflow.core.exception;

/**
 * Thrown when a {@code {{name}}} template references a variable that is not set.
 */
public class VariableResolutionException extends TaskflowException {

    public static final String ERROR_CODE = "VARIABLE_NOT_FOUND";

    public VariableResolutionException(String variableName) {
        super(ERROR_CODE, "Variable not found: " + variableName);
    }
}
