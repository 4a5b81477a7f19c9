package com.taskflow.core.exception;

/**
 * Thrown when a variable is present but holds a value of an unexpected type.
 */
public class VariableTypeException extends TaskflowException {

    public static final String ERROR_CODE = "VARIABLE_TYPE_MISMATCH";

    public VariableTypeException(String key, String expectedType, Object actual) {
        super(ERROR_CODE, String.format(
            "Variable '%s' expected %s but was %s",
            key, expectedType, actual == null ? "null" : actual.getClass().getSimpleName()
        ));
    }

    public VariableTypeException(String key, String expectedType, String reason) {
        super(ERROR_CODE, String.format(
            "Variable '%s' expected %s: %s",
            key, expectedType, reason
        ));
    }
}
