package com.taskflow.core.exception;

/**
 * Thrown when a condition cannot be evaluated, e.g. an ordering operator over incomparable values.
 */
public class ConditionEvaluationException extends TaskflowException {

    public static final String ERROR_CODE = "CONDITION_EVALUATION_FAILED";

    public ConditionEvaluationException(String message) {
        super(ERROR_CODE, message);
    }
}
