package com.taskflow.core.exception;

/**
 * Thrown when a workflow, execution or task is not found.
 */
public class NotFoundException extends TaskflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, Object entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
