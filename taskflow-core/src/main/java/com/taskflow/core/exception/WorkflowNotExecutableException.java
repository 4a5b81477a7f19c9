package com.taskflow.core.exception;

import java.util.UUID;

/**
 * Thrown synchronously by start when a workflow is inactive, not published or has no steps.
 */
public class WorkflowNotExecutableException extends TaskflowException {

    public static final String ERROR_CODE = "WORKFLOW_NOT_EXECUTABLE";

    public WorkflowNotExecutableException(UUID workflowId, String reason) {
        super(ERROR_CODE, String.format(
            "Workflow %s cannot be executed: %s",
            workflowId, reason
        ));
    }
}
