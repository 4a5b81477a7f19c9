package com.taskflow.engine.action;

import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.WorkflowAction;

import java.util.Map;

/**
 * Performs one type of workflow action.
 *
 * Handlers receive actions whose string parameters have already been resolved against
 * the execution variables.
 */
public interface ActionHandler {

    ActionType type();

    /**
     * @return output merged into the step output
     * @throws com.taskflow.core.exception.ActionExecutionException on failure
     */
    Map<String, Object> execute(WorkflowAction action, ActionContext context);
}
