package com.taskflow.engine.action;

import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.WorkflowAction;

import java.util.Map;
import java.util.Set;

/**
 * Routes workflow actions to their handlers.
 */
public interface ActionDispatcher {

    boolean supports(ActionType type);

    Set<ActionType> supportedActions();

    /**
     * Execute an action.
     *
     * @param action The action
     * @param context The invoking run
     * @return Output of the action
     * @throws com.taskflow.core.exception.UnsupportedActionException if no handler is registered for the type
     * @throws com.taskflow.core.exception.ActionExecutionException if the handler fails
     */
    Map<String, Object> execute(WorkflowAction action, ActionContext context);
}
