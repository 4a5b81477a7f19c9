package com.taskflow.core.model;

import java.util.Map;

/**
 * A side effect attached to an action step.
 */
public record WorkflowAction(
    ActionType type,
    String target,
    Map<String, Object> parameters
) {
    public WorkflowAction {
        if (type == null) {
            throw new IllegalArgumentException("Action type must not be null");
        }
        parameters = VariableMap.freeze(parameters);
    }

    public static WorkflowAction of(ActionType type, String target, Map<String, ?> parameters) {
        return new WorkflowAction(type, target, VariableMap.freeze(parameters));
    }

    public static WorkflowAction of(ActionType type, Map<String, ?> parameters) {
        return of(type, null, parameters);
    }

    public VariableMap params() {
        return VariableMap.of(parameters);
    }

    public boolean hasTarget() {
        return target != null && !target.isBlank();
    }
}
