package com.taskflow.core.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Starts a workflow when a named event arrives and its conditions match the event data.
 */
public record WorkflowTrigger(
    UUID id,
    UUID workflowId,
    String name,
    TriggerType type,
    String event,
    List<WorkflowCondition> conditions,
    Map<String, Object> configuration,
    boolean isActive
) {
    public WorkflowTrigger {
        if (id == null) {
            throw new IllegalArgumentException("Trigger id must not be null");
        }
        type = type == null ? TriggerType.MANUAL : type;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        configuration = VariableMap.freeze(configuration);
    }

    /**
     * Active event trigger with the given match conditions.
     */
    public static WorkflowTrigger onEvent(String name, String event, List<WorkflowCondition> conditions) {
        return new WorkflowTrigger(UUID.randomUUID(), null, name, TriggerType.EVENT, event,
            conditions, Map.of(), true);
    }

    public boolean listensTo(String eventName) {
        return isActive && event != null && event.equals(eventName);
    }

    public WorkflowTrigger withWorkflowId(UUID workflowId) {
        return new WorkflowTrigger(id, workflowId, name, type, event, conditions, configuration, isActive);
    }

    public WorkflowTrigger withActive(boolean active) {
        return new WorkflowTrigger(id, workflowId, name, type, event, conditions, configuration, active);
    }
}
