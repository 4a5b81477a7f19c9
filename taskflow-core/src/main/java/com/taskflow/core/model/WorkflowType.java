package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of a workflow definition. Informational: traversal is driven by step successors.
 */
public enum WorkflowType {
    SEQUENTIAL("sequential"),
    PARALLEL("parallel"),
    CONDITIONAL("conditional"),
    LOOP("loop"),
    EVENT("event"),
    APPROVAL("approval"),
    AUTOMATION("automation");

    private final String value;

    WorkflowType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowType fromValue(String value) {
        for (WorkflowType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown WorkflowType: " + value);
    }
}
