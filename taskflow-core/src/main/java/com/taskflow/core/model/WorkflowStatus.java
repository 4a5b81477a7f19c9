package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Publication status of a workflow definition.
 */
public enum WorkflowStatus {
    /**
     * Being edited, cannot be executed.
     */
    DRAFT("draft"),

    /**
     * Published and executable.
     */
    ACTIVE("active"),

    /**
     * Temporarily switched off.
     */
    INACTIVE("inactive"),

    ARCHIVED("archived"),

    /**
     * Superseded by a newer definition; kept for running executions.
     */
    DEPRECATED("deprecated");

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowStatus fromValue(String value) {
        for (WorkflowStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown WorkflowStatus: " + value);
    }
}
