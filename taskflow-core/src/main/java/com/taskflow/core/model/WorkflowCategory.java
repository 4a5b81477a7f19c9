package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Business category a workflow belongs to.
 */
public enum WorkflowCategory {
    TASK_MANAGEMENT("task_management"),
    PROJECT_MANAGEMENT("project_management"),
    APPROVAL_PROCESS("approval_process"),
    NOTIFICATION("notification"),
    INTEGRATION("integration"),
    AUTOMATION("automation"),
    REPORTING("reporting"),
    QUALITY_CONTROL("quality_control");

    private final String value;

    WorkflowCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowCategory fromValue(String value) {
        for (WorkflowCategory candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown WorkflowCategory: " + value);
    }
}
