package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states for a workflow execution.
 * Transitions follow a strict state machine; terminal states never change.
 */
public enum ExecutionStatus {
    /**
     * Created, not yet running.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING("pending"),

    /**
     * Frontier is being traversed.
     * Transitions: -> COMPLETED, FAILED, CANCELLED, PAUSED
     */
    RUNNING("running"),

    /**
     * Suspended on one or more waiting approval steps.
     * Transitions: -> RUNNING, FAILED, CANCELLED
     */
    PAUSED("paused"),

    /**
     * Frontier exhausted without failure. Terminal state.
     */
    COMPLETED("completed"),

    /**
     * Aborted by a step failure, a rejected approval or the time budget. Terminal state.
     */
    FAILED("failed"),

    /**
     * Cancelled on request. Terminal state.
     */
    CANCELLED("cancelled");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED
                || target == PAUSED;
            case PAUSED -> target == RUNNING || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ExecutionStatus: " + value);
    }
}
