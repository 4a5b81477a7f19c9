package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states for one attempt to run one step.
 */
public enum StepExecutionStatus {
    PENDING("pending"),

    /**
     * Transitions: -> COMPLETED, FAILED, SKIPPED, WAITING
     */
    RUNNING("running"),

    COMPLETED("completed"),

    FAILED("failed"),

    /**
     * Gating conditions evaluated false. Successors are still followed.
     */
    SKIPPED("skipped"),

    /**
     * Suspended until an external decision arrives.
     * Transitions: -> COMPLETED, FAILED
     */
    WAITING("waiting");

    private final String value;

    StepExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(StepExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == COMPLETED || target == FAILED || target == SKIPPED
                || target == WAITING;
            case WAITING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED, SKIPPED -> false;
        };
    }

    @JsonCreator
    public static StepExecutionStatus fromValue(String value) {
        for (StepExecutionStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown StepExecutionStatus: " + value);
    }
}
