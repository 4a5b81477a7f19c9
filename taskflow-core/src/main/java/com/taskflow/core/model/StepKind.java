package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of steps that can appear in a workflow graph.
 * The step runner switches over this enum exhaustively, so adding a kind
 * fails compilation until the runner handles it.
 */
public enum StepKind {
    /**
     * Creates a task in the task repository.
     */
    TASK("task"),

    /**
     * Notifies approvers and waits for a decision.
     */
    APPROVAL("approval"),

    /**
     * Reserved, not executable.
     */
    REVIEW("review"),

    /**
     * Sends a message to a list of recipients.
     */
    NOTIFICATION("notification"),

    /**
     * Routing node: only its gating conditions matter.
     */
    CONDITION("condition"),

    /**
     * Runs its attached actions through the action dispatcher.
     */
    ACTION("action"),

    /**
     * Suspends the execution for a configured duration.
     */
    WAIT("wait"),

    /**
     * Reserved, not executable.
     */
    LOOP("loop"),

    /**
     * Reserved, not executable.
     */
    SUB_WORKFLOW("sub_workflow");

    private final String value;

    StepKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Check if the engine knows how to run this kind.
     */
    public boolean isExecutable() {
        return switch (this) {
            case TASK, APPROVAL, NOTIFICATION, CONDITION, ACTION, WAIT -> true;
            case REVIEW, LOOP, SUB_WORKFLOW -> false;
        };
    }

    @JsonCreator
    public static StepKind fromValue(String value) {
        for (StepKind candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown StepKind: " + value);
    }
}
