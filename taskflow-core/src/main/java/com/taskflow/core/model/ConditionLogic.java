package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Combination logic for a list of conditions attached to one gate.
 */
public enum ConditionLogic {
    AND("and"),
    OR("or"),
    NOT("not");

    private final String value;

    ConditionLogic(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConditionLogic fromValue(String value) {
        for (ConditionLogic candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConditionLogic: " + value);
    }
}
