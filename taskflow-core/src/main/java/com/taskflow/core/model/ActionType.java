package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed set of side-effecting operations an action step can perform.
 */
public enum ActionType {
    CREATE_TASK("create_task"),
    UPDATE_TASK("update_task"),
    ASSIGN_TASK("assign_task"),
    SEND_EMAIL("send_email"),
    SEND_NOTIFICATION("send_notification"),
    WEBHOOK("webhook"),
    API("api"),
    SCRIPT("script"),
    APPROVAL("approval"),
    DELAY("delay");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ActionType fromValue(String value) {
        for (ActionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ActionType: " + value);
    }
}
