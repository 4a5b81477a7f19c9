package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a workflow trigger fires.
 */
public enum TriggerType {
    MANUAL("manual"),
    SCHEDULED("scheduled"),
    EVENT("event"),
    WEBHOOK("webhook"),
    EMAIL("email"),
    API("api");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TriggerType fromValue(String value) {
        for (TriggerType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TriggerType: " + value);
    }
}
