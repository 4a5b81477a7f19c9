package com.taskflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Message delivered to a single user through the notification repository.
 */
public record Notification(
    UUID id,
    UUID userId,
    String type,
    String title,
    String message,
    Map<String, Object> data,
    boolean read,
    Instant createdAt
) {
    public static final String TYPE_WORKFLOW = "workflow";
    public static final String TYPE_APPROVAL = "approval_request";

    public Notification {
        data = VariableMap.freeze(data);
    }

    public static Notification create(UUID userId, String type, String title, String message, Map<String, ?> data) {
        return new Notification(UUID.randomUUID(), userId, type, title, message,
            VariableMap.freeze(data), false, Instant.now());
    }
}
