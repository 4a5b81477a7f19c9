package com.taskflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Task handed to the external task repository by task steps and task actions.
 */
public record Task(
    UUID id,
    String title,
    String description,
    String type,
    String priority,
    String status,
    UUID projectId,
    UUID assigneeId,
    UUID createdBy,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String STATUS_TODO = "todo";

    public Task {
        metadata = VariableMap.freeze(metadata);
    }

    public static Task create(String title, String description, String type, String priority,
                              UUID projectId, UUID assigneeId, UUID createdBy, Map<String, ?> metadata) {
        Instant now = Instant.now();
        return new Task(UUID.randomUUID(), title, description,
            type != null ? type : "task", priority != null ? priority : "medium", STATUS_TODO,
            projectId, assigneeId, createdBy, VariableMap.freeze(metadata), now, now);
    }

    public Task withAssignee(UUID assignee) {
        return new Task(id, title, description, type, priority, status, projectId,
            assignee, createdBy, metadata, createdAt, Instant.now());
    }

    /**
     * Copy with every non-null argument replacing the current value.
     */
    public Task patch(String newTitle, String newDescription, String newStatus, String newPriority) {
        return new Task(id,
            newTitle != null ? newTitle : title,
            newDescription != null ? newDescription : description,
            type,
            newPriority != null ? newPriority : priority,
            newStatus != null ? newStatus : status,
            projectId, assigneeId, createdBy, metadata, createdAt, Instant.now());
    }
}
