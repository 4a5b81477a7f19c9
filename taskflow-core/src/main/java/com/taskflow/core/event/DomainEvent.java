package com.taskflow.core.event;

import com.taskflow.core.model.VariableMap;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of something that happened to an aggregate.
 * For execution events the aggregate is the workflow.
 */
public record DomainEvent(
    UUID eventId,
    String eventType,
    UUID aggregateId,
    Map<String, Object> eventData,
    Instant timestamp,
    int version,
    UUID userId
) {
    public DomainEvent {
        eventData = VariableMap.freeze(eventData);
    }

    public static DomainEvent create(String eventType, UUID aggregateId, Map<String, Object> eventData, UUID userId) {
        return new DomainEvent(UUID.randomUUID(), eventType, aggregateId, eventData, Instant.now(), 1, userId);
    }
}
