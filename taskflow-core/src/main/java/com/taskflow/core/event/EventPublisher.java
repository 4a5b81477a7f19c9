package com.taskflow.core.event;

/**
 * Outbound port for domain events (an event bus in production).
 */
public interface EventPublisher {

    /**
     * Publish an event.
     *
     * @param event The event
     * @throws RuntimeException if delivery fails; callers treat publication as best-effort
     */
    void publish(DomainEvent event);
}
