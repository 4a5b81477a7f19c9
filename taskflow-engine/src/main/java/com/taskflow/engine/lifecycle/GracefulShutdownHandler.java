package com.taskflow.engine.lifecycle;

import com.taskflow.engine.coordinator.ExecutionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;

/**
 * Manages graceful shutdown for the engine.
 *
 * On shutdown:
 * 1. Stops accepting new executions
 * 2. Cancels the live runs, which record themselves as cancelled
 * 3. Waits for the pools to drain (with timeout)
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final ExecutionSupervisor supervisor;
    private final Duration shutdownTimeout;

    public GracefulShutdownHandler(ExecutionSupervisor supervisor, Duration shutdownTimeout) {
        this.supervisor = supervisor;
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isShuttingDown() {
        return !supervisor.isAccepting();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        log.info("Initiating graceful shutdown with {} live executions", supervisor.activeCount());
        supervisor.shutdown(shutdownTimeout);
        log.info("Graceful shutdown complete");
    }
}
