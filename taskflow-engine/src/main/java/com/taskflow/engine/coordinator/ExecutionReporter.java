package com.taskflow.engine.coordinator;

import com.taskflow.core.event.DomainEvent;
import com.taskflow.core.event.EventPublisher;
import com.taskflow.core.event.WorkflowEvents;
import com.taskflow.core.model.Notification;
import com.taskflow.core.model.Workflow;
import com.taskflow.core.model.WorkflowExecution;
import com.taskflow.core.repository.NotificationRepository;
import com.taskflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Reports execution lifecycle changes: domain events, metrics and, where the workflow asks
 * for it, a notification to the user who started the execution.
 *
 * Reporting is best-effort. A failing publisher or notification store is logged and never
 * changes the outcome of a run.
 */
public class ExecutionReporter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReporter.class);

    private final EventPublisher eventPublisher;
    private final NotificationRepository notificationRepository;
    private final WorkflowMetrics metrics;

    public ExecutionReporter(
            EventPublisher eventPublisher,
            NotificationRepository notificationRepository,
            WorkflowMetrics metrics) {
        this.eventPublisher = eventPublisher;
        this.notificationRepository = notificationRepository;
        this.metrics = metrics;
    }

    public void started(Workflow workflow, WorkflowExecution execution) {
        metrics.executionStarted(workflow.name());
        publish(WorkflowEvents.started(workflow.name(), execution));
    }

    public void paused(Workflow workflow, WorkflowExecution execution) {
        metrics.executionPaused(workflow.name());
        publish(WorkflowEvents.paused(execution));
    }

    public void resumed(Workflow workflow, WorkflowExecution execution, UUID decidedBy) {
        metrics.executionResumed(workflow.name());
        publish(WorkflowEvents.resumed(execution, decidedBy));
    }

    public void completed(Workflow workflow, WorkflowExecution execution) {
        metrics.executionCompleted(workflow.name(), elapsed(execution.startedAt(), execution.completedAt()));
        publish(WorkflowEvents.completed(execution));
        if (workflow.configuration().notifyOnCompletion()) {
            notifyRequester(execution, "Workflow completed: " + workflow.name(),
                "Execution " + execution.id() + " completed");
        }
    }

    public void failed(Workflow workflow, WorkflowExecution execution) {
        metrics.executionFailed(workflow.name(), elapsed(execution.startedAt(), execution.failedAt()));
        publish(WorkflowEvents.failed(execution));
        if (workflow.configuration().notifyOnFailure()) {
            notifyRequester(execution, "Workflow failed: " + workflow.name(),
                "Execution " + execution.id() + " failed: " + execution.errorMessage());
        }
    }

    /**
     * @param wasRunning whether the execution was running, rather than paused or pending, when cancelled
     */
    public void cancelled(Workflow workflow, WorkflowExecution execution, boolean wasRunning) {
        metrics.executionCancelled(workflow.name(), wasRunning);
        publish(WorkflowEvents.cancelled(execution));
    }

    private void publish(DomainEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for {}: {}", event.eventType(), event.aggregateId(), e.getMessage(), e);
        }
    }

    private void notifyRequester(WorkflowExecution execution, String title, String message) {
        if (execution.executedBy() == null) {
            return;
        }
        try {
            notificationRepository.create(Notification.create(
                execution.executedBy(),
                Notification.TYPE_WORKFLOW,
                title,
                message,
                Map.of(
                    "execution_id", execution.id().toString(),
                    "status", execution.status().value()
                )
            ));
        } catch (RuntimeException e) {
            log.error("Failed to notify {} about execution {}: {}",
                execution.executedBy(), execution.id(), e.getMessage(), e);
        }
    }

    private static Duration elapsed(Instant from, Instant to) {
        if (from == null || to == null) {
            return null;
        }
        return Duration.between(from, to);
    }
}
