package com.taskflow.core.event;

import com.taskflow.core.model.WorkflowExecution;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Factories for the execution lifecycle events.
 */
public final class WorkflowEvents {

    public static final String EXECUTION_STARTED = "workflow.execution.started";
    public static final String EXECUTION_COMPLETED = "workflow.execution.completed";
    public static final String EXECUTION_FAILED = "workflow.execution.failed";
    public static final String EXECUTION_CANCELLED = "workflow.execution.cancelled";
    public static final String EXECUTION_PAUSED = "workflow.execution.paused";
    public static final String EXECUTION_RESUMED = "workflow.execution.resumed";

    private WorkflowEvents() {
    }

    public static DomainEvent started(String workflowName, WorkflowExecution execution) {
        Map<String, Object> data = base(execution);
        data.put("workflow_name", workflowName);
        data.put("started_at", execution.startedAt());
        data.put("trigger_id", execution.triggerId());
        return DomainEvent.create(EXECUTION_STARTED, execution.workflowId(), data, execution.executedBy());
    }

    public static DomainEvent completed(WorkflowExecution execution) {
        Map<String, Object> data = base(execution);
        data.put("started_at", execution.startedAt());
        data.put("completed_at", execution.completedAt());
        data.put("duration_ms", durationMillis(execution.startedAt(), execution.completedAt()));
        return DomainEvent.create(EXECUTION_COMPLETED, execution.workflowId(), data, execution.executedBy());
    }

    public static DomainEvent failed(WorkflowExecution execution) {
        Map<String, Object> data = base(execution);
        data.put("failed_at", execution.failedAt());
        data.put("error_message", execution.errorMessage());
        data.put("retry_count", execution.retryCount());
        data.put("duration_ms", durationMillis(execution.startedAt(), execution.failedAt()));
        return DomainEvent.create(EXECUTION_FAILED, execution.workflowId(), data, execution.executedBy());
    }

    public static DomainEvent cancelled(WorkflowExecution execution) {
        Map<String, Object> data = base(execution);
        data.put("cancelled_at", execution.cancelledAt());
        data.put("reason", execution.errorMessage());
        return DomainEvent.create(EXECUTION_CANCELLED, execution.workflowId(), data, execution.executedBy());
    }

    public static DomainEvent paused(WorkflowExecution execution) {
        Map<String, Object> data = base(execution);
        data.put("awaiting_steps", execution.awaitingStepIds());
        return DomainEvent.create(EXECUTION_PAUSED, execution.workflowId(), data, execution.executedBy());
    }

    public static DomainEvent resumed(WorkflowExecution execution, UUID decidedBy) {
        Map<String, Object> data = base(execution);
        data.put("pending_steps", execution.pendingStepIds());
        return DomainEvent.create(EXECUTION_RESUMED, execution.workflowId(), data, decidedBy);
    }

    private static Map<String, Object> base(WorkflowExecution execution) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("execution_id", execution.id());
        data.put("workflow_id", execution.workflowId());
        data.put("status", execution.status().value());
        return data;
    }

    private static Long durationMillis(Instant from, Instant to) {
        if (from == null || to == null) {
            return null;
        }
        return Duration.between(from, to).toMillis();
    }
}
