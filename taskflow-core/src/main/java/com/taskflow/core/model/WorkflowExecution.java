package com.taskflow.core.model;

import com.taskflow.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single run of a workflow.
 * Primary source of truth for execution state.
 *
 * Invariants:
 * - status transitions follow {@link ExecutionStatus#canTransitionTo}
 * - context is the trigger data and never changes after start
 * - sequenceNumber is monotonically increasing; every copy increments it
 * - pendingStepIds is the frontier to resume from while paused
 */
public record WorkflowExecution(
    // Identity
    UUID id,
    UUID workflowId,
    UUID triggerId,

    // State
    ExecutionStatus status,
    UUID currentStepId,
    List<UUID> pendingStepIds,
    List<UUID> awaitingStepIds,

    // Data
    Map<String, Object> context,
    Map<String, Object> variables,
    UUID executedBy,

    // Error tracking
    String errorMessage,
    int retryCount,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant failedAt,
    Instant cancelledAt,
    Instant deadline,
    Instant updatedAt,

    // Versioning (optimistic locking)
    long sequenceNumber
) {
    public WorkflowExecution {
        pendingStepIds = pendingStepIds == null ? List.of() : List.copyOf(pendingStepIds);
        awaitingStepIds = awaitingStepIds == null ? List.of() : List.copyOf(awaitingStepIds);
        context = VariableMap.freeze(context);
        variables = VariableMap.freeze(variables);
    }

    /**
     * Create a new execution in PENDING state.
     */
    public static WorkflowExecution create(
            UUID workflowId,
            UUID triggerId,
            UUID executedBy,
            Map<String, ?> context,
            Map<String, ?> variables) {
        Instant now = Instant.now();
        return new WorkflowExecution(
            UUID.randomUUID(),
            workflowId,
            triggerId,
            ExecutionStatus.PENDING,
            null,
            List.of(),
            List.of(),
            VariableMap.freeze(context),
            VariableMap.freeze(variables),
            executedBy,
            null,
            0,
            now,
            null,
            null,
            null,
            null,
            null,
            now,
            0L
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isDeadlineExceeded(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }

    public VariableMap variableMap() {
        return VariableMap.of(variables);
    }

    // ========== Transitions ==========

    /**
     * Create a copy in the target state, stamping the matching timestamp.
     *
     * @throws InvalidStateTransitionException if the state machine forbids the move
     */
    public WorkflowExecution withStatus(ExecutionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
        Instant now = Instant.now();
        Builder builder = toBuilder().status(target);
        switch (target) {
            case RUNNING -> {
                if (startedAt == null) {
                    builder.startedAt(now);
                }
            }
            case COMPLETED -> builder.completedAt(now);
            case FAILED -> builder.failedAt(now);
            case CANCELLED -> builder.cancelledAt(now);
            case PENDING, PAUSED -> {
            }
        }
        return builder.touch().build();
    }

    /**
     * Move to RUNNING and fix the deadline, if any.
     */
    public WorkflowExecution start(Instant deadline) {
        WorkflowExecution running = withStatus(ExecutionStatus.RUNNING);
        return running.toBuilder().deadline(deadline).build();
    }

    public WorkflowExecution complete() {
        return withStatus(ExecutionStatus.COMPLETED).toBuilder()
            .pendingStepIds(List.of())
            .awaitingStepIds(List.of())
            .build();
    }

    public WorkflowExecution fail(String error) {
        return withStatus(ExecutionStatus.FAILED).toBuilder()
            .errorMessage(error)
            .build();
    }

    public WorkflowExecution cancel(String reason) {
        return withStatus(ExecutionStatus.CANCELLED).toBuilder()
            .errorMessage(reason)
            .build();
    }

    /**
     * Suspend on waiting steps, remembering where to continue.
     */
    public WorkflowExecution pause(List<UUID> pending, List<UUID> awaiting) {
        return withStatus(ExecutionStatus.PAUSED).toBuilder()
            .pendingStepIds(pending)
            .awaitingStepIds(awaiting)
            .build();
    }

    public WorkflowExecution resume() {
        return withStatus(ExecutionStatus.RUNNING).toBuilder()
            .awaitingStepIds(List.of())
            .build();
    }

    /**
     * Record traversal progress after a level.
     */
    public WorkflowExecution withProgress(Map<String, ?> newVariables, UUID stepId, List<UUID> pending) {
        return toBuilder()
            .variables(newVariables)
            .currentStepId(stepId)
            .pendingStepIds(pending)
            .touch()
            .build();
    }

    /**
     * Record the outcome of an approval decision while paused.
     */
    public WorkflowExecution withApprovalRecorded(Map<String, ?> newVariables, List<UUID> pending, List<UUID> awaiting) {
        return toBuilder()
            .variables(newVariables)
            .pendingStepIds(pending)
            .awaitingStepIds(awaiting)
            .touch()
            .build();
    }

    public WorkflowExecution withRetryIncremented() {
        return toBuilder()
            .retryCount(retryCount + 1)
            .touch()
            .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID id;
        private UUID workflowId;
        private UUID triggerId;
        private ExecutionStatus status;
        private UUID currentStepId;
        private List<UUID> pendingStepIds;
        private List<UUID> awaitingStepIds;
        private Map<String, Object> context;
        private Map<String, Object> variables;
        private UUID executedBy;
        private String errorMessage;
        private int retryCount;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant failedAt;
        private Instant cancelledAt;
        private Instant deadline;
        private Instant updatedAt;
        private long sequenceNumber;

        public Builder(WorkflowExecution execution) {
            this.id = execution.id();
            this.workflowId = execution.workflowId();
            this.triggerId = execution.triggerId();
            this.status = execution.status();
            this.currentStepId = execution.currentStepId();
            this.pendingStepIds = execution.pendingStepIds();
            this.awaitingStepIds = execution.awaitingStepIds();
            this.context = execution.context();
            this.variables = execution.variables();
            this.executedBy = execution.executedBy();
            this.errorMessage = execution.errorMessage();
            this.retryCount = execution.retryCount();
            this.createdAt = execution.createdAt();
            this.startedAt = execution.startedAt();
            this.completedAt = execution.completedAt();
            this.failedAt = execution.failedAt();
            this.cancelledAt = execution.cancelledAt();
            this.deadline = execution.deadline();
            this.updatedAt = execution.updatedAt();
            this.sequenceNumber = execution.sequenceNumber();
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStepId(UUID currentStepId) {
            this.currentStepId = currentStepId;
            return this;
        }

        public Builder pendingStepIds(List<UUID> pendingStepIds) {
            this.pendingStepIds = pendingStepIds;
            return this;
        }

        public Builder awaitingStepIds(List<UUID> awaitingStepIds) {
            this.awaitingStepIds = awaitingStepIds;
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            this.variables = VariableMap.freeze(variables);
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder cancelledAt(Instant cancelledAt) {
            this.cancelledAt = cancelledAt;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        /**
         * Bump the sequence number and update timestamp.
         */
        public Builder touch() {
            this.sequenceNumber++;
            this.updatedAt = Instant.now();
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(
                id, workflowId, triggerId, status, currentStepId,
                pendingStepIds, awaitingStepIds, context, variables, executedBy,
                errorMessage, retryCount, createdAt, startedAt, completedAt,
                failedAt, cancelledAt, deadline, updatedAt, sequenceNumber
            );
        }
    }
}
