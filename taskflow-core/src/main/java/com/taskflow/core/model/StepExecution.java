package com.taskflow.core.model;

import com.taskflow.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit record of one attempt to run one step.
 * A retry produces a new record; {@code retryCount} is the 0-based attempt index.
 */
public record StepExecution(
    UUID id,
    UUID executionId,
    UUID stepId,
    String stepName,
    StepExecutionStatus status,
    Map<String, Object> input,
    Map<String, Object> output,
    Instant startedAt,
    Instant completedAt,
    Instant failedAt,
    String errorMessage,
    String errorCode,
    int retryCount,
    UUID assignedTo,
    Instant createdAt,
    Instant updatedAt
) {
    public StepExecution {
        input = VariableMap.freeze(input);
        output = VariableMap.freeze(output);
    }

    /**
     * Create a record for an attempt that is starting now.
     */
    public static StepExecution start(UUID executionId, WorkflowStep step, Map<String, ?> input, int retryCount) {
        Instant now = Instant.now();
        return new StepExecution(
            UUID.randomUUID(), executionId, step.id(), step.name(),
            StepExecutionStatus.RUNNING, VariableMap.freeze(input), Map.of(),
            now, null, null, null, null, retryCount, null, now, now
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public StepExecution withCompleted(Map<String, ?> result) {
        Instant now = Instant.now();
        return transition(StepExecutionStatus.COMPLETED, result, now, null, null, null, assignedTo, now);
    }

    public StepExecution withSkipped() {
        Instant now = Instant.now();
        return transition(StepExecutionStatus.SKIPPED, Map.of(), now, null, null, null, assignedTo, now);
    }

    public StepExecution withFailed(String error, String code) {
        Instant now = Instant.now();
        return transition(StepExecutionStatus.FAILED, output, null, now, error, code, assignedTo, now);
    }

    public StepExecution withWaiting(UUID assignee, Map<String, ?> pendingOutput) {
        return transition(StepExecutionStatus.WAITING, pendingOutput, null, null, null, null, assignee, Instant.now());
    }

    private StepExecution transition(
            StepExecutionStatus target,
            Map<String, ?> newOutput,
            Instant completed,
            Instant failed,
            String error,
            String code,
            UUID assignee,
            Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(
                "StepExecution", status.value(), target.value());
        }
        return new StepExecution(
            id, executionId, stepId, stepName, target, input, VariableMap.freeze(newOutput),
            startedAt, completed, failed, error, code, retryCount, assignee, createdAt, now
        );
    }
}
