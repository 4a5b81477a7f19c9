package com.taskflow.engine.step;

import com.taskflow.core.model.StepExecution;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one step attempt, with the audit record it produced.
 *
 * {@code nextSteps} is populated for completed and skipped steps only.
 */
public record StepResult(
    Outcome outcome,
    StepExecution stepExecution,
    Map<String, Object> output,
    List<UUID> nextSteps,
    String errorMessage,
    String errorCode,
    boolean shouldRetry,
    Duration retryDelay
) {
    public enum Outcome {
        COMPLETED,
        SKIPPED,
        WAITING,
        FAILED
    }

    public static StepResult completed(StepExecution record, List<UUID> nextSteps) {
        return new StepResult(Outcome.COMPLETED, record, record.output(), nextSteps, null, null, false, Duration.ZERO);
    }

    public static StepResult skipped(StepExecution record, List<UUID> nextSteps) {
        return new StepResult(Outcome.SKIPPED, record, Map.of(), nextSteps, null, null, false, Duration.ZERO);
    }

    public static StepResult waiting(StepExecution record) {
        return new StepResult(Outcome.WAITING, record, Map.of(), List.of(), null, null, false, Duration.ZERO);
    }

    public static StepResult failed(StepExecution record, boolean shouldRetry, Duration retryDelay) {
        return new StepResult(Outcome.FAILED, record, Map.of(), List.of(),
            record.errorMessage(), record.errorCode(), shouldRetry, retryDelay);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
