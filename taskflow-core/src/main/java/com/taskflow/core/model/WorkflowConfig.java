package com.taskflow.core.model;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Execution settings of a workflow.
 *
 * {@code retryAttempts} counts retries after the first attempt; {@code maxExecutionTime}
 * is optional and bounds the wall-clock time of one execution.
 */
public record WorkflowConfig(
    Duration maxExecutionTime,
    int retryAttempts,
    Duration retryDelay,
    boolean notifyOnFailure,
    boolean notifyOnCompletion,
    boolean allowParallel,
    WorkflowPriority priority,
    Map<String, Object> settings
) {
    public WorkflowConfig {
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must be >= 0");
        }
        retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
        priority = priority == null ? WorkflowPriority.NORMAL : priority;
        settings = VariableMap.freeze(settings);
    }

    /**
     * No time budget, no retries, sequential.
     */
    public static WorkflowConfig defaults() {
        return builder().build();
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.fixed(retryAttempts + 1, retryDelay);
    }

    public Optional<Duration> executionTimeBudget() {
        if (maxExecutionTime == null || maxExecutionTime.isZero() || maxExecutionTime.isNegative()) {
            return Optional.empty();
        }
        return Optional.of(maxExecutionTime);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration maxExecutionTime;
        private int retryAttempts;
        private Duration retryDelay = Duration.ZERO;
        private boolean notifyOnFailure;
        private boolean notifyOnCompletion;
        private boolean allowParallel;
        private WorkflowPriority priority = WorkflowPriority.NORMAL;
        private Map<String, Object> settings = Map.of();

        public Builder maxExecutionTime(Duration maxExecutionTime) {
            this.maxExecutionTime = maxExecutionTime;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder notifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
            return this;
        }

        public Builder notifyOnCompletion(boolean notifyOnCompletion) {
            this.notifyOnCompletion = notifyOnCompletion;
            return this;
        }

        public Builder allowParallel(boolean allowParallel) {
            this.allowParallel = allowParallel;
            return this;
        }

        public Builder priority(WorkflowPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = settings;
            return this;
        }

        public WorkflowConfig build() {
            return new WorkflowConfig(
                maxExecutionTime, retryAttempts, retryDelay, notifyOnFailure,
                notifyOnCompletion, allowParallel, priority, settings
            );
        }
    }
}
