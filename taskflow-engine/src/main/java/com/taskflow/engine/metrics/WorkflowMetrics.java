package com.taskflow.engine.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow engine.
 *
 * Metrics exposed:
 * - Executions started, completed, failed, cancelled, paused and resumed
 * - Live executions by state
 * - Step outcomes and retries
 * - Execution duration
 *
 * Until bound to a registry, meters go to {@link Metrics#globalRegistry}.
 */
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String EXECUTION_COUNT = "taskflow.executions";
    public static final String EXECUTION_STARTED = "taskflow.executions.started";
    public static final String EXECUTION_COMPLETED = "taskflow.executions.completed";
    public static final String EXECUTION_FAILED = "taskflow.executions.failed";
    public static final String EXECUTION_CANCELLED = "taskflow.executions.cancelled";
    public static final String EXECUTION_PAUSED = "taskflow.executions.paused";
    public static final String EXECUTION_RESUMED = "taskflow.executions.resumed";
    public static final String EXECUTION_DURATION = "taskflow.execution.duration";

    public static final String STEP_OUTCOMES = "taskflow.steps";
    public static final String STEP_RETRIES = "taskflow.step.retries";

    private static final String[] LIVE_STATES = {"RUNNING", "PAUSED"};

    private volatile MeterRegistry registry = Metrics.globalRegistry;

    private final ConcurrentHashMap<String, AtomicInteger> executionStateGauges = new ConcurrentHashMap<>();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (String state : LIVE_STATES) {
            AtomicInteger gauge = executionStateGauges.computeIfAbsent(state, s -> new AtomicInteger(0));
            Gauge.builder(EXECUTION_COUNT, gauge, AtomicInteger::get)
                .tag("state", state)
                .description("Number of executions in " + state + " state")
                .register(registry);
        }
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflowName) {
        Counter.builder(EXECUTION_STARTED)
            .tag("workflow", workflowName)
            .description("Total executions started")
            .register(registry)
            .increment();

        incrementState("RUNNING");
    }

    public void executionCompleted(String workflowName, Duration duration) {
        Counter.builder(EXECUTION_COMPLETED)
            .tag("workflow", workflowName)
            .description("Total executions completed successfully")
            .register(registry)
            .increment();

        recordDuration(workflowName, "success", duration);
        decrementState("RUNNING");
    }

    public void executionFailed(String workflowName, Duration duration) {
        Counter.builder(EXECUTION_FAILED)
            .tag("workflow", workflowName)
            .description("Total executions failed")
            .register(registry)
            .increment();

        recordDuration(workflowName, "failure", duration);
        decrementState("RUNNING");
    }

    public void executionCancelled(String workflowName, boolean wasRunning) {
        Counter.builder(EXECUTION_CANCELLED)
            .tag("workflow", workflowName)
            .description("Total executions cancelled")
            .register(registry)
            .increment();

        decrementState(wasRunning ? "RUNNING" : "PAUSED");
    }

    public void executionPaused(String workflowName) {
        Counter.builder(EXECUTION_PAUSED)
            .tag("workflow", workflowName)
            .description("Total executions paused on a pending decision")
            .register(registry)
            .increment();

        incrementState("PAUSED");
        decrementState("RUNNING");
    }

    public void executionResumed(String workflowName) {
        Counter.builder(EXECUTION_RESUMED)
            .tag("workflow", workflowName)
            .description("Total executions resumed")
            .register(registry)
            .increment();

        incrementState("RUNNING");
        decrementState("PAUSED");
    }

    // ========== Step Metrics ==========

    public void stepFinished(String workflowName, String stepKind, String outcome) {
        Counter.builder(STEP_OUTCOMES)
            .tag("workflow", workflowName)
            .tag("kind", stepKind)
            .tag("outcome", outcome)
            .description("Step attempts by outcome")
            .register(registry)
            .increment();
    }

    public void stepRetried(String workflowName, String stepKind) {
        Counter.builder(STEP_RETRIES)
            .tag("workflow", workflowName)
            .tag("kind", stepKind)
            .description("Total step retry attempts")
            .register(registry)
            .increment();
    }

    /**
     * Current value of the live state gauge, for health reporting.
     */
    public int liveExecutions(String state) {
        AtomicInteger gauge = executionStateGauges.get(state);
        return gauge != null ? gauge.get() : 0;
    }

    // ========== Helper Methods ==========

    private void recordDuration(String workflowName, String outcome, Duration duration) {
        if (duration == null) {
            return;
        }
        Timer.builder(EXECUTION_DURATION)
            .tag("workflow", workflowName)
            .tag("outcome", outcome)
            .description("Execution duration from start to terminal state")
            .register(registry)
            .record(duration);
    }

    private void incrementState(String state) {
        executionStateGauges.computeIfAbsent(state, s -> new AtomicInteger(0)).incrementAndGet();
    }

    private void decrementState(String state) {
        executionStateGauges.computeIfAbsent(state, s -> new AtomicInteger(0))
            .updateAndGet(v -> Math.max(0, v - 1));
    }
}
