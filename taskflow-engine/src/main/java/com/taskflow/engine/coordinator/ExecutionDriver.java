package com.taskflow.engine.coordinator;

import com.taskflow.core.exception.ExecutionCancelledException;
import com.taskflow.core.exception.OptimisticLockException;
import com.taskflow.core.model.Durations;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.Workflow;
import com.taskflow.core.model.WorkflowExecution;
import com.taskflow.core.model.WorkflowStep;
import com.taskflow.core.repository.WorkflowExecutionRepository;
import com.taskflow.engine.logging.LoggingContext;
import com.taskflow.engine.metrics.WorkflowMetrics;
import com.taskflow.engine.step.StepContext;
import com.taskflow.engine.step.StepResult;
import com.taskflow.engine.step.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives one run of an execution through the step graph, level by level.
 *
 * A level is the current frontier of steps. Each step's outcome is merged into the execution
 * variables in frontier order and its successors form the next frontier, deduplicated by id.
 * The execution is persisted after every level. A run ends when the frontier is exhausted
 * (completed), a step fails without retry (failed), the token is cancelled (cancelled) or a
 * step waits on a decision (paused).
 *
 * The run is the only writer of a running execution.
 */
public class ExecutionDriver {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDriver.class);

    private final WorkflowExecutionRepository executionRepository;
    private final StepRunner stepRunner;
    private final ExecutionReporter reporter;
    private final WorkflowMetrics metrics;
    private final ExecutorService stepPool;

    public ExecutionDriver(
            WorkflowExecutionRepository executionRepository,
            StepRunner stepRunner,
            ExecutionReporter reporter,
            WorkflowMetrics metrics,
            ExecutorService stepPool) {
        this.executionRepository = executionRepository;
        this.stepRunner = stepRunner;
        this.reporter = reporter;
        this.metrics = metrics;
        this.stepPool = stepPool;
    }

    /**
     * Run a running execution from the given frontier until it ends or pauses.
     * Never throws: every outcome is recorded on the execution.
     *
     * @param workflow The workflow definition
     * @param execution The execution, already persisted in running state
     * @param frontier Ids of the steps to run first
     * @param token Cancellation signal for this run
     */
    public void run(Workflow workflow, WorkflowExecution execution, List<UUID> frontier, CancellationToken token) {
        new Run(workflow, execution, token).execute(frontier);
    }

    /**
     * State of one run. Owned by the run thread; step threads of a parallel batch only read
     * immutable snapshots and record retries.
     */
    private final class Run {

        private final Workflow workflow;
        private final CancellationToken token;
        private final Map<String, Object> variables;
        private WorkflowExecution execution;

        Run(Workflow workflow, WorkflowExecution execution, CancellationToken token) {
            this.workflow = workflow;
            this.execution = execution;
            this.token = token;
            this.variables = new LinkedHashMap<>(execution.variables());
        }

        void execute(List<UUID> frontierIds) {
            try (var ctx = LoggingContext.forExecution(workflow.id(), execution.id())) {
                try {
                    List<WorkflowStep> frontier = resolveInitial(frontierIds);
                    while (!frontier.isEmpty()) {
                        checkInterrupts();
                        Level level = runLevel(frontier);
                        List<UUID> nextIds = new ArrayList<>(level.next.keySet());
                        UUID current = level.lastStepId != null ? level.lastStepId : execution.currentStepId();

                        if (!level.awaiting.isEmpty()) {
                            pause(current, nextIds, level.awaiting);
                            return;
                        }
                        updateExecution(execution.withProgress(variables, current, nextIds));
                        frontier = new ArrayList<>(level.next.values());
                    }
                    complete();
                } catch (ExecutionCancelledException e) {
                    cancel();
                } catch (Abort e) {
                    fail(e.getMessage());
                } catch (OptimisticLockException e) {
                    // Another writer, e.g. a direct cancel, took the execution over
                    log.warn("Execution {} changed outside this run, stopping: {}", execution.id(), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Run of execution {} aborted by an unexpected error", execution.id(), e);
                    fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                }
            }
        }

        // ========== Levels ==========

        private List<WorkflowStep> resolveInitial(List<UUID> ids) {
            List<WorkflowStep> steps = new ArrayList<>();
            for (UUID id : new LinkedHashSet<>(ids)) {
                steps.add(workflow.stepById(id)
                    .orElseThrow(() -> new Abort("Execution references unknown step " + id)));
            }
            return steps;
        }

        private Level runLevel(List<WorkflowStep> frontier) {
            Level level = new Level();
            boolean parallelAllowed = workflow.configuration().allowParallel();
            int i = 0;
            while (i < frontier.size()) {
                int end = i + 1;
                if (parallelAllowed && frontier.get(i).isParallel()) {
                    while (end < frontier.size() && frontier.get(end).isParallel()) {
                        end++;
                    }
                }
                List<WorkflowStep> group = frontier.subList(i, end);
                if (group.size() == 1) {
                    WorkflowStep step = group.get(0);
                    apply(step, runWithRetry(step, VariableMap.of(variables)), level);
                } else {
                    List<StepResult> results = runBatch(group);
                    for (int k = 0; k < group.size(); k++) {
                        apply(group.get(k), results.get(k), level);
                    }
                }
                i = end;
            }
            return level;
        }

        private List<StepResult> runBatch(List<WorkflowStep> batch) {
            log.info("Running {} steps in parallel", batch.size());
            VariableMap snapshot = VariableMap.of(variables);
            List<Future<StepResult>> futures = new ArrayList<>();
            for (WorkflowStep step : batch) {
                futures.add(stepPool.submit(() -> runWithRetry(step, snapshot)));
            }

            List<StepResult> results = new ArrayList<>();
            RuntimeException error = null;
            for (Future<StepResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    results.add(null);
                    if (error == null) {
                        error = unwrap(e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel("interrupted");
                    futures.forEach(f -> f.cancel(true));
                    throw new ExecutionCancelledException(execution.id());
                }
            }
            if (error != null) {
                throw error;
            }
            return results;
        }

        private StepResult runWithRetry(WorkflowStep step, VariableMap snapshot) {
            int attempt = 1;
            while (true) {
                checkInterrupts();
                StepResult result = stepRunner.run(new StepContext(
                    execution.id(), workflow, step, execution.executedBy(), snapshot, attempt, token));
                metrics.stepFinished(workflow.name(), step.kind().value(), result.outcome().name().toLowerCase());

                if (!result.isFailed() || !result.shouldRetry()) {
                    return result;
                }
                checkDeadline();
                token.sleep(result.retryDelay());
                recordRetry();
                metrics.stepRetried(workflow.name(), step.kind().value());
                attempt++;
            }
        }

        private void apply(WorkflowStep step, StepResult result, Level level) {
            switch (result.outcome()) {
                case COMPLETED, SKIPPED -> {
                    variables.putAll(result.output());
                    level.lastStepId = step.id();
                    for (UUID nextId : result.nextSteps()) {
                        WorkflowStep next = workflow.stepById(nextId)
                            .orElseThrow(() -> new Abort(
                                "Step '" + step.name() + "' references unknown step " + nextId));
                        level.next.putIfAbsent(nextId, next);
                    }
                }
                case WAITING -> {
                    level.lastStepId = step.id();
                    level.awaiting.add(step.id());
                }
                case FAILED -> throw new Abort("Step '" + step.name() + "' failed: " + result.errorMessage());
            }
        }

        private synchronized void recordRetry() {
            execution = execution.withRetryIncremented();
        }

        // ========== Interrupts ==========

        private void checkInterrupts() {
            token.throwIfCancelled();
            checkDeadline();
        }

        private void checkDeadline() {
            if (execution.isDeadlineExceeded(Instant.now())) {
                String budget = workflow.configuration().executionTimeBudget()
                    .map(Durations::format)
                    .orElse("?");
                throw new Abort("Execution exceeded max execution time of " + budget);
            }
        }

        // ========== Endings ==========

        private void pause(UUID current, List<UUID> pending, List<UUID> awaiting) {
            updateExecution(execution.withProgress(variables, current, pending).pause(pending, awaiting));
            log.info("Execution paused, awaiting steps {}", awaiting);
            reporter.paused(workflow, execution);

            // A cancel that raced with the pause signalled this run's token instead of writing directly
            if (token.isCancelled()) {
                try {
                    updateExecution(execution.cancel(cancelReason()));
                    log.info("Execution cancelled while pausing: {}", execution.errorMessage());
                    reporter.cancelled(workflow, execution, false);
                } catch (OptimisticLockException e) {
                    log.warn("Execution changed after pausing, cancellation not applied: {}", e.getMessage());
                }
            }
        }

        private void complete() {
            updateExecution(execution.withProgress(variables, execution.currentStepId(), List.of()).complete());
            log.info("Execution completed");
            reporter.completed(workflow, execution);
        }

        private void cancel() {
            execution = execution.cancel(cancelReason());
            try {
                executionRepository.update(execution);
            } catch (RuntimeException e) {
                log.error("Could not record cancellation of execution {}", execution.id(), e);
            }
            log.info("Execution cancelled: {}", execution.errorMessage());
            reporter.cancelled(workflow, execution, true);
        }

        private void fail(String message) {
            if (execution.isTerminal()) {
                log.error("Execution already {} when failing with: {}", execution.status().value(), message);
                return;
            }
            execution = execution.withProgress(variables, execution.currentStepId(), execution.pendingStepIds())
                .fail(message);
            try {
                executionRepository.update(execution);
            } catch (RuntimeException e) {
                log.error("Could not record failure of execution {}", execution.id(), e);
            }
            log.error("Execution failed: {}", message);
            reporter.failed(workflow, execution);
        }

        private void updateExecution(WorkflowExecution updated) {
            executionRepository.update(updated);
            execution = updated;
        }

        private String cancelReason() {
            return token.reason() != null ? token.reason() : "cancelled";
        }
    }

    /**
     * Result of one level: successors in first-seen order and the steps left waiting.
     */
    private static final class Level {
        private final Map<UUID, WorkflowStep> next = new LinkedHashMap<>();
        private final List<UUID> awaiting = new ArrayList<>();
        private UUID lastStepId;
    }

    /**
     * Ends a run as failed with the given message.
     */
    private static final class Abort extends RuntimeException {
        Abort(String message) {
            super(message, null, false, false);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause);
    }
}
