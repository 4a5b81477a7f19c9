package com.taskflow.engine.step;

import com.taskflow.core.exception.ConditionEvaluationException;
import com.taskflow.core.exception.ExecutionCancelledException;
import com.taskflow.core.exception.StepExecutionException;
import com.taskflow.core.exception.TaskflowException;
import com.taskflow.core.exception.UnsupportedStepKindException;
import com.taskflow.core.model.RetryPolicy;
import com.taskflow.core.model.StepExecution;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowConfig;
import com.taskflow.core.model.WorkflowStep;
import com.taskflow.core.repository.NotificationRepository;
import com.taskflow.core.repository.StepExecutionRepository;
import com.taskflow.core.repository.TaskRepository;
import com.taskflow.engine.action.ActionDispatcher;
import com.taskflow.engine.condition.ConditionEvaluator;
import com.taskflow.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a single attempt of a single step and records it.
 *
 * Every attempt writes its own {@link StepExecution}: created in {@code running},
 * then moved to completed, skipped, waiting or failed. Write failures propagate to the
 * caller, which aborts the run.
 *
 * The runner never sleeps between attempts. A failed result carries whether and when
 * the caller should try again.
 */
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final StepExecutionRepository stepExecutionRepository;
    private final ConditionEvaluator conditionEvaluator;
    private final StepHandler taskHandler;
    private final StepHandler approvalHandler;
    private final StepHandler notificationHandler;
    private final StepHandler actionHandler;
    private final StepHandler waitHandler;
    private final StepHandler conditionHandler;
    private final int maxRetryAttempts;

    public StepRunner(
            StepExecutionRepository stepExecutionRepository,
            ConditionEvaluator conditionEvaluator,
            StepHandler taskHandler,
            StepHandler approvalHandler,
            StepHandler notificationHandler,
            StepHandler actionHandler,
            StepHandler waitHandler,
            StepHandler conditionHandler,
            int maxRetryAttempts) {
        if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("maxRetryAttempts must be >= 0");
        }
        this.stepExecutionRepository = stepExecutionRepository;
        this.conditionEvaluator = conditionEvaluator;
        this.taskHandler = taskHandler;
        this.approvalHandler = approvalHandler;
        this.notificationHandler = notificationHandler;
        this.actionHandler = actionHandler;
        this.waitHandler = waitHandler;
        this.conditionHandler = conditionHandler;
        this.maxRetryAttempts = maxRetryAttempts;
    }

    /**
     * Runner with the built-in handler for every supported step kind.
     */
    public static StepRunner standard(
            StepExecutionRepository stepExecutionRepository,
            ConditionEvaluator conditionEvaluator,
            ActionDispatcher actionDispatcher,
            TaskRepository taskRepository,
            NotificationRepository notificationRepository,
            int maxRetryAttempts) {
        return new StepRunner(
            stepExecutionRepository,
            conditionEvaluator,
            new TaskStepHandler(taskRepository),
            new ApprovalStepHandler(notificationRepository),
            new NotificationStepHandler(notificationRepository),
            new ActionStepHandler(actionDispatcher),
            new WaitStepHandler(),
            new ConditionStepHandler(),
            maxRetryAttempts
        );
    }

    /**
     * Run one attempt.
     *
     * @param context The attempt to run
     * @return The outcome, with the persisted record
     * @throws ExecutionCancelledException if the run was cancelled while the step was suspended
     */
    public StepResult run(StepContext context) {
        WorkflowStep step = context.step();
        try (var ctx = LoggingContext.forStep(
                context.workflow().id(), context.executionId(), step.id(), context.attempt())) {

            StepExecution record = StepExecution.start(
                context.executionId(), step, context.variables().asMap(), context.attempt() - 1);
            stepExecutionRepository.save(record);

            if (!step.isActive()) {
                log.debug("Skipping inactive step '{}'", step.name());
                return skip(record, step);
            }

            if (step.hasConditions()) {
                boolean passed;
                try {
                    passed = conditionEvaluator.evaluateAll(
                        step.conditions(), step.conditionLogic(), context.variables().asMap());
                } catch (ConditionEvaluationException e) {
                    log.warn("Condition evaluation failed for step '{}': {}", step.name(), e.getMessage());
                    return fail(record, context, e.getMessage(), e.getErrorCode(), false);
                }
                if (!passed) {
                    log.info("Conditions not met, skipping step '{}'", step.name());
                    return skip(record, step);
                }
            }

            log.info("Running {} step '{}' (attempt {})", step.kind().value(), step.name(), context.attempt());
            StepOutput output;
            try {
                output = dispatch(context);
            } catch (ExecutionCancelledException e) {
                stepExecutionRepository.update(record.withFailed("cancelled", e.getErrorCode()));
                throw e;
            } catch (StepExecutionException e) {
                return fail(record, context, e.getMessage(), e.getErrorCode(), e.isRetryable());
            } catch (TaskflowException e) {
                return fail(record, context, e.getMessage(), e.getErrorCode(), false);
            } catch (RuntimeException e) {
                log.debug("Unexpected error in step '{}'", step.name(), e);
                return fail(record, context, describe(e), StepExecutionException.ERROR_CODE, true);
            }

            if (output.waiting()) {
                StepExecution waiting = record.withWaiting(output.assignee(), output.values());
                stepExecutionRepository.update(waiting);
                log.info("Step '{}' is waiting on {}", step.name(), output.assignee());
                return StepResult.waiting(waiting);
            }

            StepExecution completed = record.withCompleted(output.values());
            stepExecutionRepository.update(completed);
            log.info("Step '{}' completed", step.name());
            return StepResult.completed(completed, step.nextSteps());
        }
    }

    private StepOutput dispatch(StepContext context) {
        StepHandler handler = switch (context.step().kind()) {
            case TASK -> taskHandler;
            case APPROVAL -> approvalHandler;
            case NOTIFICATION -> notificationHandler;
            case ACTION -> actionHandler;
            case WAIT -> waitHandler;
            case CONDITION -> conditionHandler;
            case REVIEW, LOOP, SUB_WORKFLOW -> throw new UnsupportedStepKindException(context.step().kind());
        };
        return handler.execute(context);
    }

    private StepResult skip(StepExecution record, WorkflowStep step) {
        StepExecution skipped = record.withSkipped();
        stepExecutionRepository.update(skipped);
        return StepResult.skipped(skipped, step.nextSteps());
    }

    private StepResult fail(StepExecution record, StepContext context, String message, String code, boolean retryable) {
        StepExecution failed = record.withFailed(message, code);
        stepExecutionRepository.update(failed);

        RetryPolicy policy;
        try {
            policy = retryPolicyFor(context);
        } catch (IllegalArgumentException | TaskflowException e) {
            log.warn("Invalid retry settings on step '{}', not retrying: {}", context.step().name(), e.getMessage());
            policy = RetryPolicy.noRetry();
        }
        boolean shouldRetry = retryable
            && policy.shouldRetry(code)
            && policy.hasMoreAttempts(context.attempt());
        Duration delay = shouldRetry ? policy.computeBackoff(context.attempt()) : Duration.ZERO;

        if (shouldRetry) {
            log.warn("Step '{}' failed on attempt {}/{}, retrying in {}ms: {}",
                context.step().name(), context.attempt(), policy.maxAttempts(), delay.toMillis(), message);
        } else {
            log.error("Step '{}' failed on attempt {}: {}", context.step().name(), context.attempt(), message);
        }
        return StepResult.failed(failed, shouldRetry, delay);
    }

    /**
     * Step level {@code retry_attempts} / {@code retry_delay} override the workflow configuration.
     * A step may further set {@code retry_backoff} (delay multiplier), {@code retry_max_delay},
     * {@code retry_jitter}, {@code retry_on} and {@code no_retry_on} (error codes).
     * Either way the number of retries never exceeds the engine-wide cap.
     *
     * @throws IllegalArgumentException if the settings describe an invalid policy
     */
    RetryPolicy retryPolicyFor(StepContext context) {
        WorkflowConfig workflowConfig = context.workflow().configuration();
        VariableMap stepConfig = context.step().config();

        RetryPolicy policy;
        if (stepConfig.containsKey("retry_attempts") || stepConfig.containsKey("retry_delay")) {
            int retries = stepConfig.integer("retry_attempts").orElse(workflowConfig.retryAttempts());
            Duration delay = stepConfig.duration("retry_delay").orElse(workflowConfig.retryDelay());
            policy = RetryPolicy.fixed(Math.max(0, retries) + 1, delay);
        } else {
            policy = workflowConfig.retryPolicy();
        }

        if (stepConfig.containsKey("retry_backoff") || stepConfig.containsKey("retry_max_delay")) {
            policy = policy.withBackoff(
                stepConfig.decimal("retry_backoff").orElse(1.0),
                stepConfig.duration("retry_max_delay").orElse(null));
        }
        Optional<Double> jitter = stepConfig.decimal("retry_jitter");
        if (jitter.isPresent()) {
            policy = policy.withJitter(jitter.get());
        }
        if (stepConfig.containsKey("retry_on") || stepConfig.containsKey("no_retry_on")) {
            policy = policy.withErrorCodes(
                Set.copyOf(stepConfig.stringList("retry_on").orElse(List.of())),
                Set.copyOf(stepConfig.stringList("no_retry_on").orElse(List.of())));
        }
        return policy.cappedAt(maxRetryAttempts + 1);
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
