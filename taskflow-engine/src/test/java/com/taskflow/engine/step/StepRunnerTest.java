package com.taskflow.engine.step;

import com.taskflow.core.exception.ConditionEvaluationException;
import com.taskflow.core.exception.ExecutionCancelledException;
import com.taskflow.core.exception.StepExecutionException;
import com.taskflow.core.exception.UnsupportedStepKindException;
import com.taskflow.core.model.*;
import com.taskflow.engine.action.DefaultActionDispatcher;
import com.taskflow.engine.condition.DefaultConditionEvaluator;
import com.taskflow.engine.coordinator.CancellationToken;
import com.taskflow.engine.persistence.InMemoryNotificationRepository;
import com.taskflow.engine.persistence.InMemoryStepExecutionRepository;
import com.taskflow.engine.persistence.InMemoryTaskRepository;
import com.taskflow.engine.support.FakeWebhookClient;
import com.taskflow.engine.support.RecordingEmailSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class StepRunnerTest {

    private static final int RETRY_CAP = 5;

    private InMemoryStepExecutionRepository stepRepository;
    private InMemoryNotificationRepository notificationRepository;
    private InMemoryTaskRepository taskRepository;
    private StepRunner runner;
    private final UUID executionId = UUID.randomUUID();
    private final UUID user = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        stepRepository = new InMemoryStepExecutionRepository();
        notificationRepository = new InMemoryNotificationRepository();
        taskRepository = new InMemoryTaskRepository();
        DefaultConditionEvaluator evaluator = new DefaultConditionEvaluator();
        runner = StepRunner.standard(stepRepository, evaluator,
            DefaultActionDispatcher.standard(taskRepository, notificationRepository,
                new RecordingEmailSender(), new FakeWebhookClient(), evaluator),
            taskRepository, notificationRepository, RETRY_CAP);
    }

    private StepRunner runnerWithActionHandler(StepHandler actionHandler, int cap) {
        DefaultConditionEvaluator evaluator = new DefaultConditionEvaluator();
        return new StepRunner(stepRepository, evaluator,
            new TaskStepHandler(taskRepository),
            new ApprovalStepHandler(notificationRepository),
            new NotificationStepHandler(notificationRepository),
            actionHandler,
            new WaitStepHandler(),
            new ConditionStepHandler(),
            cap);
    }

    private static Workflow workflow(WorkflowConfig config) {
        return Workflow.builder().name("wf").configuration(config).build();
    }

    private StepContext context(Workflow workflow, WorkflowStep step, Map<String, ?> variables, int attempt) {
        return new StepContext(executionId, workflow, step, user, VariableMap.of(variables), attempt,
            CancellationToken.none());
    }

    private StepContext context(WorkflowStep step, Map<String, ?> variables) {
        return context(workflow(WorkflowConfig.defaults()), step, variables, 1);
    }

    // ========== Gating ==========

    @Test
    @DisplayName("A passing step is recorded as completed and hands over its successors")
    void completedStep() {
        UUID next = UUID.randomUUID();
        WorkflowStep step = WorkflowStep.builder().name("check").kind(StepKind.CONDITION).next(next).build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.COMPLETED);
        assertThat(result.nextSteps()).containsExactly(next);
        assertThat(result.output()).containsEntry("condition_met", true);
        assertThat(stepRepository.findById(result.stepExecution().id()).orElseThrow().status())
            .isEqualTo(StepExecutionStatus.COMPLETED);
    }

    @Test
    @DisplayName("Unmet conditions skip the step but keep its successors")
    void unmetConditionsSkip() {
        UUID next = UUID.randomUUID();
        WorkflowStep step = WorkflowStep.builder()
            .name("big orders only")
            .kind(StepKind.NOTIFICATION)
            .condition(WorkflowCondition.of("amount", ConditionOperator.GREATER_THAN, 1000))
            .next(next)
            .build();

        StepResult result = runner.run(context(step, Map.of("amount", 10)));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.SKIPPED);
        assertThat(result.nextSteps()).containsExactly(next);
        assertThat(result.stepExecution().status()).isEqualTo(StepExecutionStatus.SKIPPED);
    }

    @Test
    @DisplayName("OR logic runs the step when any condition holds")
    void orLogic() {
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.CONDITION)
            .condition(WorkflowCondition.of("amount", ConditionOperator.GREATER_THAN, 1000))
            .condition(WorkflowCondition.of("vip", ConditionOperator.EQUALS, true))
            .conditionLogic(ConditionLogic.OR)
            .build();

        assertThat(runner.run(context(step, Map.of("amount", 10, "vip", true))).outcome())
            .isEqualTo(StepResult.Outcome.COMPLETED);
    }

    @Test
    @DisplayName("An inactive step is skipped")
    void inactiveStepSkipped() {
        WorkflowStep step = WorkflowStep.builder().kind(StepKind.TASK).active(false).build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.SKIPPED);
    }

    @Test
    @DisplayName("A condition that cannot be evaluated fails the step without retry")
    void conditionErrorIsPermanent() {
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.CONDITION)
            .condition(WorkflowCondition.of("amount", ConditionOperator.GREATER_THAN, 5))
            .build();
        Workflow retrying = workflow(WorkflowConfig.builder().retryAttempts(3).build());

        StepResult result = runner.run(context(retrying, step, Map.of("amount", "many"), 1));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.FAILED);
        assertThat(result.shouldRetry()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ConditionEvaluationException.ERROR_CODE);
    }

    // ========== Dispatch ==========

    @Test
    @DisplayName("Kinds the engine cannot run fail without retry")
    void unsupportedKind() {
        WorkflowStep step = WorkflowStep.builder().name("loop").kind(StepKind.LOOP).build();
        Workflow retrying = workflow(WorkflowConfig.builder().retryAttempts(3).build());

        StepResult result = runner.run(context(retrying, step, Map.of(), 1));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.shouldRetry()).isFalse();
        assertThat(result.errorCode()).isEqualTo(UnsupportedStepKindException.ERROR_CODE);
    }

    @Test
    @DisplayName("A task step creates a task from its configuration")
    void taskStep() {
        WorkflowStep step = WorkflowStep.builder()
            .name("Review")
            .kind(StepKind.TASK)
            .configuration(Map.of("title", "Review order", "priority", "high"))
            .build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.COMPLETED);
        Task task = taskRepository.findById(UUID.fromString((String) result.output().get("task_id"))).orElseThrow();
        assertThat(task.title()).isEqualTo("Review order");
        assertThat(task.createdBy()).isEqualTo(user);
    }

    @Test
    @DisplayName("A task step without name or title creates one untitled task")
    void namelessTaskStep() {
        WorkflowStep step = WorkflowStep.builder().kind(StepKind.TASK).build();
        Workflow retrying = workflow(WorkflowConfig.builder().retryAttempts(3).build());

        StepResult result = runner.run(context(retrying, step, Map.of(), 1));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.COMPLETED);
        assertThat(result.output()).containsEntry("task_title", "");
        Task task = taskRepository.findById(UUID.fromString((String) result.output().get("task_id"))).orElseThrow();
        assertThat(task.title()).isEmpty();
    }

    @Test
    @DisplayName("A blank title falls back to the step name")
    void blankTitleUsesStepName() {
        WorkflowStep step = WorkflowStep.builder()
            .name("Collect documents")
            .kind(StepKind.TASK)
            .configuration(Map.of("title", " "))
            .build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.output()).containsEntry("task_title", "Collect documents");
    }

    @Test
    @DisplayName("An action step runs its actions in order, each seeing the previous output")
    void actionStepChainsOutputs() {
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .action(WorkflowAction.of(ActionType.SCRIPT, "is_large",
                Map.of("field", "amount", "operator", "greater_than", "value", 1000)))
            .action(WorkflowAction.of(ActionType.SCRIPT, "flagged",
                Map.of("field", "is_large", "operator", "equals", "value", true)))
            .build();

        StepResult result = runner.run(context(step, Map.of("amount", 5000)));

        assertThat(result.output()).containsEntry("is_large", true).containsEntry("flagged", true);
    }

    // ========== Approval ==========

    @Test
    @DisplayName("An approval step notifies approvers and waits")
    void approvalWaits() {
        UUID approver = UUID.randomUUID();
        WorkflowStep step = WorkflowStep.builder()
            .name("Manager sign-off")
            .kind(StepKind.APPROVAL)
            .assignment(StepAssignment.approver(approver))
            .build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.WAITING);
        assertThat(result.stepExecution().status()).isEqualTo(StepExecutionStatus.WAITING);
        assertThat(result.stepExecution().assignedTo()).isEqualTo(approver);
        assertThat(stepRepository.findWaiting(10)).hasSize(1);
        assertThat(notificationRepository.findByUser(approver))
            .singleElement()
            .satisfies(n -> assertThat(n.type()).isEqualTo(Notification.TYPE_APPROVAL));
    }

    @Test
    @DisplayName("auto_approve completes the approval immediately")
    void autoApprove() {
        UUID approver = UUID.randomUUID();
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.APPROVAL)
            .assignment(StepAssignment.approver(approver))
            .configuration(Map.of("auto_approve", true))
            .build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.COMPLETED);
        assertThat(result.output())
            .containsEntry("approved", true)
            .containsEntry("approved_by", approver.toString());
    }

    @Test
    @DisplayName("An approval step without approvers fails permanently")
    void approvalWithoutApprovers() {
        WorkflowStep step = WorkflowStep.builder().kind(StepKind.APPROVAL).build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.errorCode()).isEqualTo(ApprovalStepHandler.NO_APPROVERS);
        assertThat(result.shouldRetry()).isFalse();
    }

    // ========== Retry ==========

    @Test
    @DisplayName("Unexpected errors are retried with the workflow delay until attempts run out")
    void retryableFailure() {
        AtomicInteger calls = new AtomicInteger();
        StepRunner flaky = runnerWithActionHandler(context -> {
            calls.incrementAndGet();
            throw new IllegalStateException("downstream unavailable");
        }, RETRY_CAP);
        Workflow workflow = workflow(WorkflowConfig.builder()
            .retryAttempts(2)
            .retryDelay(Duration.ofSeconds(3))
            .build());
        WorkflowStep step = WorkflowStep.builder().kind(StepKind.ACTION).build();

        StepResult first = flaky.run(context(workflow, step, Map.of(), 1));
        StepResult last = flaky.run(context(workflow, step, Map.of(), 3));

        assertThat(first.shouldRetry()).isTrue();
        assertThat(first.retryDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(first.errorMessage()).isEqualTo("downstream unavailable");
        assertThat(first.errorCode()).isEqualTo(StepExecutionException.ERROR_CODE);
        assertThat(last.shouldRetry()).isFalse();
        assertThat(calls).hasValue(2);

        assertThat(stepRepository.findByStep(executionId, step.id()))
            .extracting(StepExecution::retryCount)
            .containsExactly(0, 2);
    }

    @Test
    @DisplayName("A permanent step failure is never retried")
    void permanentFailure() {
        StepRunner failing = runnerWithActionHandler(context -> {
            throw StepExecutionException.permanent("BAD_INPUT", "bad input");
        }, RETRY_CAP);
        Workflow workflow = workflow(WorkflowConfig.builder().retryAttempts(3).build());

        StepResult result = failing.run(context(workflow, WorkflowStep.builder().kind(StepKind.ACTION).build(),
            Map.of(), 1));

        assertThat(result.shouldRetry()).isFalse();
        assertThat(result.errorCode()).isEqualTo("BAD_INPUT");
    }

    @Test
    @DisplayName("Step level retry settings override the workflow's")
    void stepRetryOverride() {
        Workflow workflow = workflow(WorkflowConfig.builder()
            .retryAttempts(3)
            .retryDelay(Duration.ofSeconds(1))
            .build());
        WorkflowStep noRetry = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .configuration(Map.of("retry_attempts", 0))
            .build();
        WorkflowStep slower = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .configuration(Map.of("retry_delay", "5s"))
            .build();

        RetryPolicy noRetryPolicy = runner.retryPolicyFor(context(workflow, noRetry, Map.of(), 1));
        RetryPolicy slowerPolicy = runner.retryPolicyFor(context(workflow, slower, Map.of(), 1));

        assertThat(noRetryPolicy.maxAttempts()).isEqualTo(1);
        assertThat(slowerPolicy.maxAttempts()).isEqualTo(4);
        assertThat(slowerPolicy.computeBackoff(1)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A step can grow its retry delay up to a ceiling")
    void growingRetryDelay() {
        StepRunner flaky = runnerWithActionHandler(context -> {
            throw StepExecutionException.transient_("UPSTREAM_BUSY", "busy");
        }, RETRY_CAP);
        Workflow workflow = workflow(WorkflowConfig.builder()
            .retryAttempts(3)
            .retryDelay(Duration.ofSeconds(1))
            .build());
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .configuration(Map.of("retry_backoff", 2.0, "retry_max_delay", "3s"))
            .build();

        assertThat(flaky.run(context(workflow, step, Map.of(), 1)).retryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(flaky.run(context(workflow, step, Map.of(), 2)).retryDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(flaky.run(context(workflow, step, Map.of(), 3)).retryDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(flaky.run(context(workflow, step, Map.of(), 4)).shouldRetry()).isFalse();
    }

    @Test
    @DisplayName("Error codes listed under no_retry_on are not retried")
    void noRetryOnErrorCode() {
        StepRunner flaky = runnerWithActionHandler(context -> {
            throw StepExecutionException.transient_("QUOTA_EXHAUSTED", "quota");
        }, RETRY_CAP);
        Workflow workflow = workflow(WorkflowConfig.builder().retryAttempts(3).build());
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .configuration(Map.of("no_retry_on", List.of("QUOTA_EXHAUSTED")))
            .build();
        WorkflowStep onlyTimeouts = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .configuration(Map.of("retry_on", List.of("TIMEOUT")))
            .build();

        assertThat(flaky.run(context(workflow, step, Map.of(), 1)).shouldRetry()).isFalse();
        assertThat(flaky.run(context(workflow, onlyTimeouts, Map.of(), 1)).shouldRetry()).isFalse();
    }

    @Test
    @DisplayName("Invalid retry settings fail the step without retry")
    void invalidRetrySettings() {
        StepRunner flaky = runnerWithActionHandler(context -> {
            throw StepExecutionException.transient_("UPSTREAM_BUSY", "busy");
        }, RETRY_CAP);
        Workflow workflow = workflow(WorkflowConfig.builder().retryAttempts(3).build());
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.ACTION)
            .configuration(Map.of("retry_backoff", 0.5))
            .build();

        StepResult result = flaky.run(context(workflow, step, Map.of(), 1));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.shouldRetry()).isFalse();
    }

    @Test
    @DisplayName("The engine-wide cap bounds retries")
    void retryCap() {
        Workflow workflow = workflow(WorkflowConfig.builder().retryAttempts(50).build());
        StepRunner capped = runnerWithActionHandler(context -> StepOutput.completed(Map.of()), 2);

        RetryPolicy policy = capped.retryPolicyFor(
            context(workflow, WorkflowStep.builder().kind(StepKind.ACTION).build(), Map.of(), 1));

        assertThat(policy.maxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("A negative retry cap is rejected")
    void negativeCap() {
        assertThatThrownBy(() -> runnerWithActionHandler(context -> StepOutput.completed(Map.of()), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Wait ==========

    @Test
    @DisplayName("A wait step completes after its duration")
    void waitStep() {
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.WAIT)
            .configuration(Map.of("duration", "10ms"))
            .build();

        StepResult result = runner.run(context(step, Map.of()));

        assertThat(result.outcome()).isEqualTo(StepResult.Outcome.COMPLETED);
        assertThat(result.output()).containsEntry("waited_duration", "10ms");
    }

    @Test
    @DisplayName("Cancelling the run interrupts a wait step")
    void cancelledWait() {
        CancellationToken token = new CancellationToken(executionId);
        token.cancel("stop");
        WorkflowStep step = WorkflowStep.builder()
            .kind(StepKind.WAIT)
            .configuration(Map.of("duration", "1h"))
            .build();

        assertThatThrownBy(() -> runner.run(new StepContext(executionId, workflow(WorkflowConfig.defaults()),
                step, user, VariableMap.empty(), 1, token)))
            .isInstanceOf(ExecutionCancelledException.class);

        assertThat(stepRepository.findByStep(executionId, step.id()))
            .singleElement()
            .satisfies(record -> assertThat(record.status()).isEqualTo(StepExecutionStatus.FAILED));
    }
}
