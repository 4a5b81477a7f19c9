package com.taskflow.engine.coordinator;

import com.taskflow.core.exception.*;
import com.taskflow.core.model.*;
import com.taskflow.core.repository.*;
import com.taskflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * Control plane of the engine: owns workflow definitions and the lifecycle of executions.
 *
 * Starting an execution persists it as running and hands the traversal to the
 * {@link ExecutionSupervisor}; the caller gets the execution back immediately. A paused
 * execution resumes through {@link #submitApproval(UUID, UUID, ApprovalDecision)}.
 */
public class WorkflowOrchestrator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    public static final String APPROVAL_REJECTED = "APPROVAL_REJECTED";

    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final WorkflowRepository workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final StepExecutionRepository stepExecutionRepository;
    private final ExecutionSupervisor supervisor;
    private final ExecutionDriver driver;
    private final ExecutionReporter reporter;

    public WorkflowOrchestrator(
            WorkflowRepository workflowRepository,
            WorkflowExecutionRepository executionRepository,
            StepExecutionRepository stepExecutionRepository,
            ExecutionSupervisor supervisor,
            ExecutionDriver driver,
            ExecutionReporter reporter) {
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.stepExecutionRepository = stepExecutionRepository;
        this.supervisor = supervisor;
        this.driver = driver;
        this.reporter = reporter;
    }

    // ========== Definitions ==========

    @Override
    public Workflow registerWorkflow(Workflow workflow) {
        log.info("Registering workflow: {} ({})", workflow.name(), workflow.id());
        workflowRepository.save(workflow);
        return workflow;
    }

    @Override
    public Workflow activateWorkflow(UUID workflowId, UUID activatedBy) {
        Workflow active = loadWorkflow(workflowId).activate(activatedBy);
        workflowRepository.update(active);
        log.info("Activated workflow: {} ({})", active.name(), workflowId);
        return active;
    }

    @Override
    public Workflow deactivateWorkflow(UUID workflowId, UUID deactivatedBy) {
        Workflow inactive = loadWorkflow(workflowId).deactivate(deactivatedBy);
        workflowRepository.update(inactive);
        log.info("Deactivated workflow: {} ({})", inactive.name(), workflowId);
        return inactive;
    }

    // ========== Executions ==========

    @Override
    public WorkflowExecution startWorkflow(UUID workflowId, UUID triggeredBy, Map<String, ?> triggerData) {
        return startWorkflow(workflowId, null, triggeredBy, triggerData);
    }

    @Override
    public WorkflowExecution startWorkflow(UUID workflowId, UUID triggerId, UUID triggeredBy, Map<String, ?> triggerData) {
        log.info("Starting workflow {} (trigger={}, by={})", workflowId, triggerId, triggeredBy);

        Workflow workflow = loadWorkflow(workflowId);
        if (!workflow.canExecute()) {
            throw new WorkflowNotExecutableException(workflowId, whyNotExecutable(workflow));
        }
        if (!supervisor.isAccepting()) {
            throw new IllegalStateException("Cannot accept new executions during shutdown");
        }
        List<UUID> frontier = workflow.firstStep()
            .map(entry -> List.of(entry.id()))
            .orElse(List.of());

        // Workflow defaults first, trigger data wins
        Map<String, Object> variables = new LinkedHashMap<>(workflow.variables());
        if (triggerData != null) {
            variables.putAll(triggerData);
        }

        WorkflowExecution running = WorkflowExecution
            .create(workflowId, triggerId, triggeredBy, triggerData, variables)
            .start(null);
        Instant startedAt = running.startedAt();
        running = running.toBuilder()
            .deadline(workflow.configuration().executionTimeBudget().map(startedAt::plus).orElse(null))
            .build();

        executionRepository.save(running);
        reporter.started(workflow, running);
        if (frontier.isEmpty()) {
            // The run completes straight away
            log.info("No steps to execute for execution {}", running.id());
        } else {
            log.info("Started execution {} of workflow '{}'", running.id(), workflow.name());
        }

        submitRun(workflow, running, frontier);
        return running;
    }

    @Override
    public WorkflowExecution getExecution(UUID executionId) {
        return executionRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("WorkflowExecution", executionId));
    }

    @Override
    public List<WorkflowExecution> listExecutions(UUID workflowId) {
        return executionRepository.findByWorkflow(workflowId);
    }

    @Override
    public List<StepExecution> getStepExecutions(UUID executionId) {
        return stepExecutionRepository.findByExecution(executionId);
    }

    @Override
    public WorkflowExecution cancelExecution(UUID executionId, String reason) {
        log.info("Cancelling execution {}: {}", executionId, reason);

        return withWriteRetry(() -> {
            WorkflowExecution current = getExecution(executionId);
            if (current.isTerminal()) {
                throw new InvalidStateTransitionException(current.status(), ExecutionStatus.CANCELLED);
            }
            if (current.status() == ExecutionStatus.RUNNING && supervisor.cancel(executionId, reason)) {
                // The run writes the cancelled state at its next transition point
                return current;
            }

            WorkflowExecution cancelled = current.cancel(reason);
            executionRepository.update(cancelled);
            log.info("Cancelled {} execution {}", current.status().value(), executionId);
            reporter.cancelled(loadWorkflow(current.workflowId()), cancelled,
                current.status() == ExecutionStatus.RUNNING);
            return cancelled;
        });
    }

    @Override
    public WorkflowExecution submitApproval(UUID executionId, UUID stepId, ApprovalDecision decision) {
        log.info("Approval decision on execution {} step {}: approved={} by {}",
            executionId, stepId, decision.approved(), decision.decidedBy());

        return withWriteRetry(() -> {
            WorkflowExecution execution = getExecution(executionId);
            if (execution.status() != ExecutionStatus.PAUSED) {
                throw new InvalidStateTransitionException(execution.status(), ExecutionStatus.RUNNING);
            }
            if (!execution.awaitingStepIds().contains(stepId)) {
                throw new NotFoundException("AwaitingStep", stepId);
            }
            Workflow workflow = loadWorkflow(execution.workflowId());
            WorkflowStep step = workflow.stepById(stepId)
                .orElseThrow(() -> new NotFoundException("WorkflowStep", stepId));
            StepExecution waiting = stepExecutionRepository.findByStep(executionId, stepId).stream()
                .filter(s -> s.status() == StepExecutionStatus.WAITING)
                .reduce((first, second) -> second)
                .orElseThrow(() -> new NotFoundException("StepExecution", stepId));

            return decision.approved()
                ? approve(workflow, execution, step, waiting, decision)
                : reject(workflow, execution, waiting, decision);
        });
    }

    // ========== Helper Methods ==========

    private WorkflowExecution approve(
            Workflow workflow,
            WorkflowExecution execution,
            WorkflowStep step,
            StepExecution waiting,
            ApprovalDecision decision) {
        Map<String, Object> output = new LinkedHashMap<>(waiting.output());
        output.put("approved", true);
        output.put("approved_by", decision.decidedBy().toString());
        output.put("approved_at", Instant.now().toString());
        output.put("comment", decision.comment());

        Map<String, Object> variables = new LinkedHashMap<>(execution.variables());
        variables.putAll(output);

        Set<UUID> pending = new LinkedHashSet<>(execution.pendingStepIds());
        pending.addAll(step.nextSteps());
        List<UUID> awaiting = new ArrayList<>(execution.awaitingStepIds());
        awaiting.remove(step.id());

        WorkflowExecution recorded = execution.withApprovalRecorded(variables, List.copyOf(pending), awaiting);
        if (!awaiting.isEmpty()) {
            executionRepository.update(recorded);
            stepExecutionRepository.update(waiting.withCompleted(output));
            log.info("Approval recorded, execution {} still awaiting {}", execution.id(), awaiting);
            return recorded;
        }

        WorkflowExecution resumed = recorded.resume();
        executionRepository.update(resumed);
        stepExecutionRepository.update(waiting.withCompleted(output));
        log.info("Resuming execution {} with pending steps {}", execution.id(), resumed.pendingStepIds());
        reporter.resumed(workflow, resumed, decision.decidedBy());

        submitRun(workflow, resumed, resumed.pendingStepIds());
        return resumed;
    }

    private WorkflowExecution reject(
            Workflow workflow,
            WorkflowExecution execution,
            StepExecution waiting,
            ApprovalDecision decision) {
        String message = "Approval rejected by " + decision.decidedBy()
            + (decision.comment() != null ? ": " + decision.comment() : "");

        WorkflowExecution failed = execution.fail(message);
        executionRepository.update(failed);
        stepExecutionRepository.update(waiting.withFailed(message, APPROVAL_REJECTED));
        log.info("Execution {} failed: {}", execution.id(), message);
        reporter.failed(workflow, failed);
        return failed;
    }

    private void submitRun(Workflow workflow, WorkflowExecution execution, List<UUID> frontier) {
        try {
            supervisor.submit(execution.id(), token -> driver.run(workflow, execution, frontier, token));
        } catch (IllegalStateException e) {
            WorkflowExecution failed = execution.fail(e.getMessage());
            try {
                executionRepository.update(failed);
            } catch (RuntimeException writeError) {
                log.error("Could not record failure of execution {}", execution.id(), writeError);
            }
            reporter.failed(workflow, failed);
            throw e;
        }
    }

    /**
     * Retry a read-modify-write against a concurrent writer of the same execution.
     */
    private WorkflowExecution withWriteRetry(Supplier<WorkflowExecution> operation) {
        OptimisticLockException conflict = null;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            try {
                return operation.get();
            } catch (OptimisticLockException e) {
                log.debug("Concurrent update on attempt {}: {}", attempt, e.getMessage());
                conflict = e;
            }
        }
        throw conflict;
    }

    private Workflow loadWorkflow(UUID workflowId) {
        return workflowRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    private static String whyNotExecutable(Workflow workflow) {
        if (workflow.status() != WorkflowStatus.ACTIVE) {
            return "workflow status is " + workflow.status().value();
        }
        if (!workflow.isActive()) {
            return "workflow is not active";
        }
        return "workflow has no steps";
    }
}
