package com.taskflow.engine.service;

import com.taskflow.core.model.StepExecution;
import com.taskflow.core.model.Workflow;
import com.taskflow.core.model.WorkflowExecution;
import com.taskflow.engine.coordinator.ApprovalDecision;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Core service for workflow automation.
 * Manages workflow definitions and the lifecycle of their executions.
 */
public interface WorkflowService {

    /**
     * Register a new workflow definition.
     *
     * @param workflow The workflow definition, usually a draft
     * @return The registered definition
     */
    Workflow registerWorkflow(Workflow workflow);

    /**
     * Validate the step graph of a workflow and publish it.
     *
     * @param workflowId The workflow ID
     * @param activatedBy The user activating it
     * @return The active workflow
     * @throws com.taskflow.core.exception.WorkflowValidationException if the graph is malformed
     */
    Workflow activateWorkflow(UUID workflowId, UUID activatedBy);

    /**
     * Switch a workflow off. Running executions are not affected.
     *
     * @param workflowId The workflow ID
     * @param deactivatedBy The user deactivating it
     * @return The inactive workflow
     */
    Workflow deactivateWorkflow(UUID workflowId, UUID deactivatedBy);

    /**
     * Start a new execution of a workflow without a trigger.
     *
     * @param workflowId The workflow ID
     * @param triggeredBy The user starting it
     * @param triggerData Data the execution starts with
     * @return The running execution; steps run asynchronously
     * @throws com.taskflow.core.exception.WorkflowNotExecutableException if the workflow cannot execute
     */
    WorkflowExecution startWorkflow(UUID workflowId, UUID triggeredBy, Map<String, ?> triggerData);

    /**
     * Start a new execution of a workflow on behalf of a trigger.
     *
     * @param workflowId The workflow ID
     * @param triggerId The trigger that fired, or null
     * @param triggeredBy The user starting it
     * @param triggerData Data the execution starts with
     * @return The running execution; steps run asynchronously
     */
    WorkflowExecution startWorkflow(UUID workflowId, UUID triggerId, UUID triggeredBy, Map<String, ?> triggerData);

    /**
     * Get an execution by ID.
     *
     * @param executionId The execution ID
     * @return The execution
     * @throws com.taskflow.core.exception.NotFoundException if it does not exist
     */
    WorkflowExecution getExecution(UUID executionId);

    /**
     * List the executions of a workflow, oldest first.
     */
    List<WorkflowExecution> listExecutions(UUID workflowId);

    /**
     * Audit trail of an execution: one record per step attempt, ordered by start.
     */
    List<StepExecution> getStepExecutions(UUID executionId);

    /**
     * Cancel an execution.
     *
     * @param executionId The execution ID
     * @param reason The cancellation reason
     * @return The execution as of the request; a running execution is cancelled asynchronously
     * @throws com.taskflow.core.exception.InvalidStateTransitionException if the execution has already ended
     */
    WorkflowExecution cancelExecution(UUID executionId, String reason);

    /**
     * Record a decision on a step that is waiting for approval.
     *
     * @param executionId The paused execution
     * @param stepId The awaiting step
     * @param decision The decision
     * @return The execution after the decision is recorded
     */
    WorkflowExecution submitApproval(UUID executionId, UUID stepId, ApprovalDecision decision);
}
