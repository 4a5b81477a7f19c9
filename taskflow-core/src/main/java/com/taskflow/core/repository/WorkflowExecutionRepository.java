package com.taskflow.core.repository;

import com.taskflow.core.model.ExecutionStatus;
import com.taskflow.core.model.WorkflowExecution;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow executions.
 * Supports optimistic locking via sequence numbers: writes to one execution are serialized
 * and a write carrying a sequence number not above the stored one is rejected.
 */
public interface WorkflowExecutionRepository {

    /**
     * Save a new execution.
     *
     * @param execution The execution to save
     */
    void save(WorkflowExecution execution);

    /**
     * Update an existing execution with optimistic locking.
     *
     * @param execution The execution to update
     * @throws com.taskflow.core.exception.OptimisticLockException if the write is stale
     * @throws com.taskflow.core.exception.NotFoundException if the execution does not exist
     */
    void update(WorkflowExecution execution);

    /**
     * Find an execution by ID.
     *
     * @param executionId The execution ID
     * @return The execution if found
     */
    Optional<WorkflowExecution> findById(UUID executionId);

    /**
     * Find all executions of a workflow, oldest first.
     *
     * @param workflowId The workflow ID
     * @return Executions of the workflow
     */
    List<WorkflowExecution> findByWorkflow(UUID workflowId);

    /**
     * Find executions by status.
     *
     * @param status The execution status
     * @param limit Maximum number of results
     * @return Executions in the given status
     */
    List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit);

    /**
     * Count executions by status for a workflow.
     *
     * @param workflowId The workflow ID
     * @return Count per status
     */
    Map<ExecutionStatus, Long> countByStatus(UUID workflowId);
}
