package com.taskflow.core.repository;

import com.taskflow.core.model.Workflow;
import com.taskflow.core.model.WorkflowStatus;
import com.taskflow.core.model.WorkflowTrigger;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow definitions.
 */
public interface WorkflowRepository {

    /**
     * Save a new workflow definition.
     *
     * @param workflow The workflow to save
     * @throws IllegalArgumentException if a workflow with the same id exists
     */
    void save(Workflow workflow);

    /**
     * Replace an existing workflow definition.
     *
     * @param workflow The updated workflow
     * @throws com.taskflow.core.exception.NotFoundException if the workflow does not exist
     * @throws com.taskflow.core.exception.OptimisticLockException if versionNum is not newer than the stored one
     */
    void update(Workflow workflow);

    /**
     * Find a workflow by ID.
     *
     * @param workflowId The workflow ID
     * @return The workflow if found
     */
    Optional<Workflow> findById(UUID workflowId);

    /**
     * Find workflows by publication status.
     *
     * @param status The status
     * @return Matching workflows
     */
    List<Workflow> findByStatus(WorkflowStatus status);

    List<Workflow> findAll();

    /**
     * Find the active triggers listening to an event, across all workflows.
     * Whether the owning workflow can currently execute is left to the caller.
     *
     * @param eventName The event name
     * @return Matching triggers, each bound to its workflow id
     */
    List<WorkflowTrigger> findTriggersByEvent(String eventName);
}
