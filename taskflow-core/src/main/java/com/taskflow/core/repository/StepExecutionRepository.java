package com.taskflow.core.repository;

import com.taskflow.core.model.StepExecution;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for step execution audit records.
 */
public interface StepExecutionRepository {

    /**
     * Save a new step execution.
     *
     * @param stepExecution The record to save
     */
    void save(StepExecution stepExecution);

    /**
     * Update an existing step execution.
     *
     * @param stepExecution The updated record
     * @throws com.taskflow.core.exception.NotFoundException if the record does not exist
     */
    void update(StepExecution stepExecution);

    Optional<StepExecution> findById(UUID stepExecutionId);

    /**
     * Find all step executions of a workflow execution.
     *
     * @param executionId The workflow execution ID
     * @return Records ordered by start time
     */
    List<StepExecution> findByExecution(UUID executionId);

    /**
     * Find all attempts of one step within an execution.
     *
     * @param executionId The workflow execution ID
     * @param stepId The step ID
     * @return Attempts ordered by retry count
     */
    List<StepExecution> findByStep(UUID executionId, UUID stepId);

    /**
     * Find step executions waiting on an external decision.
     *
     * @param limit Maximum number of results
     * @return Waiting records
     */
    List<StepExecution> findWaiting(int limit);
}
