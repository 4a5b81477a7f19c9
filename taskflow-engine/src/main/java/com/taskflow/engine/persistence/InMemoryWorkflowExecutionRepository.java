package com.taskflow.engine.persistence;

import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.exception.OptimisticLockException;
import com.taskflow.core.model.ExecutionStatus;
import com.taskflow.core.model.WorkflowExecution;
import com.taskflow.core.repository.WorkflowExecutionRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowExecutionRepository.
 * {@code compute} serializes writes per execution; the sequence number check rejects stale copies.
 */
public class InMemoryWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private final Map<UUID, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowExecution execution) {
        if (executions.putIfAbsent(execution.id(), execution) != null) {
            throw new IllegalArgumentException("Execution already exists: " + execution.id());
        }
    }

    @Override
    public void update(WorkflowExecution execution) {
        executions.compute(execution.id(), (id, stored) -> {
            if (stored == null) {
                throw new NotFoundException("WorkflowExecution", id);
            }
            if (execution.sequenceNumber() <= stored.sequenceNumber()) {
                throw new OptimisticLockException(
                    "WorkflowExecution", id, stored.sequenceNumber(), execution.sequenceNumber());
            }
            return execution;
        });
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> findByWorkflow(UUID workflowId) {
        return executions.values().stream()
            .filter(e -> e.workflowId().equals(workflowId))
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == status)
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus(UUID workflowId) {
        return executions.values().stream()
            .filter(e -> e.workflowId().equals(workflowId))
            .collect(Collectors.groupingBy(WorkflowExecution::status, Collectors.counting()));
    }
}
