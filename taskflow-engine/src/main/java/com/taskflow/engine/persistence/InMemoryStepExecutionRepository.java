package com.taskflow.engine.persistence;

import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.model.StepExecution;
import com.taskflow.core.model.StepExecutionStatus;
import com.taskflow.core.repository.StepExecutionRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of StepExecutionRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryStepExecutionRepository implements StepExecutionRepository {

    private static final Comparator<StepExecution> BY_START =
        Comparator.comparing(StepExecution::startedAt).thenComparing(StepExecution::retryCount);

    private final Map<UUID, StepExecution> stepExecutions = new ConcurrentHashMap<>();

    @Override
    public void save(StepExecution stepExecution) {
        stepExecutions.put(stepExecution.id(), stepExecution);
    }

    @Override
    public void update(StepExecution stepExecution) {
        if (stepExecutions.replace(stepExecution.id(), stepExecution) == null) {
            throw new NotFoundException("StepExecution", stepExecution.id());
        }
    }

    @Override
    public Optional<StepExecution> findById(UUID stepExecutionId) {
        return Optional.ofNullable(stepExecutions.get(stepExecutionId));
    }

    @Override
    public List<StepExecution> findByExecution(UUID executionId) {
        return stepExecutions.values().stream()
            .filter(s -> s.executionId().equals(executionId))
            .sorted(BY_START)
            .collect(Collectors.toList());
    }

    @Override
    public List<StepExecution> findByStep(UUID executionId, UUID stepId) {
        return stepExecutions.values().stream()
            .filter(s -> s.executionId().equals(executionId) && s.stepId().equals(stepId))
            .sorted(Comparator.comparing(StepExecution::retryCount).thenComparing(StepExecution::startedAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<StepExecution> findWaiting(int limit) {
        return stepExecutions.values().stream()
            .filter(s -> s.status() == StepExecutionStatus.WAITING)
            .sorted(BY_START)
            .limit(limit)
            .collect(Collectors.toList());
    }
}
