package com.taskflow.engine.persistence;

import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.exception.OptimisticLockException;
import com.taskflow.core.model.Workflow;
import com.taskflow.core.model.WorkflowStatus;
import com.taskflow.core.model.WorkflowTrigger;
import com.taskflow.core.repository.WorkflowRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<UUID, Workflow> workflows = new ConcurrentHashMap<>();

    @Override
    public void save(Workflow workflow) {
        if (workflows.putIfAbsent(workflow.id(), workflow) != null) {
            throw new IllegalArgumentException("Workflow already exists: " + workflow.id());
        }
    }

    @Override
    public void update(Workflow workflow) {
        workflows.compute(workflow.id(), (id, stored) -> {
            if (stored == null) {
                throw new NotFoundException("Workflow", id);
            }
            if (workflow.versionNum() <= stored.versionNum()) {
                throw new OptimisticLockException("Workflow", id, stored.versionNum(), workflow.versionNum());
            }
            return workflow;
        });
    }

    @Override
    public Optional<Workflow> findById(UUID workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public List<Workflow> findByStatus(WorkflowStatus status) {
        return workflows.values().stream()
            .filter(w -> w.status() == status)
            .sorted(Comparator.comparing(Workflow::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<Workflow> findAll() {
        return workflows.values().stream()
            .sorted(Comparator.comparing(Workflow::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowTrigger> findTriggersByEvent(String eventName) {
        return workflows.values().stream()
            .sorted(Comparator.comparing(Workflow::createdAt))
            .flatMap(w -> w.triggers().stream())
            .filter(t -> t.listensTo(eventName))
            .collect(Collectors.toList());
    }
}
