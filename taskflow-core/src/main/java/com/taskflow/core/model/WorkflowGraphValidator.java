package com.taskflow.core.model;

import com.taskflow.core.exception.WorkflowValidationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Structural checks run when a workflow is activated.
 *
 * Rejects duplicate step ids, successors that are not steps of the workflow,
 * self-loops, cycles and workflows without steps.
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    /**
     * @throws WorkflowValidationException describing the first problem found
     */
    public static void validate(Workflow workflow) {
        Map<UUID, WorkflowStep> stepsById = new LinkedHashMap<>();
        for (WorkflowStep step : workflow.steps()) {
            if (stepsById.put(step.id(), step) != null) {
                throw new WorkflowValidationException("steps", "duplicate step id " + step.id());
            }
        }

        if (stepsById.isEmpty()) {
            throw new WorkflowValidationException("steps", "workflow has no steps");
        }

        for (WorkflowStep step : workflow.steps()) {
            for (UUID next : step.nextSteps()) {
                if (next.equals(step.id())) {
                    throw new WorkflowValidationException("nextSteps",
                        String.format("step '%s' lists itself as a successor", label(step)));
                }
                if (!stepsById.containsKey(next)) {
                    throw new WorkflowValidationException("nextSteps",
                        String.format("step '%s' references unknown step %s", label(step), next));
                }
            }
        }

        List<UUID> cycle = findCycleMembers(stepsById);
        if (!cycle.isEmpty()) {
            throw new WorkflowValidationException("nextSteps",
                "step graph contains a cycle through " + cycle);
        }
    }

    /**
     * Kahn's algorithm: whatever cannot be drained from the in-degree queue sits on a cycle
     * (or downstream of one).
     */
    private static List<UUID> findCycleMembers(Map<UUID, WorkflowStep> stepsById) {
        Map<UUID, Integer> inDegree = new HashMap<>();
        stepsById.keySet().forEach(id -> inDegree.put(id, 0));
        for (WorkflowStep step : stepsById.values()) {
            for (UUID next : new HashSet<>(step.nextSteps())) {
                inDegree.merge(next, 1, Integer::sum);
            }
        }

        Deque<UUID> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        Set<UUID> drained = new HashSet<>();
        while (!ready.isEmpty()) {
            UUID current = ready.poll();
            drained.add(current);
            for (UUID next : new HashSet<>(stepsById.get(current).nextSteps())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        return stepsById.keySet().stream()
            .filter(id -> !drained.contains(id))
            .toList();
    }

    private static String label(WorkflowStep step) {
        return step.name() != null ? step.name() : step.id().toString();
    }
}
