package com.taskflow.core.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A node in a workflow graph.
 *
 * {@code order} is only used to pick the entry step; traversal follows {@code nextSteps}.
 * Gating conditions are combined with {@code conditionLogic}.
 */
public record WorkflowStep(
    UUID id,
    UUID workflowId,
    String name,
    String description,
    StepKind kind,
    int order,
    List<WorkflowCondition> conditions,
    ConditionLogic conditionLogic,
    List<WorkflowAction> actions,
    List<StepAssignment> assignments,
    List<UUID> nextSteps,
    boolean isOptional,
    boolean isParallel,
    Integer timeoutHours,
    Map<String, Object> configuration,
    boolean isActive
) {
    public WorkflowStep {
        if (id == null) {
            throw new IllegalArgumentException("Step id must not be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Step kind must not be null");
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        conditionLogic = conditionLogic == null ? ConditionLogic.AND : conditionLogic;
        actions = actions == null ? List.of() : List.copyOf(actions);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        configuration = VariableMap.freeze(configuration);
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    public VariableMap config() {
        return VariableMap.of(configuration);
    }

    public List<UUID> approverIds() {
        return assignments.stream()
            .filter(StepAssignment::isApprover)
            .map(StepAssignment::userId)
            .toList();
    }

    public WorkflowStep withWorkflowId(UUID workflowId) {
        return toBuilder().workflowId(workflowId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private UUID workflowId;
        private String name;
        private String description;
        private StepKind kind = StepKind.TASK;
        private int order;
        private List<WorkflowCondition> conditions = List.of();
        private ConditionLogic conditionLogic = ConditionLogic.AND;
        private List<WorkflowAction> actions = List.of();
        private List<StepAssignment> assignments = List.of();
        private List<UUID> nextSteps = List.of();
        private boolean isOptional;
        private boolean isParallel;
        private Integer timeoutHours;
        private Map<String, Object> configuration = Map.of();
        private boolean isActive = true;

        public Builder() {
        }

        public Builder(WorkflowStep step) {
            this.id = step.id();
            this.workflowId = step.workflowId();
            this.name = step.name();
            this.description = step.description();
            this.kind = step.kind();
            this.order = step.order();
            this.conditions = step.conditions();
            this.conditionLogic = step.conditionLogic();
            this.actions = step.actions();
            this.assignments = step.assignments();
            this.nextSteps = step.nextSteps();
            this.isOptional = step.isOptional();
            this.isParallel = step.isParallel();
            this.timeoutHours = step.timeoutHours();
            this.configuration = step.configuration();
            this.isActive = step.isActive();
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(UUID workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder kind(StepKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder conditions(List<WorkflowCondition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder condition(WorkflowCondition condition) {
            this.conditions = append(this.conditions, condition);
            return this;
        }

        public Builder conditionLogic(ConditionLogic conditionLogic) {
            this.conditionLogic = conditionLogic;
            return this;
        }

        public Builder actions(List<WorkflowAction> actions) {
            this.actions = actions;
            return this;
        }

        public Builder action(WorkflowAction action) {
            this.actions = append(this.actions, action);
            return this;
        }

        public Builder assignments(List<StepAssignment> assignments) {
            this.assignments = assignments;
            return this;
        }

        public Builder assignment(StepAssignment assignment) {
            this.assignments = append(this.assignments, assignment);
            return this;
        }

        public Builder nextSteps(List<UUID> nextSteps) {
            this.nextSteps = nextSteps;
            return this;
        }

        public Builder next(UUID... stepIds) {
            this.nextSteps = List.of(stepIds);
            return this;
        }

        public Builder optional(boolean isOptional) {
            this.isOptional = isOptional;
            return this;
        }

        public Builder parallel(boolean isParallel) {
            this.isParallel = isParallel;
            return this;
        }

        public Builder timeoutHours(Integer timeoutHours) {
            this.timeoutHours = timeoutHours;
            return this;
        }

        public Builder configuration(Map<String, ?> configuration) {
            this.configuration = VariableMap.freeze(configuration);
            return this;
        }

        public Builder active(boolean isActive) {
            this.isActive = isActive;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(
                id, workflowId, name, description, kind, order,
                conditions, conditionLogic, actions, assignments, nextSteps,
                isOptional, isParallel, timeoutHours, configuration, isActive
            );
        }

        private static <T> List<T> append(List<T> list, T element) {
            var copy = new java.util.ArrayList<>(list);
            copy.add(element);
            return copy;
        }
    }
}
