package com.taskflow.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A workflow definition: a graph of steps plus the triggers that start it.
 * Immutable; lifecycle operations return a copy with {@code versionNum + 1}.
 *
 * Invariants:
 * - step ids are unique within the workflow
 * - an active workflow has passed {@link WorkflowGraphValidator}
 */
public record Workflow(
    // Identity
    UUID id,
    String name,
    String description,
    WorkflowType type,
    WorkflowStatus status,
    WorkflowCategory category,
    String version,
    UUID ownerId,

    // Graph
    List<WorkflowStep> steps,
    List<WorkflowTrigger> triggers,

    // Data
    Map<String, Object> variables,
    WorkflowConfig configuration,
    List<String> tags,

    // Flags
    boolean isActive,
    boolean isTemplate,

    // Audit
    Instant createdAt,
    Instant updatedAt,
    UUID createdBy,
    UUID updatedBy,
    long versionNum
) {
    public Workflow {
        if (id == null) {
            throw new IllegalArgumentException("Workflow id must not be null");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        variables = VariableMap.freeze(variables);
        configuration = configuration == null ? WorkflowConfig.defaults() : configuration;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Create a new draft workflow.
     */
    public static Workflow create(String name, String description, WorkflowType type, UUID ownerId, UUID createdBy) {
        Instant now = Instant.now();
        return new Workflow(
            UUID.randomUUID(), name, description, type, WorkflowStatus.DRAFT,
            WorkflowCategory.AUTOMATION, "1.0", ownerId,
            List.of(), List.of(), Map.of(), WorkflowConfig.defaults(), List.of(),
            false, false,
            now, now, createdBy, createdBy, 1L
        );
    }

    // ========== Queries ==========

    /**
     * Check if the workflow is published, switched on and has steps.
     * Every step may still be inactive, in which case a run completes without executing any.
     */
    public boolean canExecute() {
        return isActive && status == WorkflowStatus.ACTIVE && !steps.isEmpty();
    }

    /**
     * The active step with the lowest order. Ties go to the step added first.
     */
    public Optional<WorkflowStep> firstStep() {
        // min() keeps the first of equal elements for a sequential stream
        return steps.stream()
            .filter(WorkflowStep::isActive)
            .min(Comparator.comparingInt(WorkflowStep::order));
    }

    public Optional<WorkflowStep> stepById(UUID stepId) {
        return steps.stream()
            .filter(step -> step.id().equals(stepId))
            .findFirst();
    }

    public VariableMap variableMap() {
        return VariableMap.of(variables);
    }

    // ========== Lifecycle ==========

    /**
     * Validate the step graph and publish the workflow.
     *
     * @throws com.taskflow.core.exception.WorkflowValidationException if the graph is malformed
     */
    public Workflow activate(UUID by) {
        WorkflowGraphValidator.validate(this);
        return toBuilder()
            .status(WorkflowStatus.ACTIVE)
            .active(true)
            .touch(by)
            .build();
    }

    public Workflow deactivate(UUID by) {
        return toBuilder()
            .status(WorkflowStatus.INACTIVE)
            .active(false)
            .touch(by)
            .build();
    }

    /**
     * Append a step, binding it to this workflow.
     */
    public Workflow addStep(WorkflowStep step) {
        List<WorkflowStep> newSteps = new ArrayList<>(steps);
        newSteps.add(step.withWorkflowId(id));
        return toBuilder()
            .steps(newSteps)
            .touch(updatedBy)
            .build();
    }

    public Workflow addTrigger(WorkflowTrigger trigger) {
        List<WorkflowTrigger> newTriggers = new ArrayList<>(triggers);
        newTriggers.add(trigger.withWorkflowId(id));
        return toBuilder()
            .triggers(newTriggers)
            .touch(updatedBy)
            .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder(create(null, null, WorkflowType.SEQUENTIAL, null, null));
    }

    public static class Builder {
        private UUID id;
        private String name;
        private String description;
        private WorkflowType type;
        private WorkflowStatus status;
        private WorkflowCategory category;
        private String version;
        private UUID ownerId;
        private List<WorkflowStep> steps;
        private List<WorkflowTrigger> triggers;
        private Map<String, Object> variables;
        private WorkflowConfig configuration;
        private List<String> tags;
        private boolean isActive;
        private boolean isTemplate;
        private Instant createdAt;
        private Instant updatedAt;
        private UUID createdBy;
        private UUID updatedBy;
        private long versionNum;

        public Builder(Workflow workflow) {
            this.id = workflow.id();
            this.name = workflow.name();
            this.description = workflow.description();
            this.type = workflow.type();
            this.status = workflow.status();
            this.category = workflow.category();
            this.version = workflow.version();
            this.ownerId = workflow.ownerId();
            this.steps = workflow.steps();
            this.triggers = workflow.triggers();
            this.variables = workflow.variables();
            this.configuration = workflow.configuration();
            this.tags = workflow.tags();
            this.isActive = workflow.isActive();
            this.isTemplate = workflow.isTemplate();
            this.createdAt = workflow.createdAt();
            this.updatedAt = workflow.updatedAt();
            this.createdBy = workflow.createdBy();
            this.updatedBy = workflow.updatedBy();
            this.versionNum = workflow.versionNum();
        }

        public Builder id(UUID id) {
            this.id = id;
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

        public Builder type(WorkflowType type) {
            this.type = type;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder category(WorkflowCategory category) {
            this.category = category;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder ownerId(UUID ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder triggers(List<WorkflowTrigger> triggers) {
            this.triggers = triggers;
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            this.variables = VariableMap.freeze(variables);
            return this;
        }

        public Builder configuration(WorkflowConfig configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder active(boolean isActive) {
            this.isActive = isActive;
            return this;
        }

        public Builder template(boolean isTemplate) {
            this.isTemplate = isTemplate;
            return this;
        }

        public Builder createdBy(UUID createdBy) {
            this.createdBy = createdBy;
            this.updatedBy = createdBy;
            return this;
        }

        /**
         * Record a modification: bumps the version number and audit fields.
         */
        public Builder touch(UUID by) {
            this.updatedBy = by;
            this.updatedAt = Instant.now();
            this.versionNum++;
            return this;
        }

        public Workflow build() {
            return new Workflow(
                id, name, description, type, status, category, version, ownerId,
                steps, triggers, variables, configuration, tags,
                isActive, isTemplate,
                createdAt, updatedAt, createdBy, updatedBy, versionNum
            );
        }
    }
}
