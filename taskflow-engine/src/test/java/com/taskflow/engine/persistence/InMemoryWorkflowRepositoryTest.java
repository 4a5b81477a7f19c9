package com.taskflow.engine.persistence;

import com.taskflow.core.exception.OptimisticLockException;
import com.taskflow.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemoryWorkflowRepositoryTest {

    private final InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository();
    private final UUID owner = UUID.randomUUID();

    private Workflow workflow(String name, String event) {
        return Workflow.create(name, null, WorkflowType.SEQUENTIAL, owner, owner)
            .addStep(WorkflowStep.builder().name("s").kind(StepKind.TASK).build())
            .addTrigger(WorkflowTrigger.onEvent(name + " trigger", event, List.of()));
    }

    @Test
    @DisplayName("Updates from an outdated definition are rejected")
    void versionCheck() {
        Workflow draft = workflow("w", "e");
        repository.save(draft);
        repository.update(draft.activate(owner));

        assertThatThrownBy(() -> repository.update(draft.deactivate(owner)))
            .isInstanceOf(OptimisticLockException.class);
        assertThat(repository.findById(draft.id()).orElseThrow().status()).isEqualTo(WorkflowStatus.ACTIVE);
    }

    @Test
    @DisplayName("Triggers are found by event across workflows")
    void triggersByEvent() {
        Workflow first = workflow("first", "order.created");
        Workflow second = workflow("second", "order.created");
        repository.save(first);
        repository.save(second);
        repository.save(workflow("third", "order.deleted"));

        assertThat(repository.findTriggersByEvent("order.created"))
            .extracting(WorkflowTrigger::workflowId)
            .containsExactlyInAnyOrder(first.id(), second.id());
        assertThat(repository.findTriggersByEvent("nothing")).isEmpty();
    }

    @Test
    @DisplayName("Inactive triggers are not found")
    void inactiveTrigger() {
        Workflow workflow = Workflow.create("w", null, WorkflowType.SEQUENTIAL, owner, owner)
            .addTrigger(WorkflowTrigger.onEvent("t", "order.created", List.of()).withActive(false));
        repository.save(workflow);

        assertThat(repository.findTriggersByEvent("order.created")).isEmpty();
    }
}
