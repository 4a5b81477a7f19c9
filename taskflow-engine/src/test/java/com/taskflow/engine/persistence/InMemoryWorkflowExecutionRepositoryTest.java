package com.taskflow.engine.persistence;

import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.exception.OptimisticLockException;
import com.taskflow.core.model.ExecutionStatus;
import com.taskflow.core.model.WorkflowExecution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemoryWorkflowExecutionRepositoryTest {

    private final InMemoryWorkflowExecutionRepository repository = new InMemoryWorkflowExecutionRepository();
    private final UUID workflowId = UUID.randomUUID();

    private WorkflowExecution newExecution() {
        return WorkflowExecution.create(workflowId, null, UUID.randomUUID(), Map.of(), Map.of());
    }

    @Test
    @DisplayName("A newer copy replaces the stored one")
    void updateWithNewerCopy() {
        WorkflowExecution pending = newExecution();
        repository.save(pending);

        WorkflowExecution running = pending.start(null);
        repository.update(running);

        assertThat(repository.findById(pending.id())).contains(running);
    }

    @Test
    @DisplayName("A stale copy is rejected")
    void staleUpdateRejected() {
        WorkflowExecution pending = newExecution();
        repository.save(pending);
        WorkflowExecution running = pending.start(null);
        repository.update(running);

        // Another writer derived its copy from the same pending state
        WorkflowExecution cancelled = pending.cancel("stale");

        assertThatThrownBy(() -> repository.update(cancelled))
            .isInstanceOf(OptimisticLockException.class);
        assertThat(repository.findById(pending.id()).orElseThrow().status()).isEqualTo(ExecutionStatus.RUNNING);
    }

    @Test
    @DisplayName("Saving twice or updating an unknown execution fails")
    void saveAndUpdatePreconditions() {
        WorkflowExecution execution = newExecution();
        repository.save(execution);

        assertThatThrownBy(() -> repository.save(execution)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repository.update(newExecution().start(null)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Queries filter by workflow and status")
    void queries() {
        WorkflowExecution first = newExecution();
        WorkflowExecution second = newExecution();
        WorkflowExecution elsewhere = WorkflowExecution.create(UUID.randomUUID(), null, null, Map.of(), Map.of());
        repository.save(first);
        repository.save(second);
        repository.save(elsewhere);
        repository.update(second.start(null));

        assertThat(repository.findByWorkflow(workflowId))
            .extracting(WorkflowExecution::id)
            .containsExactlyInAnyOrder(first.id(), second.id());
        assertThat(repository.findByStatus(ExecutionStatus.PENDING, 10)).hasSize(2);
        assertThat(repository.findByStatus(ExecutionStatus.PENDING, 1)).hasSize(1);
        assertThat(repository.countByStatus(workflowId))
            .containsEntry(ExecutionStatus.PENDING, 1L)
            .containsEntry(ExecutionStatus.RUNNING, 1L);
    }
}
