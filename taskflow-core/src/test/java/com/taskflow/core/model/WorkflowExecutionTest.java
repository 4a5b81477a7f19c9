package com.taskflow.core.model;

import com.taskflow.core.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowExecutionTest {

    private WorkflowExecution pending() {
        return WorkflowExecution.create(UUID.randomUUID(), null, UUID.randomUUID(),
            Map.of("source", "api"), Map.of("source", "api"));
    }

    @Test
    void create_shouldStartPendingWithZeroSequence() {
        WorkflowExecution execution = pending();

        assertEquals(ExecutionStatus.PENDING, execution.status());
        assertEquals(0L, execution.sequenceNumber());
        assertNull(execution.startedAt());
    }

    @Test
    void start_shouldStampStartAndDeadline() {
        Instant deadline = Instant.now().plusSeconds(60);

        WorkflowExecution running = pending().start(deadline);

        assertEquals(ExecutionStatus.RUNNING, running.status());
        assertNotNull(running.startedAt());
        assertEquals(deadline, running.deadline());
        assertTrue(running.sequenceNumber() > 0);
    }

    @Test
    void everyCopy_shouldIncrementSequence() {
        WorkflowExecution running = pending().start(null);

        WorkflowExecution progressed = running.withProgress(Map.of("x", 1), UUID.randomUUID(), List.of());
        WorkflowExecution retried = progressed.withRetryIncremented();

        assertTrue(progressed.sequenceNumber() > running.sequenceNumber());
        assertTrue(retried.sequenceNumber() > progressed.sequenceNumber());
        assertEquals(1, retried.retryCount());
    }

    @Test
    void fail_shouldRecordErrorAndTimestamp() {
        WorkflowExecution failed = pending().start(null).fail("boom");

        assertEquals(ExecutionStatus.FAILED, failed.status());
        assertEquals("boom", failed.errorMessage());
        assertNotNull(failed.failedAt());
        assertTrue(failed.isTerminal());
    }

    @Test
    void pauseAndResume_shouldRoundTripFrontier() {
        UUID next = UUID.randomUUID();
        UUID awaiting = UUID.randomUUID();

        WorkflowExecution paused = pending().start(null).pause(List.of(next), List.of(awaiting));
        WorkflowExecution resumed = paused.resume();

        assertEquals(List.of(next), paused.pendingStepIds());
        assertEquals(List.of(awaiting), paused.awaitingStepIds());
        assertEquals(ExecutionStatus.RUNNING, resumed.status());
        assertEquals(List.of(next), resumed.pendingStepIds());
        assertTrue(resumed.awaitingStepIds().isEmpty());
    }

    @Test
    void terminalExecution_shouldRejectFurtherTransitions() {
        WorkflowExecution completed = pending().start(null).complete();

        assertThrows(InvalidStateTransitionException.class, () -> completed.fail("late"));
        assertThrows(InvalidStateTransitionException.class, () -> completed.cancel("late"));
        assertThrows(InvalidStateTransitionException.class, completed::resume);
    }

    @Test
    void pending_shouldNotCompleteDirectly() {
        assertThrows(InvalidStateTransitionException.class, () -> pending().complete());
    }

    @Test
    void isDeadlineExceeded_shouldCompareAgainstDeadline() {
        WorkflowExecution running = pending().start(Instant.now().minusSeconds(1));

        assertTrue(running.isDeadlineExceeded(Instant.now()));
        assertFalse(pending().start(null).isDeadlineExceeded(Instant.now()));
    }

    @Test
    void stepExecution_shouldFollowItsStateMachine() {
        WorkflowStep step = WorkflowStep.builder().name("approve").kind(StepKind.APPROVAL).build();
        StepExecution record = StepExecution.start(UUID.randomUUID(), step, Map.of(), 0);
        UUID approver = UUID.randomUUID();

        StepExecution waiting = record.withWaiting(approver, Map.of());
        StepExecution approved = waiting.withCompleted(Map.of("approved", true));

        assertEquals(StepExecutionStatus.WAITING, waiting.status());
        assertEquals(approver, approved.assignedTo());
        assertEquals(true, approved.output().get("approved"));
        assertThrows(InvalidStateTransitionException.class, approved::withSkipped);
    }
}
