package com.taskflow.engine.coordinator;

import com.taskflow.core.model.*;
import com.taskflow.engine.support.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class TriggerDispatcherTest {

    private static final String ORDER_CREATED = "order.created";

    private EngineFixture engine;
    private TriggerDispatcher dispatcher;
    private final UUID owner = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        dispatcher = engine.triggerDispatcher();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private Workflow register(String name, WorkflowTrigger trigger, boolean activate) {
        Workflow workflow = Workflow.create(name, null, WorkflowType.SEQUENTIAL, owner, owner)
            .addStep(WorkflowStep.builder().name("noop").kind(StepKind.CONDITION).build())
            .addTrigger(trigger);
        engine.orchestrator().registerWorkflow(workflow);
        return activate ? engine.orchestrator().activateWorkflow(workflow.id(), owner) : workflow;
    }

    @Test
    @DisplayName("Every matching trigger starts its workflow with the event data")
    void startsMatchingWorkflows() {
        Workflow first = register("first", WorkflowTrigger.onEvent("t1", ORDER_CREATED, List.of()), true);
        Workflow second = register("second", WorkflowTrigger.onEvent("t2", ORDER_CREATED,
            List.of(WorkflowCondition.of("amount", ConditionOperator.GREATER_THAN, 100))), true);
        register("other event", WorkflowTrigger.onEvent("t3", "order.deleted", List.of()), true);

        List<WorkflowExecution> started = dispatcher.dispatch(ORDER_CREATED, Map.of("amount", 500), owner);

        assertThat(started)
            .extracting(WorkflowExecution::workflowId)
            .containsExactlyInAnyOrder(first.id(), second.id());
        assertThat(started).allSatisfy(execution -> {
            assertThat(execution.triggerId()).isNotNull();
            assertThat(execution.context()).containsEntry("amount", 500);
            assertThat(execution.executedBy()).isEqualTo(owner);
        });
    }

    @Test
    @DisplayName("All trigger conditions must hold")
    void conditionsAreAnded() {
        register("big eu orders", WorkflowTrigger.onEvent("t", ORDER_CREATED, List.of(
            WorkflowCondition.of("amount", ConditionOperator.GREATER_THAN, 100),
            WorkflowCondition.of("region", ConditionOperator.EQUALS, "eu"))), true);

        assertThat(dispatcher.dispatch(ORDER_CREATED, Map.of("amount", 500, "region", "us"), owner)).isEmpty();
        assertThat(dispatcher.dispatch(ORDER_CREATED, Map.of("amount", 500, "region", "eu"), owner)).hasSize(1);
    }

    @Test
    @DisplayName("Workflows that cannot run are skipped without failing the dispatch")
    void inactiveWorkflowSkipped() {
        register("draft", WorkflowTrigger.onEvent("t1", ORDER_CREATED, List.of()), false);
        Workflow active = register("active", WorkflowTrigger.onEvent("t2", ORDER_CREATED, List.of()), true);

        List<WorkflowExecution> started = dispatcher.dispatch(ORDER_CREATED, Map.of(), owner);

        assertThat(started).singleElement()
            .satisfies(execution -> assertThat(execution.workflowId()).isEqualTo(active.id()));
    }

    @Test
    @DisplayName("A trigger whose conditions cannot be evaluated is skipped")
    void badConditionSkipped() {
        register("bad", WorkflowTrigger.onEvent("t1", ORDER_CREATED,
            List.of(WorkflowCondition.of("amount", ConditionOperator.GREATER_THAN, 100))), true);
        register("good", WorkflowTrigger.onEvent("t2", ORDER_CREATED, List.of()), true);

        assertThat(dispatcher.dispatch(ORDER_CREATED, Map.of("amount", "lots"), owner)).hasSize(1);
    }

    @Test
    @DisplayName("An event nobody listens to starts nothing")
    void unknownEvent() {
        register("first", WorkflowTrigger.onEvent("t1", ORDER_CREATED, List.of()), true);

        assertThat(dispatcher.dispatch("invoice.paid", null, owner)).isEmpty();
    }
}
