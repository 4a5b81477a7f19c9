package com.taskflow.engine.coordinator;

import com.taskflow.core.exception.ConditionEvaluationException;
import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.exception.WorkflowNotExecutableException;
import com.taskflow.core.model.ConditionLogic;
import com.taskflow.core.model.WorkflowExecution;
import com.taskflow.core.model.WorkflowTrigger;
import com.taskflow.core.repository.WorkflowRepository;
import com.taskflow.engine.condition.ConditionEvaluator;
import com.taskflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Starts the workflows whose triggers listen to an incoming event.
 *
 * A trigger fires when all of its conditions hold against the event data. A trigger whose
 * workflow cannot run, or whose conditions cannot be evaluated, is skipped without affecting
 * the others.
 */
public class TriggerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TriggerDispatcher.class);

    private final WorkflowRepository workflowRepository;
    private final ConditionEvaluator conditionEvaluator;
    private final WorkflowService workflowService;

    public TriggerDispatcher(
            WorkflowRepository workflowRepository,
            ConditionEvaluator conditionEvaluator,
            WorkflowService workflowService) {
        this.workflowRepository = workflowRepository;
        this.conditionEvaluator = conditionEvaluator;
        this.workflowService = workflowService;
    }

    /**
     * Dispatch an event.
     *
     * @param eventName The event name
     * @param eventData Data of the event; becomes the trigger data of started executions
     * @param triggeredBy The user on whose behalf the event arrived
     * @return Executions started, in trigger order
     */
    public List<WorkflowExecution> dispatch(String eventName, Map<String, ?> eventData, UUID triggeredBy) {
        Map<String, ?> data = eventData != null ? eventData : Map.of();
        List<WorkflowTrigger> triggers = workflowRepository.findTriggersByEvent(eventName);
        log.debug("Event {} matched {} triggers", eventName, triggers.size());

        List<WorkflowExecution> started = new ArrayList<>();
        for (WorkflowTrigger trigger : triggers) {
            if (!matches(trigger, data)) {
                continue;
            }
            try {
                started.add(workflowService.startWorkflow(trigger.workflowId(), trigger.id(), triggeredBy, data));
                log.info("Trigger '{}' started workflow {} on event {}", trigger.name(), trigger.workflowId(), eventName);
            } catch (WorkflowNotExecutableException | NotFoundException e) {
                log.warn("Trigger '{}' skipped: {}", trigger.name(), e.getMessage());
            }
        }
        return started;
    }

    private boolean matches(WorkflowTrigger trigger, Map<String, ?> data) {
        try {
            return conditionEvaluator.evaluateAll(trigger.conditions(), ConditionLogic.AND, data);
        } catch (ConditionEvaluationException e) {
            log.warn("Trigger '{}' conditions could not be evaluated: {}", trigger.name(), e.getMessage());
            return false;
        }
    }
}
