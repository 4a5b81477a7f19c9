package com.taskflow.engine.step;

import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.engine.action.ActionDispatcher;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the step's actions in order.
 *
 * Each action sees the execution variables plus the output of the actions before it,
 * so a {@code create_task} followed by {@code assign_task} can reference {@code {{task_id}}}.
 * The first failing action fails the step.
 */
public class ActionStepHandler implements StepHandler {

    private final ActionDispatcher actionDispatcher;

    public ActionStepHandler(ActionDispatcher actionDispatcher) {
        this.actionDispatcher = actionDispatcher;
    }

    @Override
    public StepOutput execute(StepContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        for (WorkflowAction action : context.step().actions()) {
            context.cancellationToken().throwIfCancelled();
            VariableMap visible = context.variables().merge(output);
            output.putAll(actionDispatcher.execute(action, context.actionContext(visible)));
        }
        return StepOutput.completed(output);
    }
}
