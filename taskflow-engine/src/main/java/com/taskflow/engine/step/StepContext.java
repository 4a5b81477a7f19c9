package com.taskflow.engine.step;

import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.Workflow;
import com.taskflow.core.model.WorkflowStep;
import com.taskflow.engine.action.ActionContext;
import com.taskflow.engine.coordinator.CancellationToken;

import java.util.UUID;

/**
 * Input of one step attempt.
 *
 * @param variables snapshot of the execution variables taken when the attempt was scheduled
 * @param attempt 1-based attempt number
 */
public record StepContext(
    UUID executionId,
    Workflow workflow,
    WorkflowStep step,
    UUID executedBy,
    VariableMap variables,
    int attempt,
    CancellationToken cancellationToken
) {
    public StepContext {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        variables = variables == null ? VariableMap.empty() : variables;
        cancellationToken = cancellationToken == null ? CancellationToken.none() : cancellationToken;
    }

    public ActionContext actionContext(VariableMap actionVariables) {
        return new ActionContext(executionId, workflow.id(), step.id(), executedBy,
            actionVariables, cancellationToken);
    }
}
