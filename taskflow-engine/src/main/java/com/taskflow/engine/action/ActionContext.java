package com.taskflow.engine.action;

import com.taskflow.core.model.VariableMap;
import com.taskflow.engine.coordinator.CancellationToken;

import java.util.UUID;

/**
 * What an action can see of the run that invokes it.
 *
 * @param variables snapshot of the execution variables; never mutated by handlers
 */
public record ActionContext(
    UUID executionId,
    UUID workflowId,
    UUID stepId,
    UUID executedBy,
    VariableMap variables,
    CancellationToken cancellationToken
) {
    public ActionContext {
        variables = variables == null ? VariableMap.empty() : variables;
        cancellationToken = cancellationToken == null ? CancellationToken.none() : cancellationToken;
    }

    /**
     * Context for invoking an action outside an execution, e.g. from tests or tools.
     */
    public static ActionContext standalone(VariableMap variables) {
        return new ActionContext(null, null, null, null, variables, CancellationToken.none());
    }
}
