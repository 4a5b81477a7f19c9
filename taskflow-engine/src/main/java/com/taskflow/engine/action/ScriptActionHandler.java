package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.ConditionOperator;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.model.WorkflowCondition;
import com.taskflow.engine.condition.ConditionEvaluator;

import java.util.Map;

/**
 * Sandboxed script: a single condition ({@code field}, {@code operator}, {@code value})
 * evaluated against the execution variables. The result is stored under the target name,
 * or {@code script_result}.
 */
public class ScriptActionHandler implements ActionHandler {

    static final String DEFAULT_RESULT_KEY = "script_result";

    private final ConditionEvaluator conditionEvaluator;

    public ScriptActionHandler(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public ActionType type() {
        return ActionType.SCRIPT;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        VariableMap params = action.params();
        String field = params.string("field")
            .orElseThrow(() -> new ActionExecutionException(type(), "parameter 'field' is required", false));
        String operatorName = params.string("operator")
            .orElseThrow(() -> new ActionExecutionException(type(), "parameter 'operator' is required", false));

        ConditionOperator operator;
        try {
            operator = ConditionOperator.fromValue(operatorName);
        } catch (IllegalArgumentException e) {
            throw new ActionExecutionException(type(), e.getMessage(), false);
        }

        boolean result = conditionEvaluator.evaluate(
            WorkflowCondition.of(field, operator, params.get("value")),
            context.variables().asMap());

        String key = action.hasTarget() ? action.target() : DEFAULT_RESULT_KEY;
        return Map.of(key, result);
    }
}
