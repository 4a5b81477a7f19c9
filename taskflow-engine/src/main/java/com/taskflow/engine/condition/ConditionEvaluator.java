package com.taskflow.engine.condition;

import com.taskflow.core.model.ConditionLogic;
import com.taskflow.core.model.WorkflowCondition;
import java.util.List;
import java.util.Map;

/**
 * Evaluates conditions against a context mapping.
 * Implementations must be pure: same inputs, same result, no side effects.
 */
public interface ConditionEvaluator {

    /**
     * Evaluate one condition.
     *
     * @param condition The condition
     * @param context Values by field name; a missing field reads as null
     * @return Whether the condition holds
     * @throws com.taskflow.core.exception.ConditionEvaluationException if the operator cannot be applied to the values
     */
    boolean evaluate(WorkflowCondition condition, Map<String, ?> context);

    /**
     * Combine several conditions.
     * AND over an empty list is true, OR over an empty list is false, NOT negates the AND.
     */
    boolean evaluateAll(List<WorkflowCondition> conditions, ConditionLogic logic, Map<String, ?> context);
}
