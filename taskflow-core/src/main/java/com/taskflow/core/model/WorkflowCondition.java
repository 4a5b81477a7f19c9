package com.taskflow.core.model;

/**
 * A single predicate over one context field.
 * {@code value} is ignored by the unary operators.
 */
public record WorkflowCondition(
    String field,
    ConditionOperator operator,
    Object value,
    ConditionLogic logic
) {
    public WorkflowCondition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Condition field must not be blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Condition operator must not be null");
        }
        if (logic == null) {
            logic = ConditionLogic.AND;
        }
    }

    public static WorkflowCondition of(String field, ConditionOperator operator, Object value) {
        return new WorkflowCondition(field, operator, value, ConditionLogic.AND);
    }

    public static WorkflowCondition of(String field, ConditionOperator operator) {
        return new WorkflowCondition(field, operator, null, ConditionLogic.AND);
    }
}
