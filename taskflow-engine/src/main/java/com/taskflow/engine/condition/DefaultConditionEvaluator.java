package com.taskflow.engine.condition;

import com.taskflow.core.exception.ConditionEvaluationException;
import com.taskflow.core.model.ConditionLogic;
import com.taskflow.core.model.WorkflowCondition;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed-operator condition evaluator.
 *
 * Numbers compare by value regardless of their boxed type, so {@code 1} equals {@code 1.0}.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    @Override
    public boolean evaluate(WorkflowCondition condition, Map<String, ?> context) {
        Object actual = context == null ? null : context.get(condition.field());
        Object expected = condition.value();

        return switch (condition.operator()) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case GREATER_THAN -> actual != null && compare(condition, actual, expected) > 0;
            case LESS_THAN -> actual != null && compare(condition, actual, expected) < 0;
            case CONTAINS -> contains(condition, actual, expected);
            case NOT_CONTAINS -> !contains(condition, actual, expected);
            case IN -> in(condition, actual, expected);
            case NOT_IN -> !in(condition, actual, expected);
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
        };
    }

    @Override
    public boolean evaluateAll(List<WorkflowCondition> conditions, ConditionLogic logic, Map<String, ?> context) {
        ConditionLogic effective = logic == null ? ConditionLogic.AND : logic;
        return switch (effective) {
            case AND -> allMatch(conditions, context);
            case OR -> {
                for (WorkflowCondition condition : conditions) {
                    if (evaluate(condition, context)) {
                        yield true;
                    }
                }
                yield false;
            }
            case NOT -> !allMatch(conditions, context);
        };
    }

    private boolean allMatch(List<WorkflowCondition> conditions, Map<String, ?> context) {
        for (WorkflowCondition condition : conditions) {
            if (!evaluate(condition, context)) {
                return false;
            }
        }
        return true;
    }

    // ========== Operators ==========

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings("unchecked")
    private int compare(WorkflowCondition condition, Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (actual instanceof String a && expected instanceof String b) {
            return a.compareTo(b);
        }
        // Same class on both sides, e.g. two Instants
        if (actual instanceof Comparable<?> && expected != null
                && actual.getClass().equals(expected.getClass())) {
            return ((Comparable<Object>) actual).compareTo(expected);
        }
        throw new ConditionEvaluationException(String.format(
            "Cannot apply %s to field '%s': %s and %s are not comparable",
            condition.operator().value(), condition.field(), typeName(actual), typeName(expected)));
    }

    private boolean contains(WorkflowCondition condition, Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof String text) {
            return text.contains(String.valueOf(expected));
        }
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> valuesEqual(element, expected));
        }
        if (actual instanceof Map<?, ?> map) {
            return map.containsKey(expected);
        }
        throw new ConditionEvaluationException(String.format(
            "Cannot apply %s to field '%s' of type %s",
            condition.operator().value(), condition.field(), typeName(actual)));
    }

    private boolean in(WorkflowCondition condition, Object actual, Object expected) {
        if (expected instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> valuesEqual(actual, element));
        }
        if (expected != null && expected.getClass().isArray()) {
            int length = Array.getLength(expected);
            for (int i = 0; i < length; i++) {
                if (valuesEqual(actual, Array.get(expected, i))) {
                    return true;
                }
            }
            return false;
        }
        if (expected instanceof String text) {
            return text.contains(String.valueOf(actual));
        }
        throw new ConditionEvaluationException(String.format(
            "Cannot apply %s to field '%s': expected value of type %s is not a collection",
            condition.operator().value(), condition.field(), typeName(expected)));
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    private static int compareNumbers(Number a, Number b) {
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
