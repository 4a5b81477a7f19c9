package com.taskflow.engine.action;

import com.taskflow.core.exception.VariableResolutionException;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{name}}} references in action targets and parameters.
 *
 * A string that is exactly one reference resolves to the variable's value with its type kept;
 * references embedded in longer text are substituted as strings.
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final VariableMap variables;

    public VariableResolver(VariableMap variables) {
        this.variables = variables;
    }

    /**
     * Copy of the action with target and parameters resolved.
     *
     * @throws VariableResolutionException if a referenced variable is absent
     */
    public WorkflowAction resolve(WorkflowAction action) {
        String target = action.target() != null ? resolveString(action.target()) : null;
        return WorkflowAction.of(action.type(), target, resolveMap(action.parameters()));
    }

    public String resolveString(String template) {
        Object resolved = resolveValue(template);
        return resolved == null ? null : resolved.toString();
    }

    Object resolveValue(Object value) {
        if (value instanceof String template) {
            return resolveTemplate(template);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((key, nested) -> resolved.put(String.valueOf(key), resolveValue(nested)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(nested -> resolved.add(resolveValue(nested)));
            return resolved;
        }
        return value;
    }

    private Map<String, Object> resolveMap(Map<String, Object> parameters) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        parameters.forEach((key, value) -> resolved.put(key, resolveValue(value)));
        return resolved;
    }

    private Object resolveTemplate(String template) {
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        if (matcher.matches()) {
            return lookup(matcher.group(1).trim());
        }

        matcher.reset();
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = lookup(matcher.group(1).trim());
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private Object lookup(String name) {
        Object value = variables.get(name);
        if (value == null) {
            throw new VariableResolutionException(name);
        }
        return value;
    }
}
