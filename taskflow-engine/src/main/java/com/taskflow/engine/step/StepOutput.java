package com.taskflow.engine.step;

import com.taskflow.core.model.VariableMap;

import java.util.Map;
import java.util.UUID;

/**
 * What a step handler produced: either a finished output or a request to wait.
 */
public record StepOutput(Map<String, Object> values, boolean waiting, UUID assignee) {

    public StepOutput {
        values = VariableMap.freeze(values);
    }

    public static StepOutput completed(Map<String, ?> values) {
        return new StepOutput(VariableMap.freeze(values), false, null);
    }

    /**
     * The step suspends until an external decision arrives for the given assignee.
     */
    public static StepOutput waitingFor(UUID assignee, Map<String, ?> values) {
        return new StepOutput(VariableMap.freeze(values), true, assignee);
    }
}
