package com.taskflow.engine.step;

import java.util.Map;

/**
 * Routing node. Its gate has already passed when it runs.
 */
public class ConditionStepHandler implements StepHandler {

    @Override
    public StepOutput execute(StepContext context) {
        return StepOutput.completed(Map.of("condition_met", true));
    }
}
