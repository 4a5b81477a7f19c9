package com.taskflow.engine.step;

/**
 * Behavior of one step kind. Gating conditions have already passed when a handler runs.
 */
public interface StepHandler {

    /**
     * @throws com.taskflow.core.exception.StepExecutionException on a failure the runner may retry or not
     * @throws com.taskflow.core.exception.ExecutionCancelledException if the run is cancelled while suspended
     */
    StepOutput execute(StepContext context);
}
