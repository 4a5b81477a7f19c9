package com.taskflow.engine.step;

import com.taskflow.core.model.Durations;

import java.time.Duration;
import java.util.Map;

/**
 * Suspends the run for the configured {@code duration}. Cancellation wakes it.
 */
public class WaitStepHandler implements StepHandler {

    @Override
    public StepOutput execute(StepContext context) {
        Duration duration = context.step().config().duration("duration").orElse(Duration.ZERO);
        context.cancellationToken().sleep(duration);
        return StepOutput.completed(Map.of("waited_duration", Durations.format(duration)));
    }
}
