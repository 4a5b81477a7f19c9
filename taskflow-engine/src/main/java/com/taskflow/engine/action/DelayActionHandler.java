package com.taskflow.engine.action;

import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.Durations;
import com.taskflow.core.model.WorkflowAction;

import java.time.Duration;
import java.util.Map;

/**
 * Suspends the calling run for {@code duration}; wakes early with
 * {@link com.taskflow.core.exception.ExecutionCancelledException} if the run is cancelled.
 */
public class DelayActionHandler implements ActionHandler {

    @Override
    public ActionType type() {
        return ActionType.DELAY;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        Duration duration = action.params().duration("duration").orElse(Duration.ZERO);
        context.cancellationToken().sleep(duration);
        return Map.of("delayed", Durations.format(duration));
    }
}
