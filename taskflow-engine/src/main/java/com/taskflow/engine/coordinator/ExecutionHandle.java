package com.taskflow.engine.coordinator;

import java.util.UUID;
import java.util.concurrent.Future;

/**
 * A run owned by the {@link ExecutionSupervisor}.
 */
public record ExecutionHandle(UUID executionId, Future<?> future, CancellationToken token) {

    public boolean isDone() {
        return future.isDone();
    }
}
