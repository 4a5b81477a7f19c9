package com.taskflow.engine.coordinator;

import com.taskflow.core.exception.ExecutionCancelledException;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for one execution run.
 * Every suspension inside a run (wait steps, delay actions, retry backoff) goes through
 * {@link #sleep(Duration)} so that cancelling wakes it immediately.
 */
public final class CancellationToken {

    private final UUID executionId;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public CancellationToken(UUID executionId) {
        this.executionId = executionId;
    }

    /**
     * Token that is never cancelled, for callers outside a supervised run.
     */
    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public UUID executionId() {
        return executionId;
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason;
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    /**
     * @throws ExecutionCancelledException if cancellation has been requested
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new ExecutionCancelledException(executionId);
        }
    }

    /**
     * Suspend for the given duration unless cancelled first.
     *
     * @throws ExecutionCancelledException if cancelled before or during the wait
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new ExecutionCancelledException(executionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(executionId);
        }
    }
}
