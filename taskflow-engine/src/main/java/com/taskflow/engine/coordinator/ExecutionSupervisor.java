package com.taskflow.engine.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Owns the threads that run executions.
 *
 * Runs go to the execution pool. Parallel step batches go to a separate step pool, so a run
 * joining its batch never waits on a thread of its own pool. The handle map tracks the latest
 * run of each execution; a resumed execution replaces the handle of the run that paused it.
 */
public class ExecutionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    private final ExecutorService executionPool;
    private final ExecutorService stepPool;
    private final Map<UUID, ExecutionHandle> handles = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public ExecutionSupervisor(int executionThreads, int stepThreads) {
        this.executionPool = Executors.newFixedThreadPool(executionThreads, namedThreads("taskflow-exec-"));
        this.stepPool = Executors.newFixedThreadPool(stepThreads, namedThreads("taskflow-step-"));
    }

    /**
     * Submit a run for an execution.
     *
     * @param executionId The execution
     * @param run The run body; receives the token that cancels it
     * @return Handle of the submitted run
     * @throws IllegalStateException if the supervisor is shutting down
     */
    public ExecutionHandle submit(UUID executionId, Consumer<CancellationToken> run) {
        if (!accepting.get()) {
            throw new IllegalStateException("Cannot accept new executions during shutdown");
        }
        CancellationToken token = new CancellationToken(executionId);
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                run.accept(token);
            } finally {
                handles.computeIfPresent(executionId, (id, h) -> h.token() == token ? null : h);
            }
            return null;
        });
        ExecutionHandle handle = new ExecutionHandle(executionId, task, token);

        ExecutionHandle previous = handles.put(executionId, handle);
        if (previous != null && !previous.isDone()) {
            // The pausing run has written its last state and is only unwinding
            log.debug("Execution {} resubmitted while its previous run was finishing", executionId);
        }
        try {
            executionPool.execute(task);
        } catch (RejectedExecutionException e) {
            handles.remove(executionId, handle);
            throw new IllegalStateException("Cannot accept new executions during shutdown", e);
        }
        log.debug("Submitted run for execution {}", executionId);
        return handle;
    }

    /**
     * Signal the live run of an execution to stop.
     *
     * @return true if a live run was signalled
     */
    public boolean cancel(UUID executionId, String reason) {
        ExecutionHandle handle = handles.get(executionId);
        if (handle == null || handle.isDone()) {
            return false;
        }
        handle.token().cancel(reason);
        log.info("Cancellation requested for execution {}: {}", executionId, reason);
        return true;
    }

    public Optional<ExecutionHandle> handle(UUID executionId) {
        return Optional.ofNullable(handles.get(executionId));
    }

    public int activeCount() {
        return handles.size();
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    /**
     * Pool for steps of a parallel batch.
     */
    public ExecutorService stepPool() {
        return stepPool;
    }

    /**
     * Stop accepting runs, cancel the live ones and wait for the pools to drain.
     */
    public void shutdown(Duration timeout) {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down with {} live executions (timeout: {}s)", handles.size(), timeout.toSeconds());
        handles.values().forEach(h -> h.token().cancel("engine shutdown"));

        executionPool.shutdown();
        stepPool.shutdown();
        try {
            long deadline = System.nanoTime() + timeout.toNanos();
            if (!executionPool.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("Execution pool did not drain in time, interrupting {} runs", handles.size());
                executionPool.shutdownNow();
            }
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!stepPool.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                stepPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            executionPool.shutdownNow();
            stepPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Execution supervisor stopped");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
