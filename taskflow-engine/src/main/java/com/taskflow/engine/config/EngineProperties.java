package com.taskflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the workflow engine.
 *
 * <pre>
 * taskflow:
 *   engine:
 *     execution-threads: 8
 *     step-threads: 16
 *     max-retry-attempts: 10
 *     shutdown-timeout: 30s
 * </pre>
 *
 * @param executionThreads Threads running executions
 * @param stepThreads Threads running the steps of parallel batches
 * @param maxRetryAttempts Upper bound on retries of a single step, whatever the workflow asks for
 * @param shutdownTimeout How long shutdown waits for live runs
 */
@ConfigurationProperties(prefix = "taskflow.engine")
public record EngineProperties(
    int executionThreads,
    int stepThreads,
    Integer maxRetryAttempts,
    Duration shutdownTimeout
) {
    public static final int DEFAULT_EXECUTION_THREADS = 8;
    public static final int DEFAULT_STEP_THREADS = 16;
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 10;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public EngineProperties {
        executionThreads = executionThreads > 0 ? executionThreads : DEFAULT_EXECUTION_THREADS;
        stepThreads = stepThreads > 0 ? stepThreads : DEFAULT_STEP_THREADS;
        if (maxRetryAttempts == null) {
            maxRetryAttempts = DEFAULT_MAX_RETRY_ATTEMPTS;
        } else if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("taskflow.engine.max-retry-attempts must be >= 0");
        }
        shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
    }

    public static EngineProperties defaults() {
        return new EngineProperties(0, 0, null, null);
    }
}
