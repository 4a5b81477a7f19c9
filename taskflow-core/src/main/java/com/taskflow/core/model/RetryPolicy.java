package com.taskflow.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How often a failed step is attempted again and how long to wait in between.
 *
 * Workflows configure a fixed delay; steps may turn it into a growing one with
 * {@link #withBackoff(double, Duration)} and {@link #withJitter(double)}, and narrow which
 * error codes are retried with {@link #withErrorCodes(Set, Set)}.
 *
 * Invariants:
 * - maxAttempts >= 1 (the first attempt counts)
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    /**
     * Ceiling for a growing delay when the step names none.
     */
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofHours(1);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            initialBackoff = Duration.ZERO;
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoff multiplier must be >= 1.0, got " + backoffMultiplier);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitter factor must be within [0.0, 1.0], got " + jitterFactor);
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    public static RetryPolicy noRetry() {
        return fixed(1, Duration.ZERO);
    }

    /**
     * Constant delay between attempts. This is what workflow configuration produces.
     */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, delay, 1.0, 0.0, Set.of(), Set.of());
    }

    // ========== Copies ==========

    /**
     * Copy whose delay grows by {@code multiplier} after every failed attempt, up to {@code maxDelay}
     * ({@link #DEFAULT_MAX_BACKOFF} when null).
     */
    public RetryPolicy withBackoff(double multiplier, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxDelay != null ? maxDelay : DEFAULT_MAX_BACKOFF,
            multiplier, jitterFactor, retryableErrors, nonRetryableErrors);
    }

    /**
     * Copy that spreads each delay uniformly by plus or minus {@code factor} of itself.
     */
    public RetryPolicy withJitter(double factor) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff,
            backoffMultiplier, factor, retryableErrors, nonRetryableErrors);
    }

    /**
     * Copy restricted to the given error codes. An empty {@code retryOn} retries every code
     * not listed in {@code neverRetryOn}.
     */
    public RetryPolicy withErrorCodes(Set<String> retryOn, Set<String> neverRetryOn) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff,
            backoffMultiplier, jitterFactor, retryOn, neverRetryOn);
    }

    /**
     * Copy whose attempt count does not exceed the given ceiling.
     */
    public RetryPolicy cappedAt(int maxAttemptsCeiling) {
        if (maxAttempts <= maxAttemptsCeiling) {
            return this;
        }
        return new RetryPolicy(Math.max(1, maxAttemptsCeiling), initialBackoff, maxBackoff,
            backoffMultiplier, jitterFactor, retryableErrors, nonRetryableErrors);
    }

    // ========== Decisions ==========

    /**
     * Delay before the attempt following {@code failedAttempt}.
     *
     * @param failedAttempt 1-indexed number of the attempt that just failed
     */
    public Duration computeBackoff(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("attempt numbers start at 1, got " + failedAttempt);
        }
        long ceiling = maxBackoff.toMillis();
        double grown = initialBackoff.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        long delay = grown >= ceiling ? ceiling : (long) grown;

        if (jitterFactor > 0.0 && delay > 0) {
            long spread = (long) (delay * jitterFactor);
            delay += ThreadLocalRandom.current().nextLong(-spread, spread + 1);
        }
        return Duration.ofMillis(delay);
    }

    public boolean shouldRetry(String errorCode) {
        if (nonRetryableErrors.contains(errorCode)) {
            return false;
        }
        return retryableErrors.isEmpty() || retryableErrors.contains(errorCode);
    }

    /**
     * @param currentAttempt 1-indexed number of the attempt that just ran
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }
}
