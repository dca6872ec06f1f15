package com.soarsentinel.core.playbook;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the {@link PlaybookExecutor}.
 */
public final class ExecutorSettings {

    /** Upper bound of the backoff between step retries. */
    public static final Duration MAX_RETRY_BACKOFF = Duration.ofSeconds(10);

    private final Duration defaultStepTimeout;
    private final Duration retryBackoff;

    /**
     * @param defaultStepTimeout deadline for steps without {@code timeoutMs}
     * @param retryBackoff       base delay before the first step retry
     * @throws IllegalArgumentException if a duration is not positive
     */
    public ExecutorSettings(Duration defaultStepTimeout, Duration retryBackoff) {
        this.defaultStepTimeout = requirePositive(defaultStepTimeout, "defaultStepTimeout");
        this.retryBackoff = requirePositive(retryBackoff, "retryBackoff");
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(Duration.ofSeconds(30), Duration.ofSeconds(1));
    }

    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    /**
     * @param failedAttempts number of attempts that have failed so far (1-based)
     * @return {@code min(base * 2^(failedAttempts-1), 10s)}
     */
    public Duration backoffAfter(int failedAttempts) {
        int exponent = Math.min(Math.max(failedAttempts - 1, 0), 20);
        Duration delay = retryBackoff.multipliedBy(1L << exponent);
        return delay.compareTo(MAX_RETRY_BACKOFF) > 0 ? MAX_RETRY_BACKOFF : delay;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ExecutorSettings{defaultStepTimeout=" + defaultStepTimeout
                + ", retryBackoff=" + retryBackoff + '}';
    }
}
