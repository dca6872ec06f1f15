package com.soarsentinel.core.trigger;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the {@link TriggerEngine}.
 */
public final class TriggerEngineSettings {

    private final String consumerGroup;
    private final int workers;
    private final Duration pollInterval;

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public TriggerEngineSettings(String consumerGroup, int workers, Duration pollInterval) {
        if (consumerGroup == null || consumerGroup.isBlank()) {
            throw new IllegalArgumentException("consumerGroup must not be null or blank");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got: " + workers);
        }
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
        this.consumerGroup = consumerGroup;
        this.workers = workers;
        this.pollInterval = pollInterval;
    }

    public static TriggerEngineSettings defaults() {
        return new TriggerEngineSettings("playbook-trigger-engine", 5, Duration.ofSeconds(2));
    }

    public String getConsumerGroup() {
        return consumerGroup;
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    @Override
    public String toString() {
        return "TriggerEngineSettings{consumerGroup='" + consumerGroup + "', workers=" + workers
                + ", pollInterval=" + pollInterval + '}';
    }
}
