package com.soarsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a playbook: an action invocation with templated inputs, an
 * optional guard condition, an error policy and an optional deadline.
 *
 * <p>
 * Steps are immutable once the playbook is versioned.
 * </p>
 *
 * @since 1.0.0
 */
public final class PlaybookStep {

    private final int sequence;
    private final String stepKey;
    private final String actionId;
    private final String condition;
    private final Map<String, Object> inputs;
    private final StepErrorPolicy onError;
    private final Long timeoutMs;
    private final int retries;

    private PlaybookStep(Builder b) {
        this.sequence = b.sequence;
        this.stepKey = requireNonBlank(b.stepKey, "stepKey");
        this.actionId = requireNonBlank(b.actionId, "actionId");
        this.condition = b.condition != null && !b.condition.isBlank() ? b.condition.trim() : null;
        this.inputs = b.inputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.inputs))
                : Map.of();
        this.onError = b.onError != null ? b.onError : StepErrorPolicy.ABORT;
        if (b.timeoutMs != null && b.timeoutMs <= 0) {
            throw new IllegalArgumentException(
                    "timeoutMs must be > 0 for step '" + stepKey + "', got: " + b.timeoutMs);
        }
        this.timeoutMs = b.timeoutMs;
        if (b.retries < 0) {
            throw new IllegalArgumentException(
                    "retries must be >= 0 for step '" + stepKey + "', got: " + b.retries);
        }
        this.retries = b.retries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getSequence() {
        return sequence;
    }

    public String getStepKey() {
        return stepKey;
    }

    public String getActionId() {
        return actionId;
    }

    /**
     * @return guard condition, or {@code null} if the step always runs
     */
    public String getCondition() {
        return condition;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public StepErrorPolicy getOnError() {
        return onError;
    }

    /**
     * @return the step deadline, or {@code null} to use the executor default
     */
    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public int getRetries() {
        return retries;
    }

    public static class Builder {
        private int sequence;
        private String stepKey;
        private String actionId;
        private String condition;
        private Map<String, Object> inputs;
        private StepErrorPolicy onError;
        private Long timeoutMs;
        private int retries;

        public Builder sequence(int sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder stepKey(String stepKey) {
            this.stepKey = stepKey;
            return this;
        }

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder onError(StepErrorPolicy onError) {
            this.onError = onError;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public PlaybookStep build() {
            return new PlaybookStep(this);
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PlaybookStep that))
            return false;
        return sequence == that.sequence && Objects.equals(stepKey, that.stepKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, stepKey);
    }

    @Override
    public String toString() {
        return "PlaybookStep{" +
                "sequence=" + sequence +
                ", stepKey='" + stepKey + '\'' +
                ", actionId='" + actionId + '\'' +
                ", condition='" + condition + '\'' +
                ", onError=" + onError +
                ", timeoutMs=" + timeoutMs +
                ", retries=" + retries +
                '}';
    }
}
