package com.soarsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recorded outcome of one step within a {@link PlaybookExecution}.
 *
 * <p>
 * Immutable. Rollback produces a copy via
 * {@link #withCompensation(boolean, String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StepResult {

    private final String stepKey;
    private final String actionId;
    private final StepStatus status;
    private final int attempts;
    private final Map<String, Object> output;
    private final String error;
    private final Instant startedAt;
    private final Instant completedAt;
    private final boolean compensated;
    private final String compensationError;

    private StepResult(String stepKey, String actionId, StepStatus status, int attempts,
            Map<String, Object> output, String error, Instant startedAt, Instant completedAt,
            boolean compensated, String compensationError) {
        this.stepKey = Objects.requireNonNull(stepKey, "stepKey must not be null");
        this.actionId = actionId;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.attempts = attempts;
        this.output = output != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                : Map.of();
        this.error = error;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.compensated = compensated;
        this.compensationError = compensationError;
    }

    public static StepResult completed(String stepKey, String actionId, int attempts,
            Map<String, Object> output, Instant startedAt, Instant completedAt) {
        return new StepResult(stepKey, actionId, StepStatus.COMPLETED, attempts, output, null,
                startedAt, completedAt, false, null);
    }

    public static StepResult failed(String stepKey, String actionId, int attempts, String error,
            Instant startedAt, Instant completedAt) {
        return new StepResult(stepKey, actionId, StepStatus.FAILED, attempts, null, error,
                startedAt, completedAt, false, null);
    }

    public static StepResult skipped(String stepKey, String actionId, Instant at) {
        return new StepResult(stepKey, actionId, StepStatus.SKIPPED, 0, null, null, at, at, false, null);
    }

    /**
     * @param succeeded         whether the compensating operation succeeded
     * @param compensationError failure message, or {@code null}
     * @return a copy recording the compensation outcome
     */
    public StepResult withCompensation(boolean succeeded, String compensationError) {
        return new StepResult(stepKey, actionId, status, attempts, output, error, startedAt,
                completedAt, succeeded, compensationError);
    }

    public String getStepKey() {
        return stepKey;
    }

    public String getActionId() {
        return actionId;
    }

    public StepStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isCompensated() {
        return compensated;
    }

    public String getCompensationError() {
        return compensationError;
    }

    @Override
    public String toString() {
        return "StepResult{" +
                "stepKey='" + stepKey + '\'' +
                ", actionId='" + actionId + '\'' +
                ", status=" + status +
                ", attempts=" + attempts +
                ", error='" + error + '\'' +
                ", compensated=" + compensated +
                '}';
    }
}
