package com.soarsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one playbook run.
 *
 * <p>
 * Created in {@link ExecutionStatus#RUNNING} at trigger time and finalised
 * <strong>exactly once</strong> by the playbook executor. Any second
 * finalisation attempt throws {@link IllegalStateException}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The executing worker appends step results while operators may request
 * cancellation from another thread, so every accessor is synchronized.
 * Cancellation only sets a flag; the executor observes it before starting the
 * next step and never interrupts an in-flight action.
 * </p>
 *
 * @since 1.0.0
 */
public final class PlaybookExecution {

    private final long id;
    private final long playbookId;
    private final long organizationId;
    private final Instant startedAt;
    private final String triggerSource;
    private final long triggerEntityId;
    private final String triggerEventId;

    private final List<StepResult> results = new ArrayList<>();
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private Instant completedAt;
    private String error;
    private boolean cancelRequested;

    public PlaybookExecution(long id, long playbookId, long organizationId, Instant startedAt,
            String triggerSource, long triggerEntityId, String triggerEventId) {
        this.id = id;
        this.playbookId = playbookId;
        this.organizationId = organizationId;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.triggerSource = triggerSource;
        this.triggerEntityId = triggerEntityId;
        this.triggerEventId = triggerEventId;
    }

    // ---------------------------------------------------------------
    // Mutation (executor side)
    // ---------------------------------------------------------------

    public synchronized void addResult(StepResult result) {
        requireRunning();
        results.add(Objects.requireNonNull(result, "result must not be null"));
    }

    /**
     * Replace the recorded result for the step with the same key.
     *
     * @param result updated result
     * @throws IllegalArgumentException if no result exists for that step
     */
    public synchronized void replaceResult(StepResult result) {
        requireRunning();
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).getStepKey().equals(result.getStepKey())) {
                results.set(i, result);
                return;
            }
        }
        throw new IllegalArgumentException("No result recorded for step '" + result.getStepKey() + "'");
    }

    public synchronized void complete(Instant at) {
        finish(ExecutionStatus.COMPLETED, null, at);
    }

    public synchronized void fail(String error, Instant at) {
        finish(ExecutionStatus.FAILED, error, at);
    }

    public synchronized void cancel(Instant at) {
        finish(ExecutionStatus.CANCELLED, "Execution cancelled", at);
    }

    /**
     * Ask the executor to stop before the next step.
     *
     * @return {@code true} if the execution was still running
     */
    public synchronized boolean requestCancel() {
        if (status.isTerminal()) {
            return false;
        }
        cancelRequested = true;
        return true;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    private void finish(ExecutionStatus target, String error, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution " + id + " already finalised as " + status.label());
        }
        this.status = target;
        this.error = error;
        this.completedAt = Objects.requireNonNull(at, "completion time must not be null");
    }

    private void requireRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution " + id + " is " + status.label() + " and can no longer change");
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public long getPlaybookId() {
        return playbookId;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public String getTriggerSource() {
        return triggerSource;
    }

    public long getTriggerEntityId() {
        return triggerEntityId;
    }

    public String getTriggerEventId() {
        return triggerEventId;
    }

    /**
     * @return snapshot of step results in execution order
     */
    public synchronized List<StepResult> getResults() {
        return List.copyOf(results);
    }

    public synchronized Optional<StepResult> getResult(String stepKey) {
        return results.stream().filter(r -> r.getStepKey().equals(stepKey)).findFirst();
    }

    /**
     * @return failure message, or {@code null} for successful executions
     */
    public synchronized String getError() {
        return error;
    }

    /**
     * @return wall-clock duration, empty while still running
     */
    public synchronized Optional<Duration> getDuration() {
        return completedAt == null ? Optional.empty() : Optional.of(Duration.between(startedAt, completedAt));
    }

    @Override
    public synchronized String toString() {
        return "PlaybookExecution{" +
                "id=" + id +
                ", playbookId=" + playbookId +
                ", status=" + status +
                ", triggerSource='" + triggerSource + '\'' +
                ", triggerEntityId=" + triggerEntityId +
                ", steps=" + results.size() +
                ", error='" + error + '\'' +
                '}';
    }
}
