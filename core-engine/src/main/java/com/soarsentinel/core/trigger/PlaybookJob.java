package com.soarsentinel.core.trigger;

import com.soarsentinel.core.model.Event;

import java.time.Instant;
import java.util.Objects;

/**
 * Request to run one playbook for one matched (event, binding) pair.
 * Immutable; a retry is a copy with the next attempt number.
 */
public final class PlaybookJob {

    private final DedupKey key;
    private final long playbookId;
    private final int priority;
    private final Event event;
    private final int attempt;
    private final Instant enqueuedAt;

    public PlaybookJob(DedupKey key, long playbookId, int priority, Event event, int attempt, Instant enqueuedAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.playbookId = playbookId;
        this.priority = priority;
        this.event = Objects.requireNonNull(event, "event must not be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
        this.attempt = attempt;
        this.enqueuedAt = enqueuedAt;
    }

    public PlaybookJob nextAttempt(Instant at) {
        return new PlaybookJob(key, playbookId, priority, event, attempt + 1, at);
    }

    public DedupKey getKey() {
        return key;
    }

    public long getBindingId() {
        return key.getBindingId();
    }

    public long getPlaybookId() {
        return playbookId;
    }

    public int getPriority() {
        return priority;
    }

    public Event getEvent() {
        return event;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public String toString() {
        return "PlaybookJob{key=" + key + ", playbookId=" + playbookId + ", attempt=" + attempt + '}';
    }
}
