package com.soarsentinel.core.trigger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted marker that a dispatch key was claimed, and which execution it
 * produced once the job ran.
 */
public final class DedupRecord {

    private final DedupKey key;
    private final Instant reservedAt;
    private final Long executionId;

    public DedupRecord(DedupKey key, Instant reservedAt, Long executionId) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.reservedAt = Objects.requireNonNull(reservedAt, "reservedAt must not be null");
        this.executionId = executionId;
    }

    DedupRecord withExecution(long id) {
        return new DedupRecord(key, reservedAt, id);
    }

    public DedupKey getKey() {
        return key;
    }

    public Instant getReservedAt() {
        return reservedAt;
    }

    public Optional<Long> getExecutionId() {
        return Optional.ofNullable(executionId);
    }

    @Override
    public String toString() {
        return "DedupRecord{key=" + key + ", reservedAt=" + reservedAt + ", executionId=" + executionId + '}';
    }
}
