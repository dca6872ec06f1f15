package com.soarsentinel.core.trigger;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DedupStore} over a concurrent map; {@code putIfAbsent} is the
 * conditional insert.
 */
public final class InMemoryDedupStore implements DedupStore {

    private final Map<DedupKey, DedupRecord> records = new ConcurrentHashMap<>();

    @Override
    public DedupRecord reserve(DedupKey key, Instant at) {
        Objects.requireNonNull(key, "key must not be null");
        DedupRecord record = new DedupRecord(key, at, null);
        if (records.putIfAbsent(key, record) != null) {
            throw new DedupConflictException(key);
        }
        return record;
    }

    @Override
    public void release(DedupKey key) {
        records.remove(key);
    }

    @Override
    public void recordExecution(DedupKey key, long executionId) {
        records.computeIfPresent(key, (k, record) -> record.withExecution(executionId));
    }

    @Override
    public Optional<DedupRecord> find(DedupKey key) {
        return Optional.ofNullable(records.get(key));
    }

    public int size() {
        return records.size();
    }
}
