package com.soarsentinel.core.trigger;

import java.time.Instant;
import java.util.Optional;

/**
 * Dedup records shared by the event consumer and the workers.
 *
 * <p>
 * {@link #reserve} is a single conditional insert per key, which is the only
 * coordination concurrent consumers need.
 * </p>
 */
public interface DedupStore {

    /**
     * Claim a key.
     *
     * @throws DedupConflictException if the key is already claimed
     */
    DedupRecord reserve(DedupKey key, Instant at);

    /**
     * Drop a claim whose job could not be enqueued, so a redelivery can
     * claim it again.
     */
    void release(DedupKey key);

    void recordExecution(DedupKey key, long executionId);

    Optional<DedupRecord> find(DedupKey key);
}
