package com.soarsentinel.core.trigger;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable queue of playbook jobs with retry-with-backoff and a dead-letter
 * path.
 */
public interface JobQueue {

    /**
     * @throws DispatchException if the queue is unavailable
     */
    void enqueue(PlaybookJob job);

    /**
     * Take the next job whose backoff has elapsed, waiting up to
     * {@code timeout}.
     */
    Optional<PlaybookJob> dequeue(Duration timeout);

    /**
     * The job finished; it will not be handed out again.
     */
    void complete(PlaybookJob job);

    /**
     * The job failed: schedule a retry after backoff, or dead-letter it when
     * its attempts are exhausted.
     *
     * @return {@code true} if the job was dead-lettered
     */
    boolean fail(PlaybookJob job, String reason);
}
