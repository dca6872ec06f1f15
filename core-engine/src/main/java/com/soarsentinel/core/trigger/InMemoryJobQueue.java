package com.soarsentinel.core.trigger;

import com.soarsentinel.core.event.DeadLetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link JobQueue} held in memory.
 *
 * <p>
 * Jobs are handed out in enqueue order once their not-before time has
 * passed. A failed job is re-scheduled after
 * {@code backoff * 2^(attempt-1)}; after {@code maxAttempts} it is moved to
 * the dead-letter list exposed by {@link #deadLetters()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class InMemoryJobQueue implements JobQueue {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private static final long MAX_WAIT_SLICE_MS = 50;

    private final int maxAttempts;
    private final Duration backoff;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Scheduled> ready = new PriorityQueue<>(
            Comparator.comparingLong((Scheduled s) -> s.notBeforeMillis).thenComparingLong(s -> s.sequence));
    private final List<PlaybookJob> leased = new ArrayList<>();
    private final List<DeadLetter<PlaybookJob>> deadLetters = new ArrayList<>();
    private long sequence;
    private boolean closed;

    public InMemoryJobQueue(int maxAttempts, Duration backoff, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void enqueue(PlaybookJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            if (closed) {
                throw new DispatchException("Job queue is closed; cannot enqueue " + job);
            }
            schedule(job, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PlaybookJob> dequeue(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                Scheduled head = ready.peek();
                if (head != null && head.notBeforeMillis <= clock.millis()) {
                    ready.poll();
                    leased.add(head.job);
                    return Optional.of(head.job);
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                // wake up periodically so delayed jobs become visible
                changed.awaitNanos(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(MAX_WAIT_SLICE_MS)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete(PlaybookJob job) {
        lock.lock();
        try {
            leased.remove(job);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean fail(PlaybookJob job, String reason) {
        lock.lock();
        try {
            leased.remove(job);
            if (job.getAttempt() >= maxAttempts) {
                deadLetters.add(new DeadLetter<>(job, job.getAttempt(), reason, clock.instant()));
                LOG.error("Job {} dead-lettered after {} attempt(s): {}", job, job.getAttempt(), reason);
                return true;
            }
            long delay = backoff.toMillis() << Math.min(job.getAttempt() - 1, 20);
            schedule(job.nextAttempt(clock.instant()), clock.millis() + delay);
            LOG.warn("Job {} failed ({}); retrying in {} ms", job, reason, delay);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reject further enqueues; jobs already queued can still be taken.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public List<DeadLetter<PlaybookJob>> deadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return jobs waiting to be taken, including those still in backoff
     */
    public int pending() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    private void schedule(PlaybookJob job, long notBeforeMillis) {
        ready.add(new Scheduled(job, notBeforeMillis, sequence++));
        changed.signalAll();
    }

    private static final class Scheduled {
        private final PlaybookJob job;
        private final long notBeforeMillis;
        private final long sequence;

        private Scheduled(PlaybookJob job, long notBeforeMillis, long sequence) {
            this.job = job;
            this.notBeforeMillis = notBeforeMillis;
            this.sequence = sequence;
        }
    }
}
