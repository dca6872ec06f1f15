package com.soarsentinel.core.trigger;

import com.soarsentinel.core.binding.BindingRegistry;
import com.soarsentinel.core.event.Delivery;
import com.soarsentinel.core.event.EventLog;
import com.soarsentinel.core.event.EventLogException;
import com.soarsentinel.core.metrics.SoarMetrics;
import com.soarsentinel.core.model.Event;
import com.soarsentinel.core.model.Playbook;
import com.soarsentinel.core.model.PlaybookBinding;
import com.soarsentinel.core.model.PlaybookExecution;
import com.soarsentinel.core.playbook.PlaybookExecutor;
import com.soarsentinel.core.playbook.PlaybookRepository;
import com.soarsentinel.core.playbook.TriggerContext;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import com.soarsentinel.core.predicate.PredicateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns events from the {@link EventLog} into playbook executions.
 *
 * <h3>Event Path (single consumer thread)</h3>
 * <pre>
 *   Received  → consume the next batch for the consumer group
 *   Matched   → active bindings of the event type, in dispatch order,
 *               filtered by predicate, skipping missing/inactive playbooks
 *   Dispatched→ reserve dedup key (eventId, bindingId), enqueue a job
 *   ack       → only after every match of the event was enqueued
 * </pre>
 * <p>
 * If an enqueue fails, its dedup claim is released and the event is nacked.
 * The redelivered event re-dispatches only the matches whose claim is still
 * free, so a redelivery never produces a second execution.
 * </p>
 *
 * <h3>Job Path (worker pool)</h3>
 * <p>
 * A fixed pool of workers takes jobs from the {@link JobQueue}, runs the
 * playbook and records the execution id against the dedup key. Jobs run
 * concurrently without ordering between bindings; a failing job is retried by
 * the queue and never holds back the event consumer.
 * </p>
 *
 * @since 1.0.0
 */
public final class TriggerEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TriggerEngine.class);

    private final EventLog eventLog;
    private final BindingRegistry bindings;
    private final PlaybookRepository playbooks;
    private final PredicateEvaluator predicates;
    private final DedupStore dedup;
    private final JobQueue jobs;
    private final PlaybookExecutor executor;
    private final TriggerEngineSettings settings;
    private final SoarMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;
    private ExecutorService workerPool;

    public TriggerEngine(EventLog eventLog, BindingRegistry bindings, PlaybookRepository playbooks,
            PredicateEvaluator predicates, DedupStore dedup, JobQueue jobs, PlaybookExecutor executor,
            TriggerEngineSettings settings, SoarMetrics metrics, Clock clock) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.bindings = Objects.requireNonNull(bindings, "bindings must not be null");
        this.playbooks = Objects.requireNonNull(playbooks, "playbooks must not be null");
        this.predicates = Objects.requireNonNull(predicates, "predicates must not be null");
        this.dedup = Objects.requireNonNull(dedup, "dedup must not be null");
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the consumer thread and the worker pool.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Trigger engine already running");
        }
        AtomicInteger workerIds = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(settings.getWorkers(), r -> {
            Thread t = new Thread(r, "trigger-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < settings.getWorkers(); i++) {
            workerPool.execute(this::workerLoop);
        }
        consumerThread = new Thread(this::consumerLoop, "trigger-consumer");
        consumerThread.setDaemon(true);
        consumerThread.start();
        LOG.info("Trigger engine started: {}", settings);
    }

    /**
     * Stop consuming and let in-flight jobs finish.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        long waitMs = settings.getPollInterval().toMillis() * 2 + 1_000;
        try {
            consumerThread.join(waitMs);
            workerPool.shutdown();
            if (!workerPool.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Workers still busy after {} ms; interrupting", waitMs);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Trigger engine stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Event path
    // ---------------------------------------------------------------

    private void consumerLoop() {
        while (running.get()) {
            List<Delivery> batch;
            try {
                batch = eventLog.consume(settings.getConsumerGroup(), settings.getPollInterval());
            } catch (EventLogException e) {
                LOG.warn("Event log unavailable: {}; retrying in {}", e.getMessage(), settings.getPollInterval());
                pause();
                continue;
            }
            for (Delivery delivery : batch) {
                try {
                    handle(delivery);
                } catch (RuntimeException e) {
                    // one bad delivery must not stop the consumer thread
                    LOG.error("Unexpected failure handling event {}; delivery left unresolved",
                            delivery.getEvent().getId(), e);
                }
            }
        }
    }

    /**
     * Process one delivery: dispatch all matches, then ack; nack on failure.
     */
    void handle(Delivery delivery) {
        metrics.incrementEventsConsumed();
        Event event = delivery.getEvent();
        try {
            int dispatched = dispatch(event);
            eventLog.ack(delivery);
            LOG.debug("Event {} ({}) acked after dispatching {} job(s)", event.getId(), event.getType(), dispatched);
        } catch (RuntimeException e) {
            LOG.warn("Dispatch of event {} failed on attempt {}: {}", event.getId(), delivery.getAttempt(),
                    e.getMessage());
            nack(delivery, e.getMessage());
        }
    }

    /**
     * Hand a delivery back to the log. A failed nack leaves the delivery
     * unresolved, so the log redelivers it once the consumer restarts.
     */
    private void nack(Delivery delivery, String reason) {
        try {
            if (eventLog.nack(delivery, reason)) {
                metrics.incrementDeadLetters("event");
            }
        } catch (RuntimeException e) {
            LOG.error("Could not nack event {} (attempt {}); delivery left unresolved: {}",
                    delivery.getEvent().getId(), delivery.getAttempt(), e.getMessage(), e);
        }
    }

    /**
     * Match an event against the bindings and enqueue a job per match that
     * has not been dispatched before.
     *
     * @return number of jobs enqueued
     * @throws DispatchException if a job could not be enqueued
     */
    public int dispatch(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!event.hasId()) {
            // redeliveries of the same record must map to the same key
            event.setId(derivedId(event));
        }
        int enqueued = 0;
        for (PlaybookBinding binding : bindings.findMatches(event.getType(), event.getOrganizationId())) {
            if (!predicateMatches(binding, event) || !playbookRunnable(binding)) {
                continue;
            }
            DedupKey key = new DedupKey(event.getId(), binding.getId());
            try {
                dedup.reserve(key, clock.instant());
            } catch (DedupConflictException e) {
                metrics.incrementDedupHits();
                LOG.debug("Skipping {}: already dispatched", key);
                continue;
            }
            try {
                jobs.enqueue(new PlaybookJob(key, binding.getPlaybookId(), binding.getPriority(), event, 1,
                        clock.instant()));
            } catch (RuntimeException e) {
                dedup.release(key);
                throw e instanceof DispatchException de
                        ? de
                        : new DispatchException("Failed to enqueue job for " + key + ": " + e.getMessage(), e);
            }
            enqueued++;
            metrics.incrementPlaybooksDispatched();
            LOG.info("Dispatched playbook {} for event {} via binding {} (priority {})",
                    binding.getPlaybookId(), event.getId(), binding.getId(), binding.getPriority());
        }
        return enqueued;
    }

    private boolean predicateMatches(PlaybookBinding binding, Event event) {
        if (!binding.hasPredicate()) {
            return true;
        }
        try {
            boolean matches = predicates.evaluate(binding.getPredicate(), event);
            if (!matches) {
                LOG.trace("Binding {} predicate did not match event {}", binding.getId(), event.getId());
            }
            return matches;
        } catch (PredicateSyntaxException e) {
            LOG.warn("Binding {} has an unparseable predicate; skipping: {}", binding.getId(), e.getMessage());
            return false;
        }
    }

    private boolean playbookRunnable(PlaybookBinding binding) {
        Optional<Playbook> playbook = playbooks.findById(binding.getPlaybookId());
        if (playbook.isEmpty()) {
            LOG.warn("Binding {} refers to missing playbook {}; skipping", binding.getId(), binding.getPlaybookId());
            return false;
        }
        if (!playbook.get().isActive()) {
            LOG.warn("Binding {} refers to inactive playbook {}; skipping", binding.getId(),
                    binding.getPlaybookId());
            return false;
        }
        return true;
    }

    private static String derivedId(Event event) {
        return "derived:" + event.getType() + ":" + event.getOrganizationId() + ":"
                + event.getEntityId() + ":" + event.getTimestamp();
    }

    // ---------------------------------------------------------------
    // Job path
    // ---------------------------------------------------------------

    private void workerLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                jobs.dequeue(settings.getPollInterval()).ifPresent(this::runJob);
            } catch (RuntimeException e) {
                LOG.error("Worker loop failure; continuing: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Run one job and record its execution against the dedup key.
     */
    void runJob(PlaybookJob job) {
        Optional<Long> previous = dedup.find(job.getKey()).flatMap(DedupRecord::getExecutionId);
        if (previous.isPresent()) {
            LOG.info("Job {} already produced execution {}; skipping", job, previous.get());
            jobs.complete(job);
            return;
        }
        try {
            PlaybookExecution execution = executor.execute(job.getPlaybookId(),
                    TriggerContext.fromEvent(job.getEvent(), job.getBindingId()));
            dedup.recordExecution(job.getKey(), execution.getId());
            jobs.complete(job);
        } catch (Throwable e) {
            // an Error would otherwise end this worker for good
            LOG.warn("Job {} failed: {}", job, e.toString(), e);
            if (jobs.fail(job, e.getMessage() != null ? e.getMessage() : e.toString())) {
                metrics.incrementDeadLetters("job");
            }
        }
    }

    private void pause() {
        try {
            Thread.sleep(settings.getPollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }
}
