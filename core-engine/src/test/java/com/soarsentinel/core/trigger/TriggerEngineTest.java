package com.soarsentinel.core.trigger;

import com.soarsentinel.core.binding.BindingRegistry;
import com.soarsentinel.core.binding.InMemoryBindingStore;
import com.soarsentinel.core.event.AlertEvents;
import com.soarsentinel.core.event.Delivery;
import com.soarsentinel.core.event.EventLog;
import com.soarsentinel.core.event.EventLogException;
import com.soarsentinel.core.event.InMemoryEventLog;
import com.soarsentinel.core.metrics.SoarMetrics;
import com.soarsentinel.core.model.Event;
import com.soarsentinel.core.model.ExecutionStatus;
import com.soarsentinel.core.model.Playbook;
import com.soarsentinel.core.model.PlaybookBinding;
import com.soarsentinel.core.model.PlaybookExecution;
import com.soarsentinel.core.model.PlaybookStep;
import com.soarsentinel.core.playbook.ActionRegistry;
import com.soarsentinel.core.playbook.ExecutorSettings;
import com.soarsentinel.core.playbook.InMemoryExecutionStore;
import com.soarsentinel.core.playbook.InMemoryPlaybookRepository;
import com.soarsentinel.core.playbook.PlaybookExecutor;
import com.soarsentinel.core.playbook.PlaybookRepository;
import com.soarsentinel.core.playbook.actions.InMemoryEndpointClient;
import com.soarsentinel.core.playbook.actions.InMemoryFirewallClient;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link TriggerEngine}.
 */
class TriggerEngineTest {

    private static final long ORG = 1;
    private static final Clock CLOCK = Clock.systemUTC();

    private InMemoryPlaybookRepository playbooks;
    private BindingRegistry bindings;
    private InMemoryExecutionStore executions;
    private InMemoryDedupStore dedup;
    private InMemoryEventLog eventLog;
    private SoarMetrics metrics;
    private PlaybookExecutor executor;

    @BeforeEach
    void setUp() {
        playbooks = new InMemoryPlaybookRepository();
        playbooks.save(playbook(1, true));
        playbooks.save(playbook(2, true));
        playbooks.save(playbook(3, false));
        PredicateEvaluator predicates = new PredicateEvaluator();
        bindings = new BindingRegistry(new InMemoryBindingStore(), playbooks, predicates, CLOCK);
        executions = new InMemoryExecutionStore();
        dedup = new InMemoryDedupStore();
        eventLog = new InMemoryEventLog(2, CLOCK);
        metrics = SoarMetrics.inMemory();
        executor = new PlaybookExecutor(playbooks,
                ActionRegistry.builtIns(new InMemoryFirewallClient(), new InMemoryEndpointClient()),
                executions, predicates, new ExecutorSettings(Duration.ofSeconds(5), Duration.ofMillis(1)),
                metrics, CLOCK);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Matching bindings are dispatched in priority order; others are skipped")
    void shouldDispatchMatchesInPriorityOrder() {
        PlaybookBinding catchAll = bindings.create(binding(null, 2, 10));
        PlaybookBinding critical = bindings.create(binding("severity == 'critical'", 1, 100));
        bindings.create(binding("severity == 'low'", 1, 50));
        bindings.create(binding(null, 3, 70));
        RecordingJobQueue queue = new RecordingJobQueue();

        int dispatched = engine(queue).dispatch(event("evt-1", "critical"));

        assertThat(dispatched).isEqualTo(2);
        assertThat(queue.jobs).extracting(PlaybookJob::getBindingId)
                .containsExactly(critical.getId(), catchAll.getId());
        assertThat(queue.jobs.get(0).getPlaybookId()).isEqualTo(1);
        assertThat(queue.jobs.get(0).getAttempt()).isEqualTo(1);
        assertThat(metrics.registry().counter("soar_playbooks_dispatched_total").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Dispatching the same event twice enqueues nothing the second time")
    void shouldNotDispatchTwice() {
        bindings.create(binding(null, 1, 10));
        RecordingJobQueue queue = new RecordingJobQueue();
        TriggerEngine engine = engine(queue);

        engine.dispatch(event("evt-1", "high"));
        int again = engine.dispatch(event("evt-1", "high"));

        assertThat(again).isZero();
        assertThat(queue.jobs).hasSize(1);
        assertThat(metrics.registry().counter("soar_dedup_hits_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Events without an id get a stable derived id")
    void shouldDeriveIdForAnonymousEvents() {
        bindings.create(binding(null, 1, 10));
        RecordingJobQueue queue = new RecordingJobQueue();
        TriggerEngine engine = engine(queue);
        Instant at = Instant.parse("2024-03-01T10:00:00Z");

        Event first = anonymousEvent(at);
        engine.dispatch(first);
        engine.dispatch(anonymousEvent(at));

        assertThat(first.getId()).startsWith("derived:alert.created:1:");
        assertThat(queue.jobs).hasSize(1);
    }

    @Test
    @DisplayName("A failed enqueue releases its claim so a retry dispatches only what is missing")
    void shouldReleaseClaimWhenEnqueueFails() {
        PlaybookBinding first = bindings.create(binding(null, 1, 20));
        PlaybookBinding second = bindings.create(binding(null, 2, 10));
        RecordingJobQueue queue = new RecordingJobQueue();
        queue.failAfter = 1;

        assertThatThrownBy(() -> engine(queue).dispatch(event("evt-1", "high")))
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("queue down");
        assertThat(dedup.find(new DedupKey("evt-1", first.getId()))).isPresent();
        assertThat(dedup.find(new DedupKey("evt-1", second.getId()))).isEmpty();

        queue.failAfter = Integer.MAX_VALUE;
        int retried = engine(queue).dispatch(event("evt-1", "high"));

        assertThat(retried).isEqualTo(1);
        assertThat(queue.jobs).extracting(PlaybookJob::getBindingId).containsExactly(first.getId(), second.getId());
    }

    @Test
    @DisplayName("A delivery is acked after dispatch and nacked until dead-lettered when dispatch fails")
    void shouldAckOrNackDeliveries() {
        bindings.create(binding(null, 1, 10));
        RecordingJobQueue broken = new RecordingJobQueue();
        broken.failAfter = 0;
        TriggerEngine engine = engine(broken);
        eventLog.publish(event("evt-1", "high"));

        engine.handle(eventLog.consume("test", Duration.ZERO).get(0));
        Delivery redelivered = eventLog.consume("test", Duration.ZERO).get(0);
        assertThat(redelivered.getAttempt()).isEqualTo(2);
        engine.handle(redelivered);

        assertThat(eventLog.deadLetters()).hasSize(1);
        assertThat(metrics.registry().counter("soar_dead_letters_total", "path", "event").count()).isEqualTo(1.0);

        eventLog.publish(event("evt-2", "high"));
        engine(new RecordingJobQueue()).handle(eventLog.consume("test", Duration.ZERO).get(0));
        assertThat(eventLog.inFlight("test")).isZero();
        assertThat(metrics.registry().counter("soar_events_consumed_total").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("A failing nack leaves the delivery unresolved and later events are still processed")
    void shouldKeepConsumingWhenNackFails() {
        bindings.create(binding(null, 1, 10));
        NackFailingEventLog log = new NackFailingEventLog(eventLog);
        JobQueue queue = new RejectingJobQueue("evt-bad", new InMemoryJobQueue(3, Duration.ofMillis(10), CLOCK));
        TriggerEngine engine = engine(log, queue);
        engine.start();
        try {
            log.publish(event("evt-bad", "high"));
            await().atMost(Duration.ofSeconds(5)).until(() -> log.nackAttempts.get() == 1);

            log.publish(event("evt-good", "high"));

            await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertThat(executions.findAll())
                    .extracting(PlaybookExecution::getTriggerEventId)
                    .containsExactly("evt-good"));
            assertThat(engine.isRunning()).isTrue();
            assertThat(eventLog.inFlight("test")).isEqualTo(1);
        } finally {
            engine.stop();
        }
    }

    @Test
    @DisplayName("A nack failure during handle does not propagate")
    void shouldNotThrowWhenNackFails() {
        bindings.create(binding(null, 1, 10));
        NackFailingEventLog log = new NackFailingEventLog(eventLog);
        RecordingJobQueue broken = new RecordingJobQueue();
        broken.failAfter = 0;
        TriggerEngine engine = engine(log, broken);
        log.publish(event("evt-1", "high"));

        engine.handle(log.consume("test", Duration.ZERO).get(0));

        assertThat(log.nackAttempts.get()).isEqualTo(1);
        assertThat(eventLog.inFlight("test")).isEqualTo(1);
        assertThat(eventLog.deadLetters()).isEmpty();
    }

    @Test
    @DisplayName("An Error thrown while running a job fails the job instead of killing the worker")
    void shouldFailJobOnError() {
        PlaybookBinding binding = bindings.create(binding(null, 1, 10));
        PlaybookRepository broken = new PlaybookRepository() {
            @Override
            public Optional<Playbook> findById(long playbookId) {
                throw new LinkageError("action class missing");
            }

            @Override
            public List<Playbook> findByOrganization(long organizationId) {
                return List.of();
            }

            @Override
            public void save(Playbook playbook) {
                // read-only
            }
        };
        PlaybookExecutor failingExecutor = new PlaybookExecutor(broken,
                ActionRegistry.builtIns(new InMemoryFirewallClient(), new InMemoryEndpointClient()),
                executions, new PredicateEvaluator(), ExecutorSettings.defaults(), metrics, CLOCK);
        RecordingJobQueue queue = new RecordingJobQueue();
        TriggerEngine engine = new TriggerEngine(eventLog, bindings, playbooks, new PredicateEvaluator(), dedup,
                queue, failingExecutor, new TriggerEngineSettings("test", 1, Duration.ofMillis(50)), metrics, CLOCK);
        PlaybookJob job = new PlaybookJob(new DedupKey("evt-1", binding.getId()), 1, 10, event("evt-1", "high"), 1,
                CLOCK.instant());

        try {
            engine.runJob(job);
        } finally {
            failingExecutor.close();
        }

        assertThat(queue.failures).containsExactly("action class missing");
        assertThat(queue.completed).isEmpty();
    }

    @Test
    @DisplayName("A job whose key already has an execution is completed without running again")
    void shouldSkipJobWithRecordedExecution() {
        PlaybookBinding binding = bindings.create(binding(null, 1, 10));
        DedupKey key = new DedupKey("evt-1", binding.getId());
        dedup.reserve(key, CLOCK.instant());
        dedup.recordExecution(key, 99);
        RecordingJobQueue queue = new RecordingJobQueue();

        engine(queue).runJob(new PlaybookJob(key, 1, 10, event("evt-1", "high"), 1, CLOCK.instant()));

        assertThat(executions.findAll()).isEmpty();
        assertThat(queue.completed).hasSize(1);
    }

    @Test
    @DisplayName("End to end: a published event runs the bound playbook exactly once")
    void shouldRunBoundPlaybook() {
        PlaybookBinding binding = bindings.create(binding("severity == 'critical'", 1, 10));
        InMemoryJobQueue queue = new InMemoryJobQueue(3, Duration.ofMillis(10), CLOCK);
        TriggerEngine engine = engine(queue);
        engine.start();
        try {
            eventLog.publish(event("evt-1", "critical"));
            eventLog.publish(event("evt-1", "critical"));

            await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
                assertThat(executions.findAll()).hasSize(1);
                assertThat(executions.findAll().get(0).getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
                assertThat(dedup.find(new DedupKey("evt-1", binding.getId()))
                        .flatMap(DedupRecord::getExecutionId)).isPresent();
            });
            PlaybookExecution execution = executions.findAll().get(0);
            assertThat(execution.getTriggerSource()).isEqualTo("binding:" + binding.getId());
            assertThat(execution.getTriggerEventId()).isEqualTo("evt-1");
        } finally {
            engine.stop();
        }
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("start twice is rejected")
    void shouldRejectDoubleStart() {
        TriggerEngine engine = engine(new InMemoryJobQueue(1, Duration.ofMillis(10), CLOCK));
        engine.start();
        try {
            assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);
        } finally {
            engine.close();
        }
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private TriggerEngine engine(JobQueue queue) {
        return engine(eventLog, queue);
    }

    private TriggerEngine engine(EventLog log, JobQueue queue) {
        return new TriggerEngine(log, bindings, playbooks, new PredicateEvaluator(), dedup, queue, executor,
                new TriggerEngineSettings("test", 2, Duration.ofMillis(50)), metrics, CLOCK);
    }

    private static Playbook playbook(long id, boolean active) {
        return new Playbook(id, ORG, "playbook " + id, null, 1, active, List.of(PlaybookStep.builder()
                .sequence(1)
                .stepKey("note")
                .actionId("log_message")
                .inputs(Map.of("message", "Alert {{ trigger.entityId }} at {{ severity }}"))
                .build()));
    }

    private static PlaybookBinding binding(String predicate, long playbookId, int priority) {
        return PlaybookBinding.builder()
                .eventType(AlertEvents.ALERT_CREATED)
                .predicate(predicate)
                .playbookId(playbookId)
                .priority(priority)
                .organizationId(ORG)
                .build();
    }

    private static Event event(String id, String severity) {
        return Event.builder()
                .id(id)
                .type(AlertEvents.ALERT_CREATED)
                .entityType(AlertEvents.ENTITY_ALERT)
                .entityId(5)
                .organizationId(ORG)
                .data(Map.of("severity", severity))
                .build();
    }

    private static Event anonymousEvent(Instant at) {
        return Event.builder()
                .type(AlertEvents.ALERT_CREATED)
                .entityType(AlertEvents.ENTITY_ALERT)
                .entityId(5)
                .organizationId(ORG)
                .timestamp(at)
                .data(Map.of("severity", "high"))
                .build();
    }

    /** Records enqueued jobs; fails every enqueue after {@code failAfter} successes. */
    private static final class RecordingJobQueue implements JobQueue {
        private final List<PlaybookJob> jobs = new ArrayList<>();
        private final List<PlaybookJob> completed = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();
        private int failAfter = Integer.MAX_VALUE;
        private int accepted;

        @Override
        public void enqueue(PlaybookJob job) {
            if (accepted >= failAfter) {
                throw new IllegalStateException("queue down");
            }
            accepted++;
            jobs.add(job);
        }

        @Override
        public Optional<PlaybookJob> dequeue(Duration timeout) {
            return Optional.empty();
        }

        @Override
        public void complete(PlaybookJob job) {
            completed.add(job);
        }

        @Override
        public boolean fail(PlaybookJob job, String reason) {
            failures.add(reason);
            return false;
        }
    }

    /** Delegates to an in-memory log but cannot hand deliveries back. */
    private static final class NackFailingEventLog implements EventLog {
        private final EventLog delegate;
        private final AtomicInteger nackAttempts = new AtomicInteger();

        private NackFailingEventLog(EventLog delegate) {
            this.delegate = delegate;
        }

        @Override
        public void publish(Event event) {
            delegate.publish(event);
        }

        @Override
        public List<Delivery> consume(String consumerGroup, Duration timeout) {
            return delegate.consume(consumerGroup, timeout);
        }

        @Override
        public void ack(Delivery delivery) {
            delegate.ack(delivery);
        }

        @Override
        public boolean nack(Delivery delivery, String reason) {
            nackAttempts.incrementAndGet();
            throw new EventLogException("retry topic unavailable");
        }
    }

    /** Rejects jobs for one event id and passes the rest through. */
    private static final class RejectingJobQueue implements JobQueue {
        private final String rejectedEventId;
        private final JobQueue delegate;

        private RejectingJobQueue(String rejectedEventId, JobQueue delegate) {
            this.rejectedEventId = rejectedEventId;
            this.delegate = delegate;
        }

        @Override
        public void enqueue(PlaybookJob job) {
            if (rejectedEventId.equals(job.getEvent().getId())) {
                throw new DispatchException("queue rejected " + job.getKey());
            }
            delegate.enqueue(job);
        }

        @Override
        public Optional<PlaybookJob> dequeue(Duration timeout) {
            return delegate.dequeue(timeout);
        }

        @Override
        public void complete(PlaybookJob job) {
            delegate.complete(job);
        }

        @Override
        public boolean fail(PlaybookJob job, String reason) {
            return delegate.fail(job, reason);
        }
    }
}
