package com.soarsentinel.core.trigger;

import com.soarsentinel.core.event.AlertEvents;
import com.soarsentinel.core.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryJobQueue}.
 */
class InMemoryJobQueueTest {

    private static final Clock CLOCK = Clock.systemUTC();
    private static final Duration SHORT = Duration.ofMillis(20);

    @Test
    @DisplayName("Jobs are handed out in enqueue order")
    void shouldDequeueInOrder() {
        InMemoryJobQueue queue = new InMemoryJobQueue(3, Duration.ofMillis(10), CLOCK);
        queue.enqueue(job(1, 1));
        queue.enqueue(job(2, 1));

        assertThat(queue.dequeue(SHORT)).get().extracting(PlaybookJob::getBindingId).isEqualTo(1L);
        assertThat(queue.dequeue(SHORT)).get().extracting(PlaybookJob::getBindingId).isEqualTo(2L);
        assertThat(queue.dequeue(SHORT)).isEmpty();
    }

    @Test
    @DisplayName("A failed job comes back after its backoff with the next attempt number")
    void shouldRetryAfterBackoff() {
        InMemoryJobQueue queue = new InMemoryJobQueue(3, Duration.ofMillis(200), CLOCK);
        queue.enqueue(job(1, 1));
        PlaybookJob taken = queue.dequeue(SHORT).orElseThrow();

        assertThat(queue.fail(taken, "executor crashed")).isFalse();

        assertThat(queue.pending()).isEqualTo(1);
        assertThat(queue.dequeue(Duration.ofMillis(10))).isEmpty();
        Optional<PlaybookJob> retried = queue.dequeue(Duration.ofSeconds(2));
        assertThat(retried).get().extracting(PlaybookJob::getAttempt).isEqualTo(2);
    }

    @Test
    @DisplayName("A job is dead-lettered once its attempts are exhausted")
    void shouldDeadLetterExhaustedJob() {
        InMemoryJobQueue queue = new InMemoryJobQueue(2, Duration.ofMillis(1), CLOCK);

        assertThat(queue.fail(job(1, 2), "still failing")).isTrue();

        assertThat(queue.pending()).isZero();
        assertThat(queue.deadLetters()).singleElement().satisfies(dead -> {
            assertThat(dead.getAttempts()).isEqualTo(2);
            assertThat(dead.getReason()).isEqualTo("still failing");
        });
    }

    @Test
    @DisplayName("A closed queue rejects new jobs")
    void shouldRejectEnqueueWhenClosed() {
        InMemoryJobQueue queue = new InMemoryJobQueue(1, Duration.ofMillis(1), CLOCK);
        queue.close();

        assertThatThrownBy(() -> queue.enqueue(job(1, 1))).isInstanceOf(DispatchException.class);
    }

    private static PlaybookJob job(long bindingId, int attempt) {
        Event event = Event.builder()
                .id("evt-" + bindingId)
                .type(AlertEvents.ALERT_CREATED)
                .entityType(AlertEvents.ENTITY_ALERT)
                .organizationId(1)
                .data(Map.of())
                .build();
        return new PlaybookJob(new DedupKey(event.getId(), bindingId), 1, 0, event, attempt, CLOCK.instant());
    }
}
