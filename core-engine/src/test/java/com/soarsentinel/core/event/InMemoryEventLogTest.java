package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryEventLog}.
 */
class InMemoryEventLogTest {

    private static final Duration NO_WAIT = Duration.ZERO;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("A consumer group receives an organization's events in publish order")
    void shouldDeliverInPublishOrder() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        log.publish(event("e1", 1));
        log.publish(event("e2", 2));
        log.publish(event("e3", 1));

        List<Delivery> batch = log.consume("engine", NO_WAIT);

        assertThat(batch).extracting(d -> d.getEvent().getId()).containsExactly("e1", "e3", "e2");
        assertThat(batch).extracting(Delivery::getAttempt).containsOnly(1);
        assertThat(log.inFlight("engine")).isEqualTo(3);
        assertThat(log.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Each consumer group keeps its own position")
    void shouldTrackGroupsIndependently() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        log.publish(event("e1", 1));

        assertThat(log.consume("a", NO_WAIT)).hasSize(1);
        assertThat(log.consume("a", NO_WAIT)).isEmpty();
        assertThat(log.consume("b", NO_WAIT)).hasSize(1);
    }

    @Test
    @DisplayName("Acked deliveries leave the in-flight set and are not redelivered")
    void shouldForgetAckedDeliveries() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        log.publish(event("e1", 1));
        Delivery delivery = log.consume("engine", NO_WAIT).get(0);

        log.ack(delivery);

        assertThat(log.inFlight("engine")).isZero();
        assertThat(log.consume("engine", NO_WAIT)).isEmpty();
    }

    @Test
    @DisplayName("Nacked events come back with the next attempt number, ahead of new events")
    void shouldRedeliverNackedEvents() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        log.publish(event("e1", 1));
        Delivery first = log.consume("engine", NO_WAIT).get(0);
        log.publish(event("e2", 1));

        boolean deadLettered = log.nack(first, "handler failed");
        List<Delivery> batch = log.consume("engine", NO_WAIT);

        assertThat(deadLettered).isFalse();
        assertThat(batch).extracting(d -> d.getEvent().getId()).containsExactly("e1", "e2");
        assertThat(batch.get(0).getAttempt()).isEqualTo(2);
    }

    @Test
    @DisplayName("An event is dead-lettered once its deliveries are exhausted")
    void shouldDeadLetterAfterMaxDeliveries() {
        InMemoryEventLog log = new InMemoryEventLog(2, CLOCK);
        log.publish(event("e1", 1));

        assertThat(log.nack(log.consume("engine", NO_WAIT).get(0), "first")).isFalse();
        assertThat(log.nack(log.consume("engine", NO_WAIT).get(0), "second")).isTrue();

        assertThat(log.consume("engine", NO_WAIT)).isEmpty();
        assertThat(log.deadLetters()).singleElement().satisfies(dead -> {
            assertThat(dead.getPayload().getId()).isEqualTo("e1");
            assertThat(dead.getAttempts()).isEqualTo(2);
            assertThat(dead.getReason()).isEqualTo("second");
            assertThat(dead.getDeadLetteredAt()).isEqualTo(CLOCK.instant());
        });
    }

    @Test
    @DisplayName("consume waits for a publish until the timeout")
    void shouldWakeUpOnPublish() throws Exception {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        CompletableFuture<List<Delivery>> pending =
                CompletableFuture.supplyAsync(() -> log.consume("engine", Duration.ofSeconds(5)));

        Thread.sleep(50);
        log.publish(event("e1", 1));

        assertThat(pending.get(5, TimeUnit.SECONDS)).hasSize(1);
    }

    @Test
    @DisplayName("Unknown handles are ignored and foreign deliveries are rejected")
    void shouldValidateHandles() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        log.publish(event("e1", 1));
        Delivery delivery = log.consume("engine", NO_WAIT).get(0);
        log.ack(delivery);

        log.ack(delivery);
        assertThat(log.nack(delivery, "late")).isFalse();
        assertThatThrownBy(() -> log.ack(new Delivery(event("x", 1), 1, "foreign")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("maxDeliveries must be positive")
    void shouldRejectInvalidMaxDeliveries() {
        assertThatThrownBy(() -> new InMemoryEventLog(0, CLOCK))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDeliveries");
    }

    static Event event(String id, long organizationId) {
        return Event.builder()
                .id(id)
                .type(AlertEvents.ALERT_CREATED)
                .entityType(AlertEvents.ENTITY_ALERT)
                .entityId(1)
                .organizationId(organizationId)
                .timestamp(CLOCK.instant())
                .data(Map.of("severity", "high"))
                .build();
    }
}
