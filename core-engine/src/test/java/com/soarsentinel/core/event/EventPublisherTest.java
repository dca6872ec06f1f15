package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Event;
import com.soarsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventPublisher}.
 */
class EventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("An alert creation yields one alert.created event on the log and the bus")
    void shouldPublishAlertCreated() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);
        NotificationBus bus = new NotificationBus();
        List<Event> seen = new ArrayList<>();
        bus.subscribe(AlertEvents.ALERT_CREATED, seen::add);
        Alert alert = Alert.builder()
                .id(42)
                .organizationId(7)
                .title("Failed login burst")
                .severity(Severity.HIGH)
                .source("idp")
                .category("authentication")
                .sourceIp("10.0.0.5")
                .tags(List.of("login"))
                .timestamp(NOW.minusSeconds(5))
                .build();

        Event event = new EventPublisher(log, bus, CLOCK).publishAlertCreated(alert);

        assertThat(event.getId()).startsWith("evt-");
        assertThat(event.getType()).isEqualTo(AlertEvents.ALERT_CREATED);
        assertThat(event.getEntityId()).isEqualTo(42);
        assertThat(event.getEntityType()).isEqualTo(AlertEvents.ENTITY_ALERT);
        assertThat(event.getOrganizationId()).isEqualTo(7);
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.getData())
                .containsEntry("alertId", 42L)
                .containsEntry("severity", "high")
                .containsEntry("category", "authentication")
                .containsEntry("sourceIp", "10.0.0.5")
                .containsEntry("tags", List.of("login"))
                .doesNotContainKey("hostId");
        assertThat(log.consume("engine", Duration.ZERO)).extracting(Delivery::getEvent).containsExactly(event);
        assertThat(seen).containsExactly(event);
    }

    @Test
    @DisplayName("Events that already carry an id keep it")
    void shouldKeepExistingId() {
        InMemoryEventLog log = new InMemoryEventLog(3, CLOCK);

        Event event = new EventPublisher(log, new NotificationBus(), CLOCK)
                .publish(InMemoryEventLogTest.event("fixed-id", 1));

        assertThat(event.getId()).isEqualTo("fixed-id");
    }

    @Test
    @DisplayName("A failed durable append is not announced on the bus")
    void shouldNotNotifyBusWhenAppendFails() {
        NotificationBus bus = new NotificationBus();
        List<Event> seen = new ArrayList<>();
        bus.subscribe(NotificationBus.WILDCARD, seen::add);
        EventLog failing = new EventLog() {
            @Override
            public void publish(Event event) {
                throw new EventLogException("broker unavailable");
            }

            @Override
            public List<Delivery> consume(String consumerGroup, Duration timeout) {
                return List.of();
            }

            @Override
            public void ack(Delivery delivery) {
            }

            @Override
            public boolean nack(Delivery delivery, String reason) {
                return false;
            }
        };
        EventPublisher publisher = new EventPublisher(failing, bus, CLOCK);

        assertThatThrownBy(() -> publisher.publish(InMemoryEventLogTest.event("e1", 1)))
                .isInstanceOf(EventLogException.class)
                .hasMessage("broker unavailable");
        assertThat(seen).isEmpty();
    }
}
