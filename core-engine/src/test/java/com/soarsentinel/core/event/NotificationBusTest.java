package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NotificationBus}.
 */
class NotificationBusTest {

    private final NotificationBus bus = new NotificationBus();

    @Test
    @DisplayName("Subscribers receive events of their type and wildcard subscribers receive all")
    void shouldRouteByType() {
        List<String> typed = new ArrayList<>();
        List<String> all = new ArrayList<>();
        bus.subscribe(AlertEvents.ALERT_CREATED, e -> typed.add(e.getId()));
        bus.subscribe(NotificationBus.WILDCARD, e -> all.add(e.getId()));

        assertThat(bus.publish(InMemoryEventLogTest.event("e1", 1))).isEqualTo(2);
        assertThat(bus.publish(other("e2"))).isEqualTo(1);

        assertThat(typed).containsExactly("e1");
        assertThat(all).containsExactly("e1", "e2");
    }

    @Test
    @DisplayName("A failing subscriber does not stop delivery to the others")
    void shouldIsolateFailingSubscriber() {
        List<String> received = new ArrayList<>();
        bus.subscribe(AlertEvents.ALERT_CREATED, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(AlertEvents.ALERT_CREATED, e -> received.add(e.getId()));

        int delivered = bus.publish(InMemoryEventLogTest.event("e1", 1));

        assertThat(delivered).isEqualTo(1);
        assertThat(received).containsExactly("e1");
    }

    @Test
    @DisplayName("Running the subscription handle unsubscribes")
    void shouldUnsubscribe() {
        List<String> received = new ArrayList<>();
        Runnable unsubscribe = bus.subscribe(AlertEvents.ALERT_CREATED, e -> received.add(e.getId()));

        unsubscribe.run();

        assertThat(bus.publish(InMemoryEventLogTest.event("e1", 1))).isZero();
        assertThat(received).isEmpty();
    }

    private static Event other(String id) {
        return Event.builder().id(id).type("incident.created").entityType("incident").organizationId(1).build();
    }
}
