package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Emits domain events to the durable {@link EventLog} and the in-process
 * {@link NotificationBus}.
 *
 * <p>
 * The durable append happens first. If it fails the exception propagates
 * and the bus is not notified, so in-process listeners never see an event
 * that the trigger engine will not.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(EventPublisher.class);

    private final EventLog eventLog;
    private final NotificationBus bus;
    private final Clock clock;

    public EventPublisher(EventLog eventLog, NotificationBus bus, Clock clock) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Publish the {@code alert.created} event of a newly persisted alert.
     *
     * @return the published event
     * @throws EventLogException if the durable append fails
     */
    public Event publishAlertCreated(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        return publish(AlertEvents.alertCreated(alert, clock.instant()));
    }

    /**
     * Publish an event, assigning an {@code evt-<uuid>} id if it has none.
     *
     * @return the published event
     * @throws EventLogException if the durable append fails
     */
    public Event publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!event.hasId()) {
            event.setId("evt-" + UUID.randomUUID());
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(clock.instant());
        }
        eventLog.publish(event);
        int subscribers = bus.publish(event);
        LOG.debug("Published event {} ({}) for organization {} to log and {} subscriber(s)",
                event.getId(), event.getType(), event.getOrganizationId(), subscribers);
        return event;
    }
}
