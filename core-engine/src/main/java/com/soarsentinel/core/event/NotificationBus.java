package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process, synchronous publish/subscribe of events by type.
 *
 * <p>
 * Subscribers register for one event type or for {@link #WILDCARD}. Delivery
 * happens on the publishing thread; a subscriber that throws is logged and
 * does not prevent delivery to the others.
 * </p>
 */
public final class NotificationBus {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationBus.class);

    /** Subscribes to every event type. */
    public static final String WILDCARD = "*";

    private final Map<String, List<Consumer<Event>>> subscribers = new ConcurrentHashMap<>();

    /**
     * @return a handle that removes the subscription when run
     */
    public Runnable subscribe(String eventType, Consumer<Event> subscriber) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        List<Consumer<Event>> list = subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        list.add(subscriber);
        return () -> list.remove(subscriber);
    }

    /**
     * @return number of subscribers the event was delivered to
     */
    public int publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        int delivered = deliver(subscribers.get(event.getType()), event);
        if (!WILDCARD.equals(event.getType())) {
            delivered += deliver(subscribers.get(WILDCARD), event);
        }
        return delivered;
    }

    private static int deliver(List<Consumer<Event>> targets, Event event) {
        if (targets == null) {
            return 0;
        }
        int delivered = 0;
        for (Consumer<Event> subscriber : targets) {
            try {
                subscriber.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                LOG.warn("Subscriber failed for event {} ({}): {}", event.getId(), event.getType(),
                        e.getMessage(), e);
            }
        }
        return delivered;
    }
}
