package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Event;

import java.util.Objects;

/**
 * One event handed to a consumer, together with the handle used to
 * acknowledge it.
 */
public final class Delivery {

    private final Event event;
    private final int attempt;
    private final Object handle;

    /**
     * @param event   the delivered event
     * @param attempt one-based delivery attempt
     * @param handle  implementation-specific acknowledgement handle
     */
    public Delivery(Event event, int attempt, Object handle) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.attempt = attempt;
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    public Event getEvent() {
        return event;
    }

    public int getAttempt() {
        return attempt;
    }

    public Object getHandle() {
        return handle;
    }

    @Override
    public String toString() {
        return "Delivery{event=" + event.getId() + ", type=" + event.getType()
                + ", organizationId=" + event.getOrganizationId() + ", attempt=" + attempt + '}';
    }
}
