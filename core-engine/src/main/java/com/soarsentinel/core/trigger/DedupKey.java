package com.soarsentinel.core.trigger;

import java.util.Objects;

/**
 * Identity of one dispatch: the pair (event id, binding id). At most one
 * playbook execution exists per key.
 */
public final class DedupKey {

    private final String eventId;
    private final long bindingId;

    public DedupKey(String eventId, long bindingId) {
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.bindingId = bindingId;
    }

    public String getEventId() {
        return eventId;
    }

    public long getBindingId() {
        return bindingId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DedupKey other))
            return false;
        return bindingId == other.bindingId && eventId.equals(other.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, bindingId);
    }

    @Override
    public String toString() {
        return eventId + "/" + bindingId;
    }
}
