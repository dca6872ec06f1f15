package com.soarsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One point on an incident suggestion's timeline.
 */
public final class TimelineEntry {

    private final Instant timestamp;
    private final long alertId;
    private final String description;

    public TimelineEntry(Instant timestamp, long alertId, String description) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.alertId = alertId;
        this.description = description;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getAlertId() {
        return alertId;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return timestamp + " " + description;
    }
}
