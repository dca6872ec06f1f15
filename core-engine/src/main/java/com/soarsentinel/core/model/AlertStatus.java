package com.soarsentinel.core.model;

import java.util.Locale;

/**
 * Lifecycle status of an alert. Transitions are owned by the ingestion
 * pipeline; this engine only reads it.
 */
public enum AlertStatus {

    NEW,
    ACKNOWLEDGED,
    IN_PROGRESS,
    RESOLVED;

    public boolean isResolved() {
        return this == RESOLVED;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
