package com.soarsentinel.core.model;

import java.util.Locale;

/**
 * Lifecycle of a {@link PlaybookExecution}: {@code RUNNING} until finalised
 * exactly once into one of the terminal states.
 */
public enum ExecutionStatus {

    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
