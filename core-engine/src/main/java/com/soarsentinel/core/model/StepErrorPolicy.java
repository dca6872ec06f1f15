package com.soarsentinel.core.model;

import java.util.Locale;

/**
 * What the playbook executor does when a step's action fails.
 */
public enum StepErrorPolicy {

    /** Stop the playbook and mark the execution failed. */
    ABORT,

    /** Record the failure and proceed with the next step. */
    CONTINUE,

    /**
     * Compensate every previously succeeded step in reverse order, then mark
     * the execution failed.
     */
    ROLLBACK;

    /**
     * @param value policy label, {@code null} or blank means {@link #ABORT}
     * @return parsed policy
     * @throws IllegalArgumentException if the label is unknown
     */
    public static StepErrorPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return ABORT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown onError policy: '" + value
                    + "'. Supported: abort, continue, rollback", e);
        }
    }
}
