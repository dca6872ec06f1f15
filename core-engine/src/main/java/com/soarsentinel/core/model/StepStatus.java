package com.soarsentinel.core.model;

import java.util.Locale;

/**
 * Outcome of a single playbook step.
 */
public enum StepStatus {

    COMPLETED,
    FAILED,
    SKIPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
