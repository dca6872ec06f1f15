package com.soarsentinel.core.playbook;

/**
 * Identifies the execution and step on whose behalf an action runs.
 */
public final class ActionContext {

    private final long executionId;
    private final long playbookId;
    private final long organizationId;
    private final String stepKey;
    private final int attempt;
    private final boolean dryRun;

    public ActionContext(long executionId, long playbookId, long organizationId, String stepKey,
            int attempt, boolean dryRun) {
        this.executionId = executionId;
        this.playbookId = playbookId;
        this.organizationId = organizationId;
        this.stepKey = stepKey;
        this.attempt = attempt;
        this.dryRun = dryRun;
    }

    public long getExecutionId() {
        return executionId;
    }

    public long getPlaybookId() {
        return playbookId;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public String getStepKey() {
        return stepKey;
    }

    /**
     * @return one-based attempt number of the current call
     */
    public int getAttempt() {
        return attempt;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public String toString() {
        return "ActionContext{execution=" + executionId + ", playbook=" + playbookId
                + ", step='" + stepKey + "', attempt=" + attempt + (dryRun ? ", dryRun" : "") + '}';
    }
}
