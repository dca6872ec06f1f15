package com.soarsentinel.core.event;

import java.time.Instant;

/**
 * Query for {@link AlertRepository#listAlerts(AlertFilter)}.
 */
public final class AlertFilter {

    private final long organizationId;
    private final Instant since;
    private final boolean unresolvedOnly;
    private final int limit;

    private AlertFilter(long organizationId, Instant since, boolean unresolvedOnly, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        this.organizationId = organizationId;
        this.since = since;
        this.unresolvedOnly = unresolvedOnly;
        this.limit = limit;
    }

    /**
     * Unresolved alerts of an organization with a timestamp at or after
     * {@code since}.
     */
    public static AlertFilter recentUnresolved(long organizationId, Instant since, int limit) {
        return new AlertFilter(organizationId, since, true, limit);
    }

    public static AlertFilter all(long organizationId) {
        return new AlertFilter(organizationId, null, false, Integer.MAX_VALUE);
    }

    public long getOrganizationId() {
        return organizationId;
    }

    /**
     * @return inclusive lower bound on the alert timestamp, or {@code null}
     */
    public Instant getSince() {
        return since;
    }

    public boolean isUnresolvedOnly() {
        return unresolvedOnly;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "AlertFilter{organizationId=" + organizationId + ", since=" + since
                + ", unresolvedOnly=" + unresolvedOnly + ", limit=" + limit + '}';
    }
}
