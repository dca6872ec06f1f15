package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.IncidentSuggestion;

/**
 * Storage collaborator that turns accepted suggestions into incidents.
 */
@FunctionalInterface
public interface IncidentSink {

    /**
     * @throws RuntimeException if the suggestion cannot be stored; the
     *                          coordinator logs it and carries on
     */
    void store(long organizationId, IncidentSuggestion suggestion);
}
