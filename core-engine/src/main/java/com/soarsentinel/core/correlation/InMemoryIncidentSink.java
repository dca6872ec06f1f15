package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.IncidentSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link IncidentSink} that keeps suggestions in memory, for local runs and
 * tests.
 */
public final class InMemoryIncidentSink implements IncidentSink {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryIncidentSink.class);

    private final Map<Long, List<IncidentSuggestion>> byOrganization = new ConcurrentHashMap<>();

    @Override
    public void store(long organizationId, IncidentSuggestion suggestion) {
        byOrganization.computeIfAbsent(organizationId, k -> new CopyOnWriteArrayList<>()).add(suggestion);
        LOG.info("Incident suggested for organization {}: '{}' ({}, confidence {})", organizationId,
                suggestion.getTitle(), suggestion.getSeverity().label(), suggestion.getConfidence());
    }

    public List<IncidentSuggestion> suggestions(long organizationId) {
        return List.copyOf(byOrganization.getOrDefault(organizationId, List.of()));
    }
}
