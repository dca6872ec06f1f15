package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.ThreatIntel;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ThreatIntelSource} backed by a map, for local runs and tests.
 */
public final class InMemoryThreatIntelSource implements ThreatIntelSource {

    private final Map<Long, List<ThreatIntel>> byOrganization = new ConcurrentHashMap<>();

    public void add(long organizationId, ThreatIntel intel) {
        byOrganization.computeIfAbsent(organizationId, k -> new CopyOnWriteArrayList<>()).add(intel);
    }

    @Override
    public List<ThreatIntel> listThreatIntel(long organizationId) {
        return List.copyOf(byOrganization.getOrDefault(organizationId, List.of()));
    }
}
