package com.soarsentinel.core.playbook.actions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Endpoint console that only records isolated hosts; for local runs and tests.
 */
public final class InMemoryEndpointClient implements EndpointClient {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEndpointClient.class);

    private final Map<String, String> isolations = new ConcurrentHashMap<>();

    @Override
    public String isolate(String hostId, String reason) {
        String isolationId = "iso-" + UUID.randomUUID();
        isolations.put(hostId, isolationId);
        LOG.info("Isolated host {} as {} ({})", hostId, isolationId, reason);
        return isolationId;
    }

    @Override
    public void release(String hostId, String isolationId) {
        isolations.remove(hostId, isolationId);
        LOG.info("Released host {} from isolation {}", hostId, isolationId);
    }

    public Set<String> isolatedHosts() {
        return Set.copyOf(isolations.keySet());
    }

    public boolean isIsolated(String hostId) {
        return isolations.containsKey(hostId);
    }
}
