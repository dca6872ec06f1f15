package com.soarsentinel.core.playbook.actions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Firewall that only records its block list; for local runs and tests.
 */
public final class InMemoryFirewallClient implements FirewallClient {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryFirewallClient.class);

    private final Map<String, String> rulesByIp = new ConcurrentHashMap<>();

    @Override
    public String block(String ip, String reason, long durationSeconds) {
        String ruleId = "fw-" + UUID.randomUUID();
        rulesByIp.put(ip, ruleId);
        LOG.info("Blocked {} for {}s as rule {} ({})", ip, durationSeconds, ruleId, reason);
        return ruleId;
    }

    @Override
    public void unblock(String ip, String ruleId) {
        rulesByIp.remove(ip, ruleId);
        LOG.info("Removed block rule {} for {}", ruleId, ip);
    }

    public Set<String> blockedIps() {
        return Set.copyOf(rulesByIp.keySet());
    }

    public boolean isBlocked(String ip) {
        return rulesByIp.containsKey(ip);
    }
}
