package com.soarsentinel.core.playbook.actions;

/**
 * Perimeter firewall used by {@link BlockIpAction}.
 */
public interface FirewallClient {

    /**
     * @return an identifier of the created rule
     */
    String block(String ip, String reason, long durationSeconds);

    void unblock(String ip, String ruleId);
}
