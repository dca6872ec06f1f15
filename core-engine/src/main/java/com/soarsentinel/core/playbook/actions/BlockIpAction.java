package com.soarsentinel.core.playbook.actions;

import com.soarsentinel.core.playbook.Action;
import com.soarsentinel.core.playbook.ActionContext;
import com.soarsentinel.core.playbook.ActionExecutionException;

import java.util.Map;
import java.util.Objects;

/**
 * {@code block_ip}: blocks {@code ip} at the firewall for
 * {@code durationSeconds} (default one day). Rollback removes the rule.
 */
public final class BlockIpAction implements Action {

    public static final String ID = "block_ip";

    private static final long DEFAULT_DURATION_SECONDS = 86_400;

    private final FirewallClient firewall;

    public BlockIpAction(FirewallClient firewall) {
        this.firewall = Objects.requireNonNull(firewall, "firewall must not be null");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, ActionContext context) {
        String ip = ActionInputs.requireString(inputs, "ip", ID);
        String reason = ActionInputs.optionalString(inputs, "reason",
                "Blocked by playbook " + context.getPlaybookId());
        long duration = ActionInputs.optionalLong(inputs, "durationSeconds", DEFAULT_DURATION_SECONDS, ID);
        if (context.isDryRun()) {
            return Map.of("ip", ip, "ruleId", "dry-run", "durationSeconds", duration);
        }
        String ruleId;
        try {
            ruleId = firewall.block(ip, reason, duration);
        } catch (RuntimeException e) {
            throw new ActionExecutionException("Firewall rejected block of " + ip + ": " + e.getMessage(), e);
        }
        return Map.of("ip", ip, "ruleId", ruleId, "durationSeconds", duration);
    }

    @Override
    public boolean supportsCompensation() {
        return true;
    }

    @Override
    public void compensate(Map<String, Object> output, ActionContext context) {
        if (context.isDryRun()) {
            return;
        }
        String ip = ActionInputs.requireString(output, "ip", ID);
        String ruleId = ActionInputs.requireString(output, "ruleId", ID);
        try {
            firewall.unblock(ip, ruleId);
        } catch (RuntimeException e) {
            throw new ActionExecutionException("Firewall rejected unblock of " + ip + ": " + e.getMessage(), e);
        }
    }
}
