package com.soarsentinel.core.playbook.actions;

import com.soarsentinel.core.playbook.Action;
import com.soarsentinel.core.playbook.ActionContext;
import com.soarsentinel.core.playbook.ActionExecutionException;

import java.util.Map;
import java.util.Objects;

/**
 * {@code isolate_host}: network-isolates {@code hostId} through the endpoint
 * console. Rollback releases the host.
 */
public final class IsolateHostAction implements Action {

    public static final String ID = "isolate_host";

    private final EndpointClient endpoints;

    public IsolateHostAction(EndpointClient endpoints) {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, ActionContext context) {
        String hostId = ActionInputs.requireString(inputs, "hostId", ID);
        String reason = ActionInputs.optionalString(inputs, "reason",
                "Isolated by playbook " + context.getPlaybookId());
        if (context.isDryRun()) {
            return Map.of("hostId", hostId, "isolationId", "dry-run");
        }
        String isolationId;
        try {
            isolationId = endpoints.isolate(hostId, reason);
        } catch (RuntimeException e) {
            throw new ActionExecutionException("Isolation of host " + hostId + " failed: " + e.getMessage(), e);
        }
        return Map.of("hostId", hostId, "isolationId", isolationId);
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
        String hostId = ActionInputs.requireString(output, "hostId", ID);
        String isolationId = ActionInputs.requireString(output, "isolationId", ID);
        try {
            endpoints.release(hostId, isolationId);
        } catch (RuntimeException e) {
            throw new ActionExecutionException("Release of host " + hostId + " failed: " + e.getMessage(), e);
        }
    }
}
