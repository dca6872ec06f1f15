package com.soarsentinel.core.playbook.actions;

import com.soarsentinel.core.playbook.Action;
import com.soarsentinel.core.playbook.ActionContext;
import com.soarsentinel.core.playbook.ActionExecutionException;

import java.util.Map;

/**
 * {@code delay}: pauses for {@code ms} milliseconds. Subject to the step
 * deadline like any other action.
 */
public final class DelayAction implements Action {

    public static final String ID = "delay";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, ActionContext context) {
        long ms = ActionInputs.optionalLong(inputs, "ms", 0L, ID);
        if (ms < 0) {
            throw new ActionExecutionException("Action 'delay' input 'ms' must not be negative: " + ms);
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionExecutionException("Delay interrupted", e);
        }
        return Map.of("delayedMs", ms);
    }
}
