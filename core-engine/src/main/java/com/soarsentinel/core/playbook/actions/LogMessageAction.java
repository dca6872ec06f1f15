package com.soarsentinel.core.playbook.actions;

import com.soarsentinel.core.playbook.Action;
import com.soarsentinel.core.playbook.ActionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * {@code log_message}: writes {@code message} to the playbook log at the
 * given {@code level} (default {@code info}).
 */
public final class LogMessageAction implements Action {

    public static final String ID = "log_message";

    private static final Logger LOG = LoggerFactory.getLogger("com.soarsentinel.playbook");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, ActionContext context) {
        String message = ActionInputs.requireString(inputs, "message", ID);
        String level = ActionInputs.optionalString(inputs, "level", "info").toLowerCase(Locale.ROOT);
        switch (level) {
            case "debug" -> LOG.debug("[execution {}] {}", context.getExecutionId(), message);
            case "warn" -> LOG.warn("[execution {}] {}", context.getExecutionId(), message);
            case "error" -> LOG.error("[execution {}] {}", context.getExecutionId(), message);
            default -> LOG.info("[execution {}] {}", context.getExecutionId(), message);
        }
        return Map.of("message", message, "level", level);
    }
}
