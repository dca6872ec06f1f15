package com.soarsentinel.core.playbook.actions;

import com.soarsentinel.core.playbook.ActionExecutionException;

import java.util.Map;

/**
 * Typed access to rendered action inputs.
 */
final class ActionInputs {

    private ActionInputs() {
        // utility class, not instantiable
    }

    static String requireString(Map<String, Object> inputs, String name, String actionId) {
        Object value = inputs.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new ActionExecutionException("Action '" + actionId + "' requires input '" + name + "'");
        }
        return value.toString().trim();
    }

    static String optionalString(Map<String, Object> inputs, String name, String defaultValue) {
        Object value = inputs.get(name);
        return value == null || value.toString().isBlank() ? defaultValue : value.toString();
    }

    static long optionalLong(Map<String, Object> inputs, String name, long defaultValue, String actionId) {
        Object value = inputs.get(name);
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ActionExecutionException(
                    "Action '" + actionId + "' input '" + name + "' is not a number: " + value, e);
        }
    }
}
