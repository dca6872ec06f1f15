package com.soarsentinel.core.playbook;

/**
 * An action call exceeded its step deadline. Treated like any other action
 * failure.
 */
public class ActionTimeoutException extends ActionExecutionException {

    private static final long serialVersionUID = 1L;

    private final long timeoutMs;

    public ActionTimeoutException(String actionId, long timeoutMs) {
        super("Action '" + actionId + "' timed out after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
