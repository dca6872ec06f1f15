package com.soarsentinel.core.playbook;

/**
 * Failure of a single action call. Handled by the executor according to the
 * step's error policy; never propagated out of an execution.
 */
public class ActionExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
