package com.soarsentinel.core.trigger;

/**
 * A playbook job could not be enqueued. The triggering event is redelivered
 * and the dispatch retried.
 */
public class DispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
