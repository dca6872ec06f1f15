package com.soarsentinel.core.event;

/**
 * The event log could not accept or deliver events.
 */
public class EventLogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventLogException(String message) {
        super(message);
    }

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
