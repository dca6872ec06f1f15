package com.soarsentinel.core.trigger;

/**
 * The dispatch key was already claimed: the match has been processed
 * before. Benign.
 */
public class DedupConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient DedupKey key;

    public DedupConflictException(DedupKey key) {
        super("Already dispatched: " + key);
        this.key = key;
    }

    public DedupKey getKey() {
        return key;
    }
}
