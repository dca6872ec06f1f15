package com.soarsentinel.core.binding;

/**
 * Thrown when an operation addresses a binding that does not exist in the
 * caller's organization.
 */
public class BindingNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long bindingId;

    public BindingNotFoundException(long bindingId) {
        super("Playbook binding not found: " + bindingId);
        this.bindingId = bindingId;
    }

    public long getBindingId() {
        return bindingId;
    }
}
