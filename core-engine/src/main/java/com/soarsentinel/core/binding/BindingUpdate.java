package com.soarsentinel.core.binding;

import java.util.Optional;

/**
 * Partial update of a binding: only the fields that were set are applied.
 *
 * <p>
 * Setting the predicate to a blank string removes it, so that the binding
 * matches every event of its type.
 * </p>
 */
public final class BindingUpdate {

    private String eventType;
    private String predicate;
    private Long playbookId;
    private Integer priority;
    private Boolean active;
    private String description;

    public BindingUpdate eventType(String eventType) {
        this.eventType = eventType;
        return this;
    }

    public BindingUpdate predicate(String predicate) {
        this.predicate = predicate;
        return this;
    }

    public BindingUpdate playbookId(long playbookId) {
        this.playbookId = playbookId;
        return this;
    }

    public BindingUpdate priority(int priority) {
        this.priority = priority;
        return this;
    }

    public BindingUpdate active(boolean active) {
        this.active = active;
        return this;
    }

    public BindingUpdate description(String description) {
        this.description = description;
        return this;
    }

    Optional<String> eventType() {
        return Optional.ofNullable(eventType);
    }

    Optional<String> predicate() {
        return Optional.ofNullable(predicate);
    }

    Optional<Long> playbookId() {
        return Optional.ofNullable(playbookId);
    }

    Optional<Integer> priority() {
        return Optional.ofNullable(priority);
    }

    Optional<Boolean> active() {
        return Optional.ofNullable(active);
    }

    Optional<String> description() {
        return Optional.ofNullable(description);
    }
}
