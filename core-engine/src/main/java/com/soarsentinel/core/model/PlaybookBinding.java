package com.soarsentinel.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Rule that maps an event type plus an optional predicate to a playbook.
 *
 * <p>
 * Bindings are created and edited by operators through the
 * {@code BindingRegistry}, which guarantees that a stored predicate always
 * compiles. The trigger engine only reads them.
 * </p>
 *
 * @since 1.0.0
 */
public final class PlaybookBinding {

    /**
     * Dispatch order: descending priority, ties broken by ascending id.
     */
    public static final Comparator<PlaybookBinding> DISPATCH_ORDER = Comparator
            .comparingInt(PlaybookBinding::getPriority).reversed()
            .thenComparingLong(PlaybookBinding::getId);

    private final long id;
    private final String eventType;
    private final String predicate;
    private final long playbookId;
    private final int priority;
    private final boolean active;
    private final long organizationId;
    private final String description;
    private final Instant createdAt;
    private final Instant updatedAt;

    private PlaybookBinding(Builder b) {
        this.id = b.id;
        this.eventType = b.eventType;
        this.predicate = b.predicate != null && !b.predicate.isBlank() ? b.predicate.trim() : null;
        this.playbookId = b.playbookId;
        this.priority = b.priority;
        this.active = b.active;
        this.organizationId = b.organizationId;
        this.description = b.description;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this binding's values
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .eventType(eventType)
                .predicate(predicate)
                .playbookId(playbookId)
                .priority(priority)
                .active(active)
                .organizationId(organizationId)
                .description(description)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public long getId() {
        return id;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * @return the predicate source, or {@code null} when the binding matches
     *         every event of its type
     */
    public String getPredicate() {
        return predicate;
    }

    public boolean hasPredicate() {
        return predicate != null;
    }

    public long getPlaybookId() {
        return playbookId;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isActive() {
        return active;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public static class Builder {
        private long id;
        private String eventType;
        private String predicate;
        private long playbookId;
        private int priority;
        private boolean active = true;
        private long organizationId;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder predicate(String predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder playbookId(long playbookId) {
            this.playbookId = playbookId;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder organizationId(long organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public PlaybookBinding build() {
            return new PlaybookBinding(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PlaybookBinding that))
            return false;
        return id == that.id
                && playbookId == that.playbookId
                && priority == that.priority
                && active == that.active
                && organizationId == that.organizationId
                && Objects.equals(eventType, that.eventType)
                && Objects.equals(predicate, that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, eventType, predicate, playbookId, priority, active, organizationId);
    }

    @Override
    public String toString() {
        return "PlaybookBinding{" +
                "id=" + id +
                ", eventType='" + eventType + '\'' +
                ", predicate='" + predicate + '\'' +
                ", playbookId=" + playbookId +
                ", priority=" + priority +
                ", active=" + active +
                ", organizationId=" + organizationId +
                '}';
    }
}
