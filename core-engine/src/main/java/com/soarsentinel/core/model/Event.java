package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wire representation of a domain occurrence published to the event log.
 *
 * <p>
 * One domain occurrence produces exactly one event, e.g. one alert creation
 * produces one {@code alert.created} event. The {@code data} payload is a
 * free-form map so that binding predicates can address arbitrary fields
 * without a rigid schema.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is a mutable Jackson bean and is <strong>not</strong>
 * thread-safe. Once handed to the event log it must be treated as read-only.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {

    /** Unique event id; the first half of every dedup key. */
    private String id;

    /** Event type, e.g. {@code alert.created}. */
    private String type;

    private long entityId;

    /** Entity kind, e.g. {@code alert}. */
    private String entityType;

    /** Tenant and event-log partition key. */
    private long organizationId;

    private Instant timestamp;

    private Map<String, Object> data = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public Event() {
    }

    private Event(Builder b) {
        this.id = b.id;
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.entityId = b.entityId;
        this.entityType = Objects.requireNonNull(b.entityType, "entityType must not be null");
        this.organizationId = b.organizationId;
        this.timestamp = b.timestamp != null ? b.timestamp : Instant.now();
        setData(b.data);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Flatten this event into the map exposed as {@code trigger} to playbook
     * conditions and templates.
     *
     * @return new mutable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("type", type);
        map.put("entityId", entityId);
        map.put("entityType", entityType);
        map.put("organizationId", organizationId);
        map.put("timestamp", timestamp != null ? timestamp.toString() : null);
        map.put("data", new LinkedHashMap<>(data));
        return map;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public long getEntityId() {
        return entityId;
    }

    public void setEntityId(long entityId) {
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(long organizationId) {
        this.organizationId = organizationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * @return unmodifiable view of the payload
     */
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * Replace the payload (a copy is taken).
     *
     * @param data payload map, {@code null} means empty
     */
    public void setData(Map<String, Object> data) {
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
    }

    @JsonIgnore
    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String id;
        private String type;
        private long entityId;
        private String entityType;
        private long organizationId;
        private Instant timestamp;
        private Map<String, Object> data;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder entityId(long entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder organizationId(long organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        /**
         * @return a new {@link Event}
         * @throws NullPointerException if {@code type} or {@code entityType} is
         *                              missing
         */
        public Event build() {
            return new Event(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return entityId == that.entityId
                && organizationId == that.organizationId
                && Objects.equals(id, that.id)
                && Objects.equals(type, that.type)
                && Objects.equals(entityType, that.entityType)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, entityId, organizationId);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", entityType='" + entityType + '\'' +
                ", entityId=" + entityId +
                ", organizationId=" + organizationId +
                ", timestamp=" + timestamp +
                ", data=" + data +
                '}';
    }
}
