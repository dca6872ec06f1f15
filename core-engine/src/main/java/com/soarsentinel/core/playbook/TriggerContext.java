package com.soarsentinel.core.playbook;

import com.soarsentinel.core.model.Event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What caused a playbook to run, and the data it runs against.
 *
 * <p>
 * The execution namespace seen by step conditions and input templates is
 * built from this context: the trigger data's fields at the root, the event
 * envelope under {@code trigger}, and step outcomes under {@code steps}.
 * </p>
 */
public final class TriggerContext {

    public static final String SOURCE_MANUAL = "manual";
    public static final String SOURCE_DRY_RUN = "dry_run";

    private final String source;
    private final long organizationId;
    private final long entityId;
    private final String eventId;
    private final Event event;
    private final Map<String, Object> data;

    private TriggerContext(String source, long organizationId, long entityId, String eventId,
            Event event, Map<String, Object> data) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.organizationId = organizationId;
        this.entityId = entityId;
        this.eventId = eventId;
        this.event = event;
        this.data = data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                : Map.of();
    }

    /**
     * Context for an event matched by a binding; the trigger source is
     * {@code binding:<id>}.
     */
    public static TriggerContext fromEvent(Event event, long bindingId) {
        Objects.requireNonNull(event, "event must not be null");
        return new TriggerContext("binding:" + bindingId, event.getOrganizationId(),
                event.getEntityId(), event.getId(), event, event.getData());
    }

    public static TriggerContext manual(long organizationId, Map<String, Object> data) {
        return new TriggerContext(SOURCE_MANUAL, organizationId, 0L, null, null, data);
    }

    static TriggerContext dryRun(long organizationId, Map<String, Object> data) {
        return new TriggerContext(SOURCE_DRY_RUN, organizationId, 0L, null, null, data);
    }

    /**
     * Build a fresh, mutable execution namespace.
     *
     * @param steps step outputs, exposed as {@code steps}; the caller keeps
     *              filling it as steps finish
     */
    Map<String, Object> newNamespace(Map<String, Object> steps) {
        Map<String, Object> namespace = new LinkedHashMap<>(data);
        namespace.put("trigger", event != null ? event.toMap() : manualTrigger());
        namespace.put("steps", steps);
        return namespace;
    }

    private Map<String, Object> manualTrigger() {
        Map<String, Object> trigger = new LinkedHashMap<>();
        trigger.put("type", source);
        trigger.put("organizationId", organizationId);
        trigger.put("data", new LinkedHashMap<>(data));
        return trigger;
    }

    public String getSource() {
        return source;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public long getEntityId() {
        return entityId;
    }

    public String getEventId() {
        return eventId;
    }

    public Event getEvent() {
        return event;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String toString() {
        return "TriggerContext{source='" + source + "', organizationId=" + organizationId
                + ", entityId=" + entityId + ", eventId='" + eventId + "'}";
    }
}
