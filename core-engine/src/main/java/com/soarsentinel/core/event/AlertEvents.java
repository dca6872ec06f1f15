package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for the {@code alert.created} wire event.
 *
 * <pre>
 * {type:"alert.created", entityId, entityType:"alert", organizationId, timestamp,
 *  data:{alertId, severity, category, sourceIp?, hostId?, hostname?, ...}}
 * </pre>
 *
 * <p>
 * Besides the required fields, {@code data} carries the title, source,
 * destination IP and tags so that binding predicates can address them.
 * Absent optional fields are omitted rather than set to {@code null}.
 * </p>
 */
public final class AlertEvents {

    public static final String ALERT_CREATED = "alert.created";
    public static final String ENTITY_ALERT = "alert";

    private AlertEvents() {
        // utility class, not instantiable
    }

    public static Event alertCreated(Alert alert, Instant publishedAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("alertId", alert.getId());
        data.put("severity", alert.getSeverity().label());
        data.put("category", alert.getCategory());
        putIfPresent(data, "sourceIp", alert.getSourceIp());
        putIfPresent(data, "hostId", alert.getHostId());
        putIfPresent(data, "hostname", alert.getHostname());
        putIfPresent(data, "destinationIp", alert.getDestinationIp());
        data.put("title", alert.getTitle());
        data.put("source", alert.getSource());
        data.put("tags", alert.getTags());

        return Event.builder()
                .type(ALERT_CREATED)
                .entityId(alert.getId())
                .entityType(ENTITY_ALERT)
                .organizationId(alert.getOrganizationId())
                .timestamp(publishedAt)
                .data(data)
                .build();
    }

    private static void putIfPresent(Map<String, Object> data, String key, String value) {
        if (value != null && !value.isBlank()) {
            data.put(key, value);
        }
    }
}
