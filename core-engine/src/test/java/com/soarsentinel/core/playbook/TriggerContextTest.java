package com.soarsentinel.core.playbook;

import com.soarsentinel.core.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TriggerContext}.
 */
class TriggerContextTest {

    @Test
    @DisplayName("Namespace exposes the caller's step map as it fills")
    void shouldExposeStepOutputsAsTheyAreAdded() {
        Map<String, Object> steps = new LinkedHashMap<>();
        Map<String, Object> namespace = TriggerContext.manual(5, Map.of("host", "web-1")).newNamespace(steps);

        steps.put("isolate", Map.of("status", "completed"));

        assertThat(namespace.get("steps")).isSameAs(steps);
        assertThat(namespace).containsEntry("host", "web-1")
                .containsEntry("steps", Map.of("isolate", Map.of("status", "completed")));
    }

    @Test
    @DisplayName("Event triggers expose the event envelope under trigger")
    void shouldExposeEventEnvelope() {
        Event event = Event.builder()
                .id("evt-7")
                .type("alert.created")
                .entityType("alert")
                .entityId(3)
                .organizationId(5)
                .data(Map.of("severity", "high"))
                .build();

        Map<String, Object> namespace = TriggerContext.fromEvent(event, 2).newNamespace(new LinkedHashMap<>());

        assertThat(namespace).containsEntry("severity", "high");
        assertThat(namespace.get("trigger")).isInstanceOfSatisfying(Map.class, trigger -> {
            assertThat(trigger.get("id")).isEqualTo("evt-7");
            assertThat(trigger.get("type")).isEqualTo("alert.created");
        });
    }
}
