package com.soarsentinel.service;

import com.soarsentinel.core.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventJsonCodec}.
 */
class EventJsonCodecTest {

    private final EventJsonCodec codec = new EventJsonCodec();

    @Test
    @DisplayName("Encoded events carry ISO timestamps and decode to an equal event")
    void shouldEncodeAndDecode() {
        Event event = Event.builder()
                .id("evt-1")
                .type("alert.created")
                .entityType("alert")
                .entityId(42)
                .organizationId(7)
                .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
                .data(Map.of("severity", "high", "tags", List.of("login")))
                .build();

        byte[] payload = codec.encode(event);

        assertThat(new String(payload, StandardCharsets.UTF_8))
                .contains("\"timestamp\":\"2024-03-01T10:00:00Z\"")
                .doesNotContain("hasId");
        assertThat(codec.decode(payload)).isEqualTo(event);
    }

    @Test
    @DisplayName("Unknown properties are ignored")
    void shouldIgnoreUnknownProperties() {
        String json = "{\"id\":\"evt-2\",\"type\":\"alert.created\",\"entityType\":\"alert\","
                + "\"organizationId\":3,\"schemaVersion\":2,\"data\":{\"severity\":\"low\"}}";

        Event event = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertThat(event.getId()).isEqualTo("evt-2");
        assertThat(event.getOrganizationId()).isEqualTo(3);
        assertThat(event.getData()).containsEntry("severity", "low");
    }

    @Test
    @DisplayName("Empty, malformed and typeless payloads are rejected")
    void shouldRejectInvalidPayloads() {
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Empty event payload");
        assertThatThrownBy(() -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Malformed event payload");
        assertThatThrownBy(() -> codec.decode("{\"id\":\"x\"}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Event payload has no type");
    }
}
