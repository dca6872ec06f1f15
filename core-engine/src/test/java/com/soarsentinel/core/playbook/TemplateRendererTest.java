package com.soarsentinel.core.playbook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TemplateRenderer}.
 */
class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    private static final Map<String, Object> NAMESPACE = Map.of(
            "sourceIp", "10.0.0.5",
            "score", 87,
            "hosts", List.of("web-1", "web-2"),
            "steps", Map.of("lookup", Map.of("status", "completed", "output", Map.of("owner", "alice"))));

    @Test
    @DisplayName("A lone placeholder keeps the value's type")
    void shouldKeepTypeOfLonePlaceholder() {
        Map<String, Object> out = renderer.render(Map.of("score", "{{ score }}", "hosts", "{{hosts}}"), NAMESPACE);

        assertThat(out.get("score")).isEqualTo(87);
        assertThat(out.get("hosts")).isEqualTo(List.of("web-1", "web-2"));
    }

    @Test
    @DisplayName("Placeholders embedded in text are interpolated")
    void shouldInterpolateEmbeddedPlaceholders() {
        Map<String, Object> out = renderer.render(
                Map.of("message", "Blocked {{ sourceIp }} (score {{ score }}) for {{ steps.lookup.output.owner }}"),
                NAMESPACE);

        assertThat(out).containsEntry("message", "Blocked 10.0.0.5 (score 87) for alice");
    }

    @Test
    @DisplayName("Unresolved placeholders render as null alone and empty inside text")
    void shouldRenderMissingValues() {
        Map<String, Object> out = renderer.render(
                Map.of("alone", "{{ missing.path }}", "text", "host=[{{ hostId }}]"), NAMESPACE);

        assertThat(out).containsEntry("alone", null).containsEntry("text", "host=[]");
    }

    @Test
    @DisplayName("Nested maps and lists are rendered recursively")
    void shouldRenderNestedStructures() {
        Map<String, Object> out = renderer.render(Map.of(
                "target", Map.of("ip", "{{ sourceIp }}", "tags", List.of("ip:{{ sourceIp }}", 5))),
                NAMESPACE);

        assertThat(out.get("target")).isEqualTo(Map.of("ip", "10.0.0.5", "tags", List.of("ip:10.0.0.5", 5)));
    }

    @Test
    @DisplayName("Non-string values and text without placeholders pass through")
    void shouldPassThroughPlainValues() {
        Map<String, Object> out = renderer.render(Map.of("count", 3, "flag", true, "text", "plain {text}"), NAMESPACE);

        assertThat(out).containsEntry("count", 3).containsEntry("flag", true).containsEntry("text", "plain {text}");
    }

    @Test
    @DisplayName("Null inputs render to an empty map")
    void shouldHandleNullInputs() {
        assertThat(renderer.render(null, NAMESPACE)).isEmpty();
    }
}
