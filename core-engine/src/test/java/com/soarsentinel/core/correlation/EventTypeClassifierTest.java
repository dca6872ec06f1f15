package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventTypeClassifier}.
 */
class EventTypeClassifierTest {

    private final EventTypeClassifier classifier = new EventTypeClassifier();

    @Test
    @DisplayName("Keywords in the title select the event type")
    void shouldClassifyByTitle() {
        assertThat(classifier.classify(alert("Failed LOGIN burst", null, "auth-service"))).isEqualTo("authentication");
        assertThat(classifier.classify(alert("Malware beacon observed", null, "sensor"))).isEqualTo("malware");
        assertThat(classifier.classify(alert("Port scan from external host", null, "sensor")))
                .isEqualTo("reconnaissance");
        assertThat(classifier.classify(alert("Outbound C2 traffic", null, "sensor")))
                .isEqualTo("command_and_control");
    }

    @Test
    @DisplayName("The first matching rule wins")
    void shouldPreferEarlierRule() {
        assertThat(classifier.classify(alert("Suspicious login followed by malware", null, "sensor")))
                .isEqualTo("authentication");
    }

    @Test
    @DisplayName("Keywords in the description are considered")
    void shouldClassifyByDescription() {
        assertThat(classifier.classify(alert("Odd thing", "Possible data exfiltration", "sensor")))
                .isEqualTo("data_movement");
    }

    @Test
    @DisplayName("Falls back to the security product named in the source")
    void shouldFallBackToSource() {
        assertThat(classifier.classify(alert("Odd thing", null, "Firewall east"))).isEqualTo("firewall");
    }

    @Test
    @DisplayName("Unrecognised alerts are generic events")
    void shouldReturnGeneric() {
        assertThat(classifier.classify(alert("Odd thing", null, "custom")))
                .isEqualTo(EventTypeClassifier.GENERIC);
    }

    private static Alert alert(String title, String description, String source) {
        return Alert.builder()
                .id(1)
                .organizationId(1)
                .title(title)
                .description(description)
                .severity(Severity.MEDIUM)
                .source(source)
                .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }
}
