package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.CorrelationPattern;
import com.soarsentinel.core.model.CorrelationTechnique;
import com.soarsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TemporalCorrelator}.
 */
class TemporalCorrelatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final TemporalCorrelator correlator =
            new TemporalCorrelator(CorrelationOptions.defaults(), new EventTypeClassifier());

    @Test
    @DisplayName("Close, severe alerts from several sources form sequences, strongest first")
    void shouldFindSequences() {
        List<Alert> alerts = List.of(
                alert(3, "Malware dropped on host", Severity.CRITICAL, "edr", T0.plusSeconds(600)),
                alert(1, "Failed login burst", Severity.CRITICAL, "idp", T0),
                alert(2, "Exploit attempt", Severity.CRITICAL, "waf", T0.plusSeconds(300)));

        List<CorrelationPattern> patterns = correlator.findPatterns(alerts);

        assertThat(patterns).extracting(CorrelationPattern::getId)
                .containsExactlyInAnyOrder("temporal:1,2,3", "temporal:1,2", "temporal:2,3");
        CorrelationPattern best = patterns.get(0);
        assertThat(best.getId()).isEqualTo("temporal:1,2,3");
        assertThat(best.getTechnique()).isEqualTo(CorrelationTechnique.TEMPORAL);
        assertThat(best.getName()).isEqualTo("Event sequence: authentication -> exploit...");
        assertThat(best.getMetadata()).containsEntry("timespan", "10 minutes")
                .containsEntry("sequenceEvents", List.of("authentication", "exploit", "malware"));
        assertThat(best.alertIds()).containsExactly(1L, 2L, 3L);
        assertThat(best.getConfidence()).isGreaterThan(patterns.get(1).getConfidence());
    }

    @Test
    @DisplayName("Three alerts two minutes apart from one source still clear the threshold")
    void shouldCorrelateSingleSourceEscalation() {
        List<Alert> alerts = List.of(
                alert(1, "Suspicious process", Severity.HIGH, "edr", T0),
                alert(2, "Suspicious process", Severity.HIGH, "edr", T0.plus(Duration.ofMinutes(2))),
                alert(3, "Malware dropped on host", Severity.CRITICAL, "edr", T0.plus(Duration.ofMinutes(4))));

        List<CorrelationPattern> patterns = correlator.findPatterns(alerts);

        assertThat(patterns).filteredOn(p -> p.getId().equals("temporal:1,2,3")).singleElement()
                .satisfies(p -> {
                    assertThat(p.alertIds()).containsExactly(1L, 2L, 3L);
                    assertThat(p.getConfidence()).isGreaterThan(0.5).isCloseTo(0.529, within(0.001));
                    assertThat(p.getMetadata()).containsEntry("timespan", "4 minutes");
                });
    }

    @Test
    @DisplayName("Weak windows score at or below the threshold and are dropped")
    void shouldDropWeakWindows() {
        List<Alert> alerts = List.of(
                alert(1, "Odd thing", Severity.LOW, "sensor", T0),
                alert(2, "Odd thing", Severity.LOW, "sensor", T0.plus(Duration.ofHours(20))));

        assertThat(correlator.findPatterns(alerts)).isEmpty();
    }

    @Test
    @DisplayName("Alerts further apart than the time window never correlate")
    void shouldIgnoreAlertsOutsideWindow() {
        List<Alert> alerts = List.of(
                alert(1, "Failed login burst", Severity.CRITICAL, "idp", T0),
                alert(2, "Malware dropped", Severity.CRITICAL, "edr", T0.plus(Duration.ofHours(30))));

        assertThat(correlator.findPatterns(alerts)).isEmpty();
    }

    @Test
    @DisplayName("Fewer than two alerts yield no patterns")
    void shouldRequireTwoAlerts() {
        assertThat(correlator.findPatterns(List.of())).isEmpty();
        assertThat(correlator.findPatterns(List.of(alert(1, "x", Severity.CRITICAL, "idp", T0)))).isEmpty();
    }

    @Test
    @DisplayName("Scoring factors stay within their ranges")
    void shouldScoreFactors() {
        assertThat(TemporalCorrelator.timeFactor(0, 86_400_000L)).isEqualTo(1.0);
        assertThat(TemporalCorrelator.timeFactor(86_400_000L, 86_400_000L)).isZero();
        assertThat(TemporalCorrelator.sourceFactor(List.of(
                alert(1, "a", Severity.LOW, "s1", T0),
                alert(2, "b", Severity.LOW, "s2", T0),
                alert(3, "c", Severity.LOW, "s3", T0),
                alert(4, "d", Severity.LOW, "s4", T0)))).isEqualTo(1.0);
        assertThat(TemporalCorrelator.severityFactor(List.of(
                alert(1, "a", Severity.CRITICAL, "s", T0),
                alert(2, "b", Severity.MEDIUM, "s", T0)))).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Timespans are described in minutes, hours or days")
    void shouldDescribeTimespan() {
        assertThat(TemporalCorrelator.describeTimespan(Duration.ofMinutes(4))).isEqualTo("4 minutes");
        assertThat(TemporalCorrelator.describeTimespan(Duration.ofHours(2))).isEqualTo("2 hours");
        assertThat(TemporalCorrelator.describeTimespan(Duration.ofMinutes(125))).isEqualTo("2 hours 5 minutes");
        assertThat(TemporalCorrelator.describeTimespan(Duration.ofHours(27))).isEqualTo("1 days 3 hours");
    }

    static Alert alert(long id, String title, Severity severity, String source, Instant timestamp) {
        return Alert.builder()
                .id(id)
                .organizationId(1)
                .title(title)
                .severity(severity)
                .source(source)
                .timestamp(timestamp)
                .build();
    }
}
