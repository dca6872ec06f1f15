package com.soarsentinel.core.predicate;

import com.soarsentinel.core.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PredicateEvaluator}.
 */
class PredicateEvaluatorTest {

    private PredicateEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new PredicateEvaluator();
    }

    @Test
    @DisplayName("Equality matches the same string and rejects another")
    void shouldMatchStringEquality() {
        assertThat(evaluator.evaluate("severity == 'high'", event(Map.of("severity", "high")))).isTrue();
        assertThat(evaluator.evaluate("severity == 'high'", event(Map.of("severity", "low")))).isFalse();
    }

    @Test
    @DisplayName("contains() matches an element of a list field")
    void shouldMatchListContainment() {
        Event event = event(Map.of("tags", List.of("ransomware", "x")));

        assertThat(evaluator.evaluate("tags.contains('ransomware')", event)).isTrue();
        assertThat(evaluator.evaluate("tags.contains('phishing')", event)).isFalse();
    }

    @Test
    @DisplayName("contains() on a string field tests for a substring")
    void shouldMatchSubstring() {
        Event event = event(Map.of("title", "Possible ransomware dropper"));

        assertThat(evaluator.evaluate("title.contains('ransomware')", event)).isTrue();
    }

    @Test
    @DisplayName("Boolean combinators honour precedence: && binds tighter than ||")
    void shouldApplyPrecedence() {
        Map<String, Object> data = Map.of("severity", "low", "category", "malware", "score", 9);

        assertThat(evaluator.evaluate("severity == 'high' || category == 'malware' && score == 9",
                event(data))).isTrue();
        assertThat(evaluator.evaluate("(severity == 'high' || category == 'malware') && score == 1",
                event(data))).isFalse();
        assertThat(evaluator.evaluate("!(severity == 'high')", event(data))).isTrue();
    }

    @Test
    @DisplayName("Numbers compare by value across integer and decimal forms")
    void shouldCompareNumbersByValue() {
        Event event = event(Map.of("count", 3L, "ratio", 0.5));

        assertThat(evaluator.evaluate("count == 3.0", event)).isTrue();
        assertThat(evaluator.evaluate("ratio == 0.50", event)).isTrue();
        assertThat(evaluator.evaluate("count != 4", event)).isTrue();
    }

    @Test
    @DisplayName("Nested fields are addressed with dots")
    void shouldResolveNestedPaths() {
        Event event = event(Map.of("host", Map.of("os", Map.of("family", "windows"))));

        assertThat(evaluator.evaluate("host.os.family == 'windows'", event)).isTrue();
    }

    @Test
    @DisplayName("A missing field is a non-match, not an error")
    void shouldTreatMissingFieldAsNonMatch() {
        Event event = event(Map.of("severity", "high"));

        assertThat(evaluator.evaluate("sourceIp == '10.0.0.1'", event)).isFalse();
        assertThat(evaluator.evaluate("sourceIp != '10.0.0.1'", event)).isFalse();
    }

    @Test
    @DisplayName("?? supplies a default for a missing field")
    void shouldUseDefaultForMissingField() {
        Event event = event(Map.of("severity", "high"));

        assertThat(evaluator.evaluate("(category ?? 'none') == 'none'", event)).isTrue();
        assertThat(evaluator.evaluate("(enabled ?? false) == false", event)).isTrue();
    }

    @Test
    @DisplayName("Null or blank predicates match every event")
    void shouldMatchWhenPredicateAbsent() {
        Event event = event(Map.of());

        assertThat(evaluator.evaluate(null, event)).isTrue();
        assertThat(evaluator.evaluate("   ", event)).isTrue();
    }

    @Test
    @DisplayName("A non-boolean result is a non-match")
    void shouldRejectNonBooleanResult() {
        assertThat(evaluator.evaluate("severity", event(Map.of("severity", "high")))).isFalse();
    }

    @Test
    @DisplayName("Strict evaluation reports the missing field")
    void shouldThrowOnMissingFieldWhenStrict() {
        CompiledPredicate predicate = evaluator.compile("sourceIp == '10.0.0.1'");

        assertThatThrownBy(() -> predicate.test(Map.of()))
                .isInstanceOf(PredicateEvaluationException.class)
                .hasMessageContaining("sourceIp");
        assertThat(predicate.matches(Map.of())).isFalse();
    }

    @Test
    @DisplayName("Malformed predicates fail with the offending position")
    void shouldRejectMalformedPredicate() {
        assertThatThrownBy(() -> evaluator.validate("severity == "))
                .isInstanceOf(PredicateSyntaxException.class);
        assertThatThrownBy(() -> evaluator.validate("severity = 'high'"))
                .isInstanceOfSatisfying(PredicateSyntaxException.class,
                        e -> assertThat(e.getPosition()).isEqualTo(9));
        assertThatThrownBy(() -> evaluator.validate("tags.contains('a'"))
                .isInstanceOf(PredicateSyntaxException.class);
        assertThatThrownBy(() -> evaluator.validate("severity == 'high"))
                .isInstanceOf(PredicateSyntaxException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    @DisplayName("Syntax errors surface from evaluate() as well")
    void shouldPropagateSyntaxErrorFromEvaluate() {
        assertThatThrownBy(() -> evaluator.evaluate("&& x", event(Map.of())))
                .isInstanceOf(PredicateSyntaxException.class);
    }

    @Test
    @DisplayName("Deeply nested predicates are rejected")
    void shouldBoundNestingDepth() {
        String predicate = "(".repeat(PredicateParser.MAX_DEPTH + 1) + "true"
                + ")".repeat(PredicateParser.MAX_DEPTH + 1);

        assertThatThrownBy(() -> evaluator.validate(predicate))
                .isInstanceOf(PredicateSyntaxException.class)
                .hasMessageContaining("nesting");
    }

    @Test
    @DisplayName("Compiled predicates are cached by their trimmed text")
    void shouldCacheCompiledPredicates() {
        CompiledPredicate first = evaluator.compile("severity == 'high'");
        CompiledPredicate second = evaluator.compile("  severity == 'high'  ");

        assertThat(second).isSameAs(first);
        assertThat(evaluator.cacheSize()).isEqualTo(1);
    }

    private static Event event(Map<String, Object> data) {
        return Event.builder()
                .id("evt-1")
                .type("alert.created")
                .entityType("alert")
                .entityId(1)
                .organizationId(1)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .data(data)
                .build();
    }
}
