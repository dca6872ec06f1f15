package com.soarsentinel.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Metric definitions for the response engine.
 * <p>
 * The process wires a Prometheus registry so the meters are scraped from
 * {@code /metrics}; tests and local runs use a {@link SimpleMeterRegistry}.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code soar_events_consumed_total} – events taken from the event log</li>
 *   <li>{@code soar_playbooks_dispatched_total} – playbook jobs enqueued</li>
 *   <li>{@code soar_dedup_hits_total} – matches skipped as already dispatched</li>
 *   <li>{@code soar_executions_total{status}} – finalised executions</li>
 *   <li>{@code soar_dead_letters_total{path}} – events or jobs given up on</li>
 *   <li>{@code soar_patterns_detected_total{technique}} – correlation patterns</li>
 *   <li>{@code soar_incident_suggestions_total} – suggestions handed to storage</li>
 *   <li>{@code soar_execution_duration} – timer of playbook run time</li>
 * </ul>
 */
public class SoarMetrics {

    private final MeterRegistry registry;
    private final Counter eventsConsumed;
    private final Counter playbooksDispatched;
    private final Counter dedupHits;
    private final Counter incidentSuggestions;
    private final Timer executionDuration;

    public SoarMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.eventsConsumed = registry.counter("soar_events_consumed_total");
        this.playbooksDispatched = registry.counter("soar_playbooks_dispatched_total");
        this.dedupHits = registry.counter("soar_dedup_hits_total");
        this.incidentSuggestions = registry.counter("soar_incident_suggestions_total");
        this.executionDuration = Timer.builder("soar_execution_duration")
                .description("Wall-clock duration of playbook executions")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Metrics backed by an in-memory registry, for tests and embedded use.
     */
    public static SoarMetrics inMemory() {
        return new SoarMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void incrementEventsConsumed() {
        eventsConsumed.increment();
    }

    public void incrementPlaybooksDispatched() {
        playbooksDispatched.increment();
    }

    public void incrementDedupHits() {
        dedupHits.increment();
    }

    public void recordExecution(String status, Duration duration) {
        registry.counter("soar_executions_total", "status", status).increment();
        if (duration != null) {
            executionDuration.record(duration);
        }
    }

    /**
     * @param path {@code event} or {@code job}
     */
    public void incrementDeadLetters(String path) {
        registry.counter("soar_dead_letters_total", "path", path).increment();
    }

    public void incrementPatternsDetected(String technique) {
        registry.counter("soar_patterns_detected_total", "technique", technique).increment();
    }

    public void incrementIncidentSuggestions() {
        incidentSuggestions.increment();
    }
}
