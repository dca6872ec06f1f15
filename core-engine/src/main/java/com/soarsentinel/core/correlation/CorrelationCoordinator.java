package com.soarsentinel.core.correlation;

import com.soarsentinel.core.event.AlertFilter;
import com.soarsentinel.core.event.AlertRepository;
import com.soarsentinel.core.metrics.SoarMetrics;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.CorrelationPattern;
import com.soarsentinel.core.model.IncidentSuggestion;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.ThreatIntel;
import com.soarsentinel.core.model.TimelineEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs both correlators over the recent alerts of an organization and turns
 * qualifying patterns into incident suggestions.
 *
 * <h3>Run</h3>
 * <ol>
 * <li>Load unresolved alerts within the lookback window; skip the run if
 * fewer than {@code minAlerts}.</li>
 * <li>Merge temporal and graph patterns, sorted by confidence.</li>
 * <li>Map each pattern at or above the confidence threshold to an
 * {@link IncidentSuggestion} and hand it to the {@link IncidentSink}. A sink
 * failure for one suggestion is logged and the rest are still stored.</li>
 * </ol>
 *
 * <p>
 * The coordinator reads alerts and threat intel only; it shares no mutable
 * state with the trigger path.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationCoordinator.class);

    static final List<String> GENERIC_RECOMMENDATIONS = List.of(
            "Investigate the connections between these alerts",
            "Check whether other systems are affected by the same indicators",
            "Consider preventive blocks for the identified indicators");

    private final AlertRepository alerts;
    private final ThreatIntelSource threatIntel;
    private final IncidentSink sink;
    private final TemporalCorrelator temporal;
    private final GraphCorrelator graph;
    private final CorrelationOptions options;
    private final SoarMetrics metrics;
    private final Clock clock;

    public CorrelationCoordinator(AlertRepository alerts, ThreatIntelSource threatIntel, IncidentSink sink,
            TemporalCorrelator temporal, GraphCorrelator graph, CorrelationOptions options,
            SoarMetrics metrics, Clock clock) {
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.threatIntel = Objects.requireNonNull(threatIntel, "threatIntel must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.temporal = Objects.requireNonNull(temporal, "temporal must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Analyse every organization that owns alerts.
     */
    public List<CorrelationResult> analyzeAll() {
        List<CorrelationResult> results = new ArrayList<>();
        for (Long organizationId : alerts.organizationIds()) {
            try {
                results.add(analyze(organizationId));
            } catch (RuntimeException e) {
                LOG.error("Correlation failed for organization {}: {}", organizationId, e.getMessage(), e);
            }
        }
        return results;
    }

    /**
     * Analyse one organization and store the resulting suggestions.
     */
    public CorrelationResult analyze(long organizationId) {
        Instant since = clock.instant().minus(Duration.ofHours(options.getLookbackHours()));
        List<Alert> recent = alerts.listAlerts(
                AlertFilter.recentUnresolved(organizationId, since, options.getMaxAlerts()));
        if (recent.size() < options.getMinAlerts()) {
            LOG.info("Organization {}: {} recent unresolved alert(s), need {}; skipping correlation",
                    organizationId, recent.size(), options.getMinAlerts());
            return CorrelationResult.skipped(organizationId, recent.size());
        }

        CorrelationResult result = correlate(organizationId, recent, threatIntel.listThreatIntel(organizationId));
        int stored = 0;
        for (IncidentSuggestion suggestion : result.getSuggestions()) {
            try {
                sink.store(organizationId, suggestion);
                stored++;
                metrics.incrementIncidentSuggestions();
            } catch (RuntimeException e) {
                LOG.error("Failed to store incident suggestion '{}' for organization {}: {}",
                        suggestion.getTitle(), organizationId, e.getMessage(), e);
            }
        }
        LOG.info("Organization {}: analysed {} alert(s), {} pattern(s), {} suggestion(s), {} stored",
                organizationId, recent.size(), result.getPatterns().size(), result.getSuggestions().size(), stored);
        return result.withStored(stored);
    }

    /**
     * Correlate a given batch without touching storage.
     */
    public CorrelationResult correlate(long organizationId, List<Alert> batch, List<ThreatIntel> intel) {
        List<CorrelationPattern> patterns = new ArrayList<>(temporal.findPatterns(batch));
        patterns.addAll(graph.findPatterns(batch, intel));
        patterns.sort(Comparator.comparingDouble(CorrelationPattern::getConfidence).reversed()
                .thenComparing(CorrelationPattern::getId));
        patterns.forEach(p -> metrics.incrementPatternsDetected(p.getTechnique().label()));

        Map<Long, Alert> byId = batch.stream()
                .collect(Collectors.toMap(Alert::getId, Function.identity(), (a, b) -> a));
        List<IncidentSuggestion> suggestions = patterns.stream()
                .filter(p -> p.getConfidence() >= options.getConfidenceThreshold())
                .map(p -> toSuggestion(p, byId))
                .toList();
        return new CorrelationResult(organizationId, batch.size(), patterns, suggestions, 0);
    }

    // ---------------------------------------------------------------
    // Pattern → suggestion
    // ---------------------------------------------------------------

    IncidentSuggestion toSuggestion(CorrelationPattern pattern, Map<Long, Alert> byId) {
        List<Long> alertIds = pattern.alertIds();
        List<Alert> related = alertIds.stream().map(byId::get).filter(Objects::nonNull).toList();

        List<TimelineEntry> timeline = related.stream()
                .sorted(Comparator.comparing(Alert::getTimestamp).thenComparingLong(Alert::getId))
                .map(a -> new TimelineEntry(a.getTimestamp(), a.getId(), "Alert detected: " + a.getTitle()))
                .toList();

        List<String> recommendations = new ArrayList<>(GENERIC_RECOMMENDATIONS);
        for (Object ioc : listOf(pattern.getMetadata().get("primaryIocs"))) {
            recommendations.add("Block indicator " + ioc);
        }

        return IncidentSuggestion.builder()
                .patternId(pattern.getId())
                .title(pattern.getName())
                .description(String.format(Locale.ROOT,
                        "%s%n%nDetected by the \"%s\" correlation technique with %.1f%% confidence.",
                        pattern.getDescription(), pattern.getTechnique().label(), pattern.getConfidence() * 100))
                .severity(aggregateSeverity(related))
                .relatedAlertIds(alertIds)
                .timeline(timeline)
                .mitreTactics(mitreTactics(related))
                .technique(pattern.getTechnique())
                .confidence(pattern.getConfidence())
                .riskAssessment("Risk assessment based on the correlation of " + related.size() + " related alerts.")
                .recommendedActions(recommendations)
                .build();
    }

    /**
     * Critical if any alert is critical; high if high alerts outnumber medium
     * and low together; low if low alerts outnumber medium and high together;
     * otherwise medium.
     */
    static Severity aggregateSeverity(List<Alert> related) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Alert alert : related) {
            counts.merge(alert.getSeverity(), 1, Integer::sum);
        }
        int critical = counts.getOrDefault(Severity.CRITICAL, 0);
        int high = counts.getOrDefault(Severity.HIGH, 0);
        int medium = counts.getOrDefault(Severity.MEDIUM, 0);
        int low = counts.getOrDefault(Severity.LOW, 0);
        if (critical > 0) {
            return Severity.CRITICAL;
        }
        if (high > medium + low) {
            return Severity.HIGH;
        }
        if (low > medium + high) {
            return Severity.LOW;
        }
        return Severity.MEDIUM;
    }

    /**
     * Union of the tactics in each alert's {@code mitreTactics} or
     * {@code aiAnalysis.mitreTactics} metadata, in first-seen order.
     */
    static List<String> mitreTactics(List<Alert> related) {
        Set<String> tactics = new LinkedHashSet<>();
        for (Alert alert : related) {
            Map<String, Object> metadata = alert.getMetadata();
            addAll(tactics, metadata.get("mitreTactics"));
            if (metadata.get("aiAnalysis") instanceof Map<?, ?> analysis) {
                addAll(tactics, analysis.get("mitreTactics"));
            }
        }
        return List.copyOf(tactics);
    }

    private static void addAll(Set<String> target, Object value) {
        for (Object element : listOf(value)) {
            if (element != null) {
                target.add(element.toString());
            }
        }
    }

    private static List<?> listOf(Object value) {
        return value instanceof List<?> list ? list : List.of();
    }
}
