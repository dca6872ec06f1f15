package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.CorrelationPattern;
import com.soarsentinel.core.model.CorrelationTechnique;
import com.soarsentinel.core.model.PatternEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds runs of alerts that are close in time and jointly significant.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Sort alerts by timestamp.</li>
 * <li>For every window size {@code 2..min(5, n)}, slide a window across the
 * sorted alerts and keep windows whose span is within the time window.</li>
 * <li>Score each window:
 * {@code 0.4 * timeFactor + 0.4 * severityFactor + 0.2 * sourceFactor}, where
 * {@code timeFactor = 1 - ln(span + 1) / ln(window + 1)} (milliseconds,
 * clamped to [0, 1]), {@code severityFactor} is the mean severity weight and
 * {@code sourceFactor = min(1, distinctSources / 3)}.</li>
 * <li>Emit windows scoring above {@value #SEQUENCE_THRESHOLD}, once per set of
 * alerts, highest confidence first.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class TemporalCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalCorrelator.class);

    static final double SEQUENCE_THRESHOLD = 0.5;
    private static final int MAX_WINDOW = 5;
    private static final String ROLE = "sequence_member";

    private final CorrelationOptions options;
    private final EventTypeClassifier classifier;

    public TemporalCorrelator(CorrelationOptions options, EventTypeClassifier classifier) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public List<CorrelationPattern> findPatterns(List<Alert> input) {
        Objects.requireNonNull(input, "alerts must not be null");
        if (input.size() < 2) {
            return List.of();
        }
        List<Alert> alerts = new ArrayList<>(input);
        alerts.sort(Comparator.comparing(Alert::getTimestamp).thenComparingLong(Alert::getId));

        long windowMs = options.timeWindowMillis();
        List<CorrelationPattern> candidates = new ArrayList<>();
        for (int size = 2; size <= Math.min(MAX_WINDOW, alerts.size()); size++) {
            for (int start = 0; start + size <= alerts.size(); start++) {
                List<Alert> window = alerts.subList(start, start + size);
                long spanMs = spanMillis(window);
                if (spanMs > windowMs) {
                    continue;
                }
                double confidence = 0.4 * timeFactor(spanMs, windowMs)
                        + 0.4 * severityFactor(window)
                        + 0.2 * sourceFactor(window);
                if (confidence > SEQUENCE_THRESHOLD) {
                    candidates.add(toPattern(window, confidence, spanMs));
                }
            }
        }

        candidates.sort(Comparator.comparingDouble(CorrelationPattern::getConfidence).reversed()
                .thenComparing(CorrelationPattern::getId));
        Set<Set<Long>> seen = new HashSet<>();
        List<CorrelationPattern> patterns = new ArrayList<>();
        for (CorrelationPattern candidate : candidates) {
            if (seen.add(new HashSet<>(candidate.alertIds()))) {
                patterns.add(candidate);
            }
        }
        LOG.debug("Temporal correlation over {} alert(s) produced {} pattern(s)", alerts.size(), patterns.size());
        return patterns;
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    static double timeFactor(long spanMs, long windowMs) {
        double factor = 1.0 - Math.log(spanMs + 1.0) / Math.log(windowMs + 1.0);
        return Math.max(0.0, Math.min(1.0, factor));
    }

    static double severityFactor(List<Alert> window) {
        return window.stream().mapToDouble(a -> a.getSeverity().weight()).average().orElse(0.0);
    }

    static double sourceFactor(List<Alert> window) {
        long distinct = window.stream().map(Alert::getSource).distinct().count();
        return Math.min(1.0, distinct / 3.0);
    }

    /**
     * @return a human-readable span such as {@code 4 minutes},
     *         {@code 2 hours 5 minutes} or {@code 1 days 3 hours}
     */
    static String describeTimespan(Duration span) {
        long minutes = Math.round(span.toMillis() / 60_000.0);
        if (minutes < 60) {
            return minutes + " minutes";
        }
        if (minutes < 1_440) {
            long hours = minutes / 60;
            long rest = minutes % 60;
            return hours + " hours" + (rest > 0 ? " " + rest + " minutes" : "");
        }
        long days = minutes / 1_440;
        long hours = (minutes % 1_440) / 60;
        return days + " days" + (hours > 0 ? " " + hours + " hours" : "");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private CorrelationPattern toPattern(List<Alert> window, double confidence, long spanMs) {
        List<String> events = window.stream().map(classifier::classify).toList();
        String sequence = String.join(" -> ", events);
        String name = "Event sequence: " + String.join(" -> ", events.subList(0, 2))
                + (events.size() > 2 ? "..." : "");
        String id = "temporal:" + new TreeSet<>(window.stream().map(Alert::getId).toList()).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sequenceEvents", events);
        metadata.put("timespan", describeTimespan(Duration.ofMillis(spanMs)));

        return CorrelationPattern.builder()
                .id(id)
                .name(name)
                .description("Temporal pattern across " + window.size() + " related events. The sequence "
                        + sequence + " suggests a coordinated campaign.")
                .confidence(confidence)
                .entities(window.stream().map(a -> new PatternEntity(PatternEntity.ALERT, a.getId(), ROLE)).toList())
                .technique(CorrelationTechnique.TEMPORAL)
                .rules(List.of("temporal_sequence", "causality_analysis"))
                .metadata(metadata)
                .build();
    }

    private static long spanMillis(List<Alert> window) {
        return Duration.between(window.get(0).getTimestamp(), window.get(window.size() - 1).getTimestamp()).toMillis();
    }
}
