package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.CorrelationPattern;
import com.soarsentinel.core.model.IncidentSuggestion;

import java.util.List;

/**
 * Outcome of one correlation run: every pattern found, ranked by
 * confidence, and the suggestions derived from those above the threshold.
 */
public final class CorrelationResult {

    private final long organizationId;
    private final int analyzedAlerts;
    private final List<CorrelationPattern> patterns;
    private final List<IncidentSuggestion> suggestions;
    private final int stored;

    CorrelationResult(long organizationId, int analyzedAlerts, List<CorrelationPattern> patterns,
            List<IncidentSuggestion> suggestions, int stored) {
        this.organizationId = organizationId;
        this.analyzedAlerts = analyzedAlerts;
        this.patterns = List.copyOf(patterns);
        this.suggestions = List.copyOf(suggestions);
        this.stored = stored;
    }

    static CorrelationResult skipped(long organizationId, int analyzedAlerts) {
        return new CorrelationResult(organizationId, analyzedAlerts, List.of(), List.of(), 0);
    }

    CorrelationResult withStored(int storedCount) {
        return new CorrelationResult(organizationId, analyzedAlerts, patterns, suggestions, storedCount);
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public int getAnalyzedAlerts() {
        return analyzedAlerts;
    }

    public List<CorrelationPattern> getPatterns() {
        return patterns;
    }

    public List<IncidentSuggestion> getSuggestions() {
        return suggestions;
    }

    /**
     * @return number of suggestions the sink accepted
     */
    public int getStored() {
        return stored;
    }

    @Override
    public String toString() {
        return "CorrelationResult{organizationId=" + organizationId + ", analyzedAlerts=" + analyzedAlerts
                + ", patterns=" + patterns.size() + ", suggestions=" + suggestions.size()
                + ", stored=" + stored + '}';
    }
}
