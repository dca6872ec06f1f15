package com.soarsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Incident proposal derived 1:1 from a correlation pattern whose confidence
 * reached the coordinator's threshold.
 *
 * <p>
 * It only becomes a persisted incident if the storage collaborator accepts
 * it.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentSuggestion {

    public static final String STATUS_NEW = "new";

    private final String patternId;
    private final String title;
    private final String description;
    private final Severity severity;
    private final String status;
    private final List<Long> relatedAlertIds;
    private final List<TimelineEntry> timeline;
    private final List<String> mitreTactics;
    private final CorrelationTechnique technique;
    private final double confidence;
    private final String riskAssessment;
    private final List<String> recommendedActions;

    private IncidentSuggestion(Builder b) {
        this.patternId = Objects.requireNonNull(b.patternId, "patternId must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.description = b.description;
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.status = STATUS_NEW;
        this.relatedAlertIds = b.relatedAlertIds != null ? List.copyOf(b.relatedAlertIds) : List.of();
        this.timeline = b.timeline != null ? List.copyOf(b.timeline) : List.of();
        this.mitreTactics = b.mitreTactics != null ? List.copyOf(b.mitreTactics) : List.of();
        this.technique = Objects.requireNonNull(b.technique, "technique must not be null");
        this.confidence = b.confidence;
        this.riskAssessment = b.riskAssessment;
        this.recommendedActions = b.recommendedActions != null ? List.copyOf(b.recommendedActions) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPatternId() {
        return patternId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getStatus() {
        return status;
    }

    public List<Long> getRelatedAlertIds() {
        return relatedAlertIds;
    }

    /**
     * @return timeline sorted by ascending timestamp
     */
    public List<TimelineEntry> getTimeline() {
        return timeline;
    }

    public List<String> getMitreTactics() {
        return mitreTactics;
    }

    public CorrelationTechnique getTechnique() {
        return technique;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getRiskAssessment() {
        return riskAssessment;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    public static class Builder {
        private String patternId;
        private String title;
        private String description;
        private Severity severity;
        private List<Long> relatedAlertIds;
        private List<TimelineEntry> timeline;
        private List<String> mitreTactics;
        private CorrelationTechnique technique;
        private double confidence;
        private String riskAssessment;
        private List<String> recommendedActions;

        public Builder patternId(String patternId) {
            this.patternId = patternId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder relatedAlertIds(List<Long> relatedAlertIds) {
            this.relatedAlertIds = relatedAlertIds;
            return this;
        }

        public Builder timeline(List<TimelineEntry> timeline) {
            this.timeline = timeline;
            return this;
        }

        public Builder mitreTactics(List<String> mitreTactics) {
            this.mitreTactics = mitreTactics;
            return this;
        }

        public Builder technique(CorrelationTechnique technique) {
            this.technique = technique;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder riskAssessment(String riskAssessment) {
            this.riskAssessment = riskAssessment;
            return this;
        }

        public Builder recommendedActions(List<String> recommendedActions) {
            this.recommendedActions = recommendedActions;
            return this;
        }

        public IncidentSuggestion build() {
            return new IncidentSuggestion(this);
        }
    }

    @Override
    public String toString() {
        return "IncidentSuggestion{" +
                "patternId='" + patternId + '\'' +
                ", title='" + title + '\'' +
                ", severity=" + severity +
                ", relatedAlertIds=" + relatedAlertIds +
                ", confidence=" + String.format("%.3f", confidence) +
                '}';
    }
}
