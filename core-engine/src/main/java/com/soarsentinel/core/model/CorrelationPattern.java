package com.soarsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A grouping of alerts believed to represent one underlying security event.
 *
 * <p>
 * Patterns are ephemeral: they are produced per analysis run and are not
 * guaranteed to be stable across runs over changing data.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationPattern {

    private final String id;
    private final String name;
    private final String description;
    private final double confidence;
    private final List<PatternEntity> entities;
    private final CorrelationTechnique technique;
    private final List<String> rules;
    private final Map<String, Object> metadata;

    private CorrelationPattern(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.description = b.description;
        if (b.confidence < 0 || b.confidence > 1 || Double.isNaN(b.confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + b.confidence);
        }
        this.confidence = b.confidence;
        this.entities = b.entities != null ? List.copyOf(b.entities) : List.of();
        this.technique = Objects.requireNonNull(b.technique, "technique must not be null");
        this.rules = b.rules != null ? List.copyOf(b.rules) : List.of();
        this.metadata = b.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata))
                : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<PatternEntity> getEntities() {
        return entities;
    }

    public CorrelationTechnique getTechnique() {
        return technique;
    }

    public List<String> getRules() {
        return rules;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return ids of the alert entities, in entity order
     */
    public List<Long> alertIds() {
        return entities.stream().filter(PatternEntity::isAlert).map(PatternEntity::getId).toList();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private double confidence;
        private List<PatternEntity> entities;
        private CorrelationTechnique technique;
        private List<String> rules;
        private Map<String, Object> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder entities(List<PatternEntity> entities) {
            this.entities = entities;
            return this;
        }

        public Builder technique(CorrelationTechnique technique) {
            this.technique = technique;
            return this;
        }

        public Builder rules(List<String> rules) {
            this.rules = rules;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public CorrelationPattern build() {
            return new CorrelationPattern(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationPattern that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationPattern{" +
                "id='" + id + '\'' +
                ", technique=" + technique.label() +
                ", confidence=" + String.format("%.3f", confidence) +
                ", entities=" + entities +
                '}';
    }
}
