package com.soarsentinel.core.model;

/**
 * Family of algorithm that produced a correlation pattern.
 */
public enum CorrelationTechnique {

    TEMPORAL("temporal"),
    SPATIAL("spatial"),
    BEHAVIORAL("behavioral"),
    GRAPH_BASED("graph_based"),
    STATISTICAL("statistical"),
    HYBRID("hybrid");

    private final String label;

    CorrelationTechnique(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
