package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, ordered from most to least severe.
 *
 * <p>
 * Each level carries the weight used by the temporal correlator's severity
 * factor.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL(1.0),
    HIGH(0.75),
    MEDIUM(0.5),
    LOW(0.25);

    private final double weight;

    Severity(double weight) {
        this.weight = weight;
    }

    /**
     * @return correlation weight in {@code (0, 1]}
     */
    public double weight() {
        return weight;
    }

    /**
     * @return lowercase wire label, e.g. {@code "critical"}
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity label, case-insensitively.
     *
     * @param value label such as {@code "high"}; must not be {@code null}
     * @return the matching severity
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: critical, high, medium, low", e);
        }
    }
}
