package com.soarsentinel.core.correlation;

/**
 * Tuning shared by the correlators and the coordinator.
 *
 * <p>
 * Immutable; use {@link #builder()} or {@link #defaults()}. The builder
 * validates ranges at {@link Builder#build()} time.
 * </p>
 */
public final class CorrelationOptions {

    private final int timeWindowHours;
    private final double confidenceThreshold;
    private final int lookbackHours;
    private final int minAlerts;
    private final int maxAlerts;

    private CorrelationOptions(Builder b) {
        this.timeWindowHours = b.timeWindowHours;
        this.confidenceThreshold = b.confidenceThreshold;
        this.lookbackHours = b.lookbackHours;
        this.minAlerts = b.minAlerts;
        this.maxAlerts = b.maxAlerts;
    }

    public static CorrelationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return maximum span of a temporal sequence and of a same-source edge
     */
    public int getTimeWindowHours() {
        return timeWindowHours;
    }

    public long timeWindowMillis() {
        return timeWindowHours * 3_600_000L;
    }

    /**
     * @return minimum pattern confidence for an incident suggestion
     */
    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public int getMinAlerts() {
        return minAlerts;
    }

    public int getMaxAlerts() {
        return maxAlerts;
    }

    @Override
    public String toString() {
        return "CorrelationOptions{timeWindowHours=" + timeWindowHours
                + ", confidenceThreshold=" + confidenceThreshold
                + ", lookbackHours=" + lookbackHours
                + ", minAlerts=" + minAlerts
                + ", maxAlerts=" + maxAlerts + '}';
    }

    public static class Builder {
        private int timeWindowHours = 24;
        private double confidenceThreshold = 0.65;
        private int lookbackHours = 24;
        private int minAlerts = 3;
        private int maxAlerts = 1_000;

        public Builder timeWindowHours(int v) {
            this.timeWindowHours = v;
            return this;
        }

        public Builder confidenceThreshold(double v) {
            this.confidenceThreshold = v;
            return this;
        }

        public Builder lookbackHours(int v) {
            this.lookbackHours = v;
            return this;
        }

        public Builder minAlerts(int v) {
            this.minAlerts = v;
            return this;
        }

        public Builder maxAlerts(int v) {
            this.maxAlerts = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public CorrelationOptions build() {
            if (timeWindowHours < 1) {
                throw new IllegalArgumentException("timeWindowHours must be >= 1, got: " + timeWindowHours);
            }
            if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
                throw new IllegalArgumentException(
                        "confidenceThreshold must be in [0, 1], got: " + confidenceThreshold);
            }
            if (lookbackHours < 1) {
                throw new IllegalArgumentException("lookbackHours must be >= 1, got: " + lookbackHours);
            }
            if (minAlerts < 2) {
                throw new IllegalArgumentException("minAlerts must be >= 2, got: " + minAlerts);
            }
            if (maxAlerts < minAlerts) {
                throw new IllegalArgumentException(
                        "maxAlerts must be >= minAlerts (" + minAlerts + "), got: " + maxAlerts);
            }
            return new CorrelationOptions(this);
        }
    }
}
