package com.soarsentinel.service;

import com.soarsentinel.core.correlation.CorrelationOptions;
import com.soarsentinel.core.playbook.ExecutorSettings;
import com.soarsentinel.core.trigger.TriggerEngineSettings;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration for the response service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configured through container env vars or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    /** Where the trigger engine reads events from. */
    public enum EventLogBackend {
        KAFKA, MEMORY;

        static EventLogBackend parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unknown event log backend: '" + value + "'. Supported: kafka, memory", e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaEventsTopic;
    private final String kafkaRetryTopic;
    private final String kafkaDlqTopic;
    private final String kafkaGroupId;
    private final EventLogBackend eventLogBackend;

    // ---------------------------------------------------------------
    // Trigger engine / executor
    // ---------------------------------------------------------------
    private final int triggerWorkers;
    private final long triggerPollIntervalMs;
    private final int eventMaxDeliveries;
    private final int jobMaxAttempts;
    private final long jobBackoffMs;
    private final long stepDefaultTimeoutMs;

    // ---------------------------------------------------------------
    // Correlation
    // ---------------------------------------------------------------
    private final int correlationIntervalMinutes;
    private final int correlationLookbackHours;
    private final int correlationTimeWindowHours;
    private final double correlationConfidenceThreshold;

    // ---------------------------------------------------------------
    // Catalog / Health
    // ---------------------------------------------------------------
    private final String catalogPath;
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaEventsTopic = b.kafkaEventsTopic;
        this.kafkaRetryTopic = b.kafkaRetryTopic;
        this.kafkaDlqTopic = b.kafkaDlqTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.eventLogBackend = b.eventLogBackend;
        this.triggerWorkers = b.triggerWorkers;
        this.triggerPollIntervalMs = b.triggerPollIntervalMs;
        this.eventMaxDeliveries = b.eventMaxDeliveries;
        this.jobMaxAttempts = b.jobMaxAttempts;
        this.jobBackoffMs = b.jobBackoffMs;
        this.stepDefaultTimeoutMs = b.stepDefaultTimeoutMs;
        this.correlationIntervalMinutes = b.correlationIntervalMinutes;
        this.correlationLookbackHours = b.correlationLookbackHours;
        this.correlationTimeWindowHours = b.correlationTimeWindowHours;
        this.correlationConfidenceThreshold = b.correlationConfidenceThreshold;
        this.catalogPath = b.catalogPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaEventsTopic(env("KAFKA_EVENTS_TOPIC", "soar.events"))
                    .kafkaRetryTopic(env("KAFKA_RETRY_TOPIC", "soar.events.retry"))
                    .kafkaDlqTopic(env("KAFKA_DLQ_TOPIC", "soar.events.dlq"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "playbook-trigger-engine"))
                    .eventLogBackend(EventLogBackend.parse(env("EVENT_LOG_BACKEND", "kafka")))
                    .triggerWorkers(parseIntEnv("TRIGGER_WORKERS", "5"))
                    .triggerPollIntervalMs(parseLongEnv("TRIGGER_POLL_INTERVAL_MS", "2000"))
                    .eventMaxDeliveries(parseIntEnv("EVENT_MAX_DELIVERIES", "5"))
                    .jobMaxAttempts(parseIntEnv("JOB_MAX_ATTEMPTS", "3"))
                    .jobBackoffMs(parseLongEnv("JOB_BACKOFF_MS", "2000"))
                    .stepDefaultTimeoutMs(parseLongEnv("STEP_DEFAULT_TIMEOUT_MS", "30000"))
                    .correlationIntervalMinutes(parseIntEnv("CORRELATION_INTERVAL_MINUTES", "15"))
                    .correlationLookbackHours(parseIntEnv("CORRELATION_LOOKBACK_HOURS", "24"))
                    .correlationTimeWindowHours(parseIntEnv("CORRELATION_TIME_WINDOW_HOURS", "24"))
                    .correlationConfidenceThreshold(
                            Double.parseDouble(env("CORRELATION_CONFIDENCE_THRESHOLD", "0.65")))
                    .catalogPath(env("SOAR_CATALOG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived settings
    // ---------------------------------------------------------------

    public TriggerEngineSettings triggerEngineSettings() {
        return new TriggerEngineSettings(kafkaGroupId, triggerWorkers, Duration.ofMillis(triggerPollIntervalMs));
    }

    public ExecutorSettings executorSettings() {
        return new ExecutorSettings(Duration.ofMillis(stepDefaultTimeoutMs),
                ExecutorSettings.defaults().getRetryBackoff());
    }

    public CorrelationOptions correlationOptions() {
        return CorrelationOptions.builder()
                .timeWindowHours(correlationTimeWindowHours)
                .lookbackHours(correlationLookbackHours)
                .confidenceThreshold(correlationConfidenceThreshold)
                .build();
    }

    /**
     * Kafka consumer {@link Properties}. Offsets are committed manually
     * after each batch is acknowledged.
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("enable.auto.commit", "false");
        props.setProperty("key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        props.setProperty("value.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.ByteArraySerializer");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaEventsTopic() {
        return kafkaEventsTopic;
    }

    public String getKafkaRetryTopic() {
        return kafkaRetryTopic;
    }

    public String getKafkaDlqTopic() {
        return kafkaDlqTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public EventLogBackend getEventLogBackend() {
        return eventLogBackend;
    }

    public int getTriggerWorkers() {
        return triggerWorkers;
    }

    public long getTriggerPollIntervalMs() {
        return triggerPollIntervalMs;
    }

    public int getEventMaxDeliveries() {
        return eventMaxDeliveries;
    }

    public int getJobMaxAttempts() {
        return jobMaxAttempts;
    }

    public long getJobBackoffMs() {
        return jobBackoffMs;
    }

    public long getStepDefaultTimeoutMs() {
        return stepDefaultTimeoutMs;
    }

    public int getCorrelationIntervalMinutes() {
        return correlationIntervalMinutes;
    }

    public int getCorrelationLookbackHours() {
        return correlationLookbackHours;
    }

    public int getCorrelationTimeWindowHours() {
        return correlationTimeWindowHours;
    }

    public double getCorrelationConfidenceThreshold() {
        return correlationConfidenceThreshold;
    }

    /**
     * @return catalog file path, or an empty string to use the classpath
     *         catalog
     */
    public String getCatalogPath() {
        return catalogPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that topic names are non-blank, counts and
     * intervals are positive, the confidence threshold lies in (0, 1] and the
     * port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaEventsTopic = "soar.events";
        private String kafkaRetryTopic = "soar.events.retry";
        private String kafkaDlqTopic = "soar.events.dlq";
        private String kafkaGroupId = "playbook-trigger-engine";
        private EventLogBackend eventLogBackend = EventLogBackend.KAFKA;
        private int triggerWorkers = 5;
        private long triggerPollIntervalMs = 2_000;
        private int eventMaxDeliveries = 5;
        private int jobMaxAttempts = 3;
        private long jobBackoffMs = 2_000;
        private long stepDefaultTimeoutMs = 30_000;
        private int correlationIntervalMinutes = 15;
        private int correlationLookbackHours = 24;
        private int correlationTimeWindowHours = 24;
        private double correlationConfidenceThreshold = 0.65;
        private String catalogPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaEventsTopic(String v) {
            this.kafkaEventsTopic = v;
            return this;
        }

        public Builder kafkaRetryTopic(String v) {
            this.kafkaRetryTopic = v;
            return this;
        }

        public Builder kafkaDlqTopic(String v) {
            this.kafkaDlqTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder eventLogBackend(EventLogBackend v) {
            this.eventLogBackend = v;
            return this;
        }

        public Builder triggerWorkers(int v) {
            this.triggerWorkers = v;
            return this;
        }

        public Builder triggerPollIntervalMs(long v) {
            this.triggerPollIntervalMs = v;
            return this;
        }

        public Builder eventMaxDeliveries(int v) {
            this.eventMaxDeliveries = v;
            return this;
        }

        public Builder jobMaxAttempts(int v) {
            this.jobMaxAttempts = v;
            return this;
        }

        public Builder jobBackoffMs(long v) {
            this.jobBackoffMs = v;
            return this;
        }

        public Builder stepDefaultTimeoutMs(long v) {
            this.stepDefaultTimeoutMs = v;
            return this;
        }

        public Builder correlationIntervalMinutes(int v) {
            this.correlationIntervalMinutes = v;
            return this;
        }

        public Builder correlationLookbackHours(int v) {
            this.correlationLookbackHours = v;
            return this;
        }

        public Builder correlationTimeWindowHours(int v) {
            this.correlationTimeWindowHours = v;
            return this;
        }

        public Builder correlationConfidenceThreshold(double v) {
            this.correlationConfidenceThreshold = v;
            return this;
        }

        public Builder catalogPath(String v) {
            this.catalogPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(eventLogBackend, "eventLogBackend required");
            requireNonBlank(kafkaEventsTopic, "kafkaEventsTopic");
            requireNonBlank(kafkaRetryTopic, "kafkaRetryTopic");
            requireNonBlank(kafkaDlqTopic, "kafkaDlqTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            requirePositive(triggerWorkers, "triggerWorkers");
            requirePositive(triggerPollIntervalMs, "triggerPollIntervalMs");
            requirePositive(eventMaxDeliveries, "eventMaxDeliveries");
            requirePositive(jobMaxAttempts, "jobMaxAttempts");
            requirePositive(jobBackoffMs, "jobBackoffMs");
            requirePositive(stepDefaultTimeoutMs, "stepDefaultTimeoutMs");
            requirePositive(correlationIntervalMinutes, "correlationIntervalMinutes");
            requirePositive(correlationLookbackHours, "correlationLookbackHours");
            requirePositive(correlationTimeWindowHours, "correlationTimeWindowHours");

            if (correlationConfidenceThreshold <= 0 || correlationConfidenceThreshold > 1) {
                throw new IllegalArgumentException(
                        "correlationConfidenceThreshold must be in (0, 1], got: " + correlationConfidenceThreshold);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (catalogPath == null) {
                catalogPath = "";
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaEventsTopic='" + kafkaEventsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", eventLogBackend=" + eventLogBackend +
                ", triggerWorkers=" + triggerWorkers +
                ", eventMaxDeliveries=" + eventMaxDeliveries +
                ", jobMaxAttempts=" + jobMaxAttempts +
                ", correlationIntervalMinutes=" + correlationIntervalMinutes +
                ", correlationConfidenceThreshold=" + correlationConfidenceThreshold +
                ", healthPort=" + healthPort +
                '}';
    }
}
