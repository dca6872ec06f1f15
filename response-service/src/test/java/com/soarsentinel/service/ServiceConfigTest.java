package com.soarsentinel.service;

import com.soarsentinel.core.correlation.CorrelationOptions;
import com.soarsentinel.core.trigger.TriggerEngineSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaEventsTopic()).isEqualTo("soar.events");
        assertThat(config.getKafkaRetryTopic()).isEqualTo("soar.events.retry");
        assertThat(config.getKafkaDlqTopic()).isEqualTo("soar.events.dlq");
        assertThat(config.getEventLogBackend()).isEqualTo(ServiceConfig.EventLogBackend.KAFKA);
        assertThat(config.getTriggerWorkers()).isEqualTo(5);
        assertThat(config.getEventMaxDeliveries()).isEqualTo(5);
        assertThat(config.getJobMaxAttempts()).isEqualTo(3);
        assertThat(config.getCorrelationIntervalMinutes()).isEqualTo(15);
        assertThat(config.getCorrelationConfidenceThreshold()).isEqualTo(0.65);
        assertThat(config.getCatalogPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Derived settings carry the configured values")
    void shouldDeriveComponentSettings() {
        ServiceConfig config = new ServiceConfig.Builder()
                .kafkaGroupId("engine-a")
                .triggerWorkers(3)
                .triggerPollIntervalMs(250)
                .stepDefaultTimeoutMs(5_000)
                .correlationTimeWindowHours(6)
                .correlationLookbackHours(12)
                .correlationConfidenceThreshold(0.8)
                .build();

        TriggerEngineSettings trigger = config.triggerEngineSettings();
        assertThat(trigger.getConsumerGroup()).isEqualTo("engine-a");
        assertThat(trigger.getWorkers()).isEqualTo(3);
        assertThat(trigger.getPollInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.executorSettings().getDefaultStepTimeout()).isEqualTo(Duration.ofSeconds(5));
        CorrelationOptions options = config.correlationOptions();
        assertThat(options.getTimeWindowHours()).isEqualTo(6);
        assertThat(options.getLookbackHours()).isEqualTo(12);
        assertThat(options.getConfidenceThreshold()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Kafka consumers commit manually and read bytes")
    void shouldBuildKafkaProperties() {
        ServiceConfig config = new ServiceConfig.Builder().kafkaBootstrapServers("broker:9092").build();

        Properties consumer = config.kafkaConsumerProperties();
        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("broker:9092");
        assertThat(consumer.getProperty("enable.auto.commit")).isEqualTo("false");
        assertThat(consumer.getProperty("value.deserializer")).endsWith("ByteArrayDeserializer");
        Properties producer = config.kafkaProducerProperties();
        assertThat(producer.getProperty("acks")).isEqualTo("all");
        assertThat(producer.getProperty("value.serializer")).endsWith("ByteArraySerializer");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().kafkaEventsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaEventsTopic");
        assertThatThrownBy(() -> new ServiceConfig.Builder().triggerWorkers(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("triggerWorkers");
        assertThatThrownBy(() -> new ServiceConfig.Builder().correlationConfidenceThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(0, 1]");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Backend names are parsed case-insensitively")
    void shouldParseBackend() {
        assertThat(ServiceConfig.EventLogBackend.parse(" Memory ")).isEqualTo(ServiceConfig.EventLogBackend.MEMORY);
        assertThatThrownBy(() -> ServiceConfig.EventLogBackend.parse("redis"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown event log backend");
    }
}
