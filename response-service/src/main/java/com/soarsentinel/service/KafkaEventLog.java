package com.soarsentinel.service;

import com.soarsentinel.core.event.Delivery;
import com.soarsentinel.core.event.EventLog;
import com.soarsentinel.core.event.EventLogException;
import com.soarsentinel.core.model.Event;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@link EventLog} on Kafka.
 *
 * <h3>Topics</h3>
 * <ul>
 * <li>events topic: keyed by organization id, so one organization's events
 * stay in one partition and keep publish order</li>
 * <li>retry topic: nacked events, re-published with an incremented
 * {@value #ATTEMPT_HEADER} header; consumed alongside the events topic</li>
 * <li>dead-letter topic: events that exhausted their deliveries and
 * payloads that could not be decoded</li>
 * </ul>
 *
 * <h3>Offsets</h3>
 * <p>
 * Auto-commit is off. A partition's offset is committed only up to the
 * oldest record still awaiting ack or nack, so a crash redelivers
 * unprocessed events rather than losing them.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #publish} may be called from any thread. {@link #consume},
 * {@link #ack} and {@link #nack} must be called from a single consumer
 * thread, as {@link KafkaConsumer} is not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class KafkaEventLog implements EventLog {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaEventLog.class);

    public static final String ATTEMPT_HEADER = "soar-delivery-attempt";
    public static final String REASON_HEADER = "soar-dead-letter-reason";

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final String eventsTopic;
    private final String retryTopic;
    private final String dlqTopic;
    private final int maxDeliveries;
    private final EventJsonCodec codec;
    private final Producer<String, byte[]> producer;
    private final Function<String, Consumer<String, byte[]>> consumerFactory;

    private final Map<String, GroupConsumer> consumers = new HashMap<>();

    public KafkaEventLog(ServiceConfig config, EventJsonCodec codec) {
        this(config.getKafkaEventsTopic(), config.getKafkaRetryTopic(), config.getKafkaDlqTopic(),
                config.getEventMaxDeliveries(), codec,
                new KafkaProducer<>(config.kafkaProducerProperties()),
                group -> {
                    Properties props = config.kafkaConsumerProperties();
                    props.setProperty("group.id", group);
                    return new KafkaConsumer<>(props);
                });
    }

    KafkaEventLog(String eventsTopic, String retryTopic, String dlqTopic, int maxDeliveries,
            EventJsonCodec codec, Producer<String, byte[]> producer,
            Function<String, Consumer<String, byte[]>> consumerFactory) {
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("maxDeliveries must be >= 1, got: " + maxDeliveries);
        }
        this.eventsTopic = Objects.requireNonNull(eventsTopic, "eventsTopic must not be null");
        this.retryTopic = Objects.requireNonNull(retryTopic, "retryTopic must not be null");
        this.dlqTopic = Objects.requireNonNull(dlqTopic, "dlqTopic must not be null");
        this.maxDeliveries = maxDeliveries;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
    }

    // ---------------------------------------------------------------
    // EventLog
    // ---------------------------------------------------------------

    @Override
    public void publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        send(new ProducerRecord<>(eventsTopic, partitionKey(event), codec.encode(event)));
        LOG.debug("Published event {} ({}) to {}", event.getId(), event.getType(), eventsTopic);
    }

    @Override
    public List<Delivery> consume(String consumerGroup, Duration timeout) {
        Objects.requireNonNull(consumerGroup, "consumerGroup must not be null");
        GroupConsumer group = consumers.computeIfAbsent(consumerGroup, this::subscribe);
        group.commit();

        ConsumerRecords<String, byte[]> records;
        try {
            records = group.consumer.poll(timeout);
        } catch (KafkaException e) {
            throw new EventLogException("Failed to poll events for group " + consumerGroup, e);
        }

        List<Delivery> batch = new ArrayList<>(records.count());
        Set<TopicPartition> rewound = new HashSet<>();
        for (ConsumerRecord<String, byte[]> record : records) {
            TopicPartition partition = new TopicPartition(record.topic(), record.partition());
            if (rewound.contains(partition)) {
                continue;
            }
            int attempt = attemptOf(record);
            Event event;
            try {
                event = codec.decode(record.value());
            } catch (IllegalArgumentException e) {
                if (!deadLetterUndecodable(group, partition, record, attempt, e.getMessage())) {
                    rewound.add(partition);
                }
                continue;
            }
            group.highestSeen.merge(partition, record.offset(), Math::max);
            group.outstanding.computeIfAbsent(partition, k -> new TreeSet<>()).add(record.offset());
            batch.add(new Delivery(event, attempt, new Handle(consumerGroup, partition, record.offset())));
        }
        return batch;
    }

    @Override
    public void ack(Delivery delivery) {
        resolve(delivery, handleOf(delivery));
    }

    /**
     * {@inheritDoc}
     *
     * <p>
     * The record stays outstanding until the retry or dead-letter copy is
     * written, so a failed send never lets the committed offset pass it.
     * </p>
     *
     * @throws EventLogException if the copy cannot be written; the delivery
     *                           is then left unresolved
     */
    @Override
    public boolean nack(Delivery delivery, String reason) {
        Handle handle = handleOf(delivery);
        Event event = delivery.getEvent();
        if (delivery.getAttempt() >= maxDeliveries) {
            deadLetter(partitionKey(event), codec.encode(event), delivery.getAttempt(), reason);
            resolve(delivery, handle);
            LOG.error("Event {} dead-lettered to {} after {} deliveries: {}",
                    event.getId(), dlqTopic, delivery.getAttempt(), reason);
            return true;
        }
        ProducerRecord<String, byte[]> retry = new ProducerRecord<>(retryTopic, partitionKey(event),
                codec.encode(event));
        retry.headers().add(ATTEMPT_HEADER, bytes(delivery.getAttempt() + 1));
        send(retry);
        resolve(delivery, handle);
        LOG.warn("Event {} re-published to {} for group {} (attempt {} failed: {})",
                event.getId(), retryTopic, handle.group, delivery.getAttempt(), reason);
        return false;
    }

    @Override
    public void close() {
        for (GroupConsumer group : consumers.values()) {
            try {
                group.commit();
            } catch (EventLogException e) {
                LOG.warn("Final offset commit failed: {}", e.getMessage());
            }
            group.consumer.close();
        }
        consumers.clear();
        producer.close();
        LOG.info("Kafka event log closed");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private GroupConsumer subscribe(String consumerGroup) {
        Consumer<String, byte[]> consumer = consumerFactory.apply(consumerGroup);
        GroupConsumer group = new GroupConsumer(consumer);
        consumer.subscribe(List.of(eventsTopic, retryTopic), new ConsumerRebalanceListener() {
            @Override
            public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                try {
                    group.commit();
                } catch (EventLogException e) {
                    LOG.warn("Group {} could not commit before revocation: {}", consumerGroup, e.getMessage());
                }
                partitions.forEach(group::forget);
            }

            @Override
            public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                LOG.info("Group {} assigned {}", consumerGroup, partitions);
            }
        });
        LOG.info("Group {} subscribed to {} and {}", consumerGroup, eventsTopic, retryTopic);
        return group;
    }

    /**
     * Dead-letter a record that could not be decoded. If the dead-letter
     * write fails the consumer is rewound to the record, so it is polled
     * again instead of being committed past.
     *
     * @return {@code false} if the partition was rewound
     */
    private boolean deadLetterUndecodable(GroupConsumer group, TopicPartition partition,
            ConsumerRecord<String, byte[]> record, int attempt, String reason) {
        try {
            deadLetter(record.key(), record.value(), attempt, reason);
        } catch (EventLogException e) {
            LOG.error("Could not dead-letter undecodable record {}-{}@{}; rewinding: {}", record.topic(),
                    record.partition(), record.offset(), e.getMessage());
            group.consumer.seek(partition, record.offset());
            return false;
        }
        LOG.warn("Undecodable record {}-{}@{} sent to {}: {}", record.topic(), record.partition(),
                record.offset(), dlqTopic, reason);
        group.highestSeen.merge(partition, record.offset(), Math::max);
        return true;
    }

    private static Handle handleOf(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery must not be null");
        if (!(delivery.getHandle() instanceof Handle handle)) {
            throw new IllegalArgumentException("Delivery was not issued by this log: " + delivery);
        }
        return handle;
    }

    private void resolve(Delivery delivery, Handle handle) {
        GroupConsumer group = consumers.get(handle.group);
        TreeSet<Long> pending = group != null ? group.outstanding.get(handle.partition) : null;
        if (pending == null || !pending.remove(handle.offset)) {
            LOG.warn("Ignoring resolution of unknown delivery {}", delivery);
        }
    }

    private void deadLetter(String key, byte[] payload, int attempts, String reason) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(dlqTopic, key, payload);
        record.headers().add(ATTEMPT_HEADER, bytes(attempts));
        record.headers().add(REASON_HEADER, (reason != null ? reason : "").getBytes(StandardCharsets.UTF_8));
        send(record);
    }

    private void send(ProducerRecord<String, byte[]> record) {
        try {
            producer.send(record).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventLogException("Interrupted while sending to " + record.topic(), e);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            throw new EventLogException("Failed to send to " + record.topic() + ": " + e.getMessage(), e);
        }
    }

    private static int attemptOf(ConsumerRecord<String, byte[]> record) {
        Header header = record.headers().lastHeader(ATTEMPT_HEADER);
        if (header == null) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(new String(header.value(), StandardCharsets.UTF_8)));
        } catch (NumberFormatException e) {
            LOG.warn("Invalid {} header on {}-{}@{}; assuming first delivery", ATTEMPT_HEADER,
                    record.topic(), record.partition(), record.offset());
            return 1;
        }
    }

    private static String partitionKey(Event event) {
        return Long.toString(event.getOrganizationId());
    }

    private static byte[] bytes(int value) {
        return Integer.toString(value).getBytes(StandardCharsets.UTF_8);
    }

    /** Consumer plus the offsets it has handed out and not yet resolved. */
    private static final class GroupConsumer {
        private final Consumer<String, byte[]> consumer;
        private final Map<TopicPartition, TreeSet<Long>> outstanding = new HashMap<>();
        private final Map<TopicPartition, Long> highestSeen = new HashMap<>();
        private final Map<TopicPartition, Long> committed = new HashMap<>();

        private GroupConsumer(Consumer<String, byte[]> consumer) {
            this.consumer = consumer;
        }

        /** Commit up to the oldest unresolved record of each partition. */
        private void commit() {
            Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
            for (Map.Entry<TopicPartition, Long> seen : highestSeen.entrySet()) {
                TreeSet<Long> pending = outstanding.get(seen.getKey());
                long next = pending == null || pending.isEmpty() ? seen.getValue() + 1 : pending.first();
                if (!Long.valueOf(next).equals(committed.get(seen.getKey()))) {
                    offsets.put(seen.getKey(), new OffsetAndMetadata(next));
                }
            }
            if (offsets.isEmpty()) {
                return;
            }
            try {
                consumer.commitSync(offsets);
            } catch (KafkaException e) {
                throw new EventLogException("Offset commit failed: " + e.getMessage(), e);
            }
            offsets.forEach((partition, offset) -> committed.put(partition, offset.offset()));
        }

        private void forget(TopicPartition partition) {
            outstanding.remove(partition);
            highestSeen.remove(partition);
            committed.remove(partition);
        }
    }

    private static final class Handle {
        private final String group;
        private final TopicPartition partition;
        private final long offset;

        private Handle(String group, TopicPartition partition, long offset) {
            this.group = group;
            this.partition = partition;
            this.offset = offset;
        }
    }
}
