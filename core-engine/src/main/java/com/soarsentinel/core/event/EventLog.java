package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Event;

import java.time.Duration;
import java.util.List;

/**
 * Append-only event log partitioned by organization, consumed with
 * at-least-once semantics per consumer group.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>Within one organization, a consumer group receives events in publish
 * order.</li>
 * <li>An event is not considered processed until it is {@link #ack acked}.
 * A {@link #nack nacked} event is redelivered later without holding back the
 * events behind it; after the configured number of deliveries it moves to the
 * dead-letter path.</li>
 * </ul>
 */
public interface EventLog extends AutoCloseable {

    /**
     * @throws EventLogException if the event cannot be appended
     */
    void publish(Event event);

    /**
     * Fetch the next batch of events for a consumer group, waiting up to
     * {@code timeout} when none is available.
     *
     * @return deliveries, possibly empty
     * @throws EventLogException if the log is unreachable
     */
    List<Delivery> consume(String consumerGroup, Duration timeout);

    void ack(Delivery delivery);

    /**
     * Give an event back for redelivery.
     *
     * @param reason why processing failed, recorded on dead-lettering
     * @return {@code true} if the event was moved to the dead-letter path
     *         instead of being scheduled for redelivery
     */
    boolean nack(Delivery delivery, String reason);

    @Override
    default void close() {
        // nothing to release by default
    }
}
