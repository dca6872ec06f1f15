package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EventLog} held in memory, for local runs and tests.
 *
 * <h3>Layout</h3>
 * <p>
 * One append-only partition per organization. Each consumer group keeps its
 * own offset per partition, a set of in-flight deliveries and a redelivery
 * queue of nacked events. Nacked events are redelivered before new ones;
 * after {@code maxDeliveries} attempts an event is dead-lettered instead.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All state is guarded by a single lock; {@link #consume} waits on a
 * condition signalled by {@link #publish} and {@link #nack}.
 * </p>
 *
 * @since 1.0.0
 */
public final class InMemoryEventLog implements EventLog {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventLog.class);

    private static final int MAX_BATCH = 100;

    private final int maxDeliveries;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Map<Long, List<Event>> partitions = new LinkedHashMap<>();
    private final Map<String, GroupState> groups = new HashMap<>();
    private final List<DeadLetter<Event>> deadLetters = new ArrayList<>();
    private final AtomicLong handles = new AtomicLong();

    /**
     * @param maxDeliveries delivery attempts before an event is dead-lettered
     */
    public InMemoryEventLog(int maxDeliveries, Clock clock) {
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("maxDeliveries must be >= 1, got: " + maxDeliveries);
        }
        this.maxDeliveries = maxDeliveries;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        lock.lock();
        try {
            partitions.computeIfAbsent(event.getOrganizationId(), k -> new ArrayList<>()).add(event);
            available.signalAll();
        } finally {
            lock.unlock();
        }
        LOG.debug("Appended event {} ({}) to partition {}", event.getId(), event.getType(),
                event.getOrganizationId());
    }

    @Override
    public List<Delivery> consume(String consumerGroup, Duration timeout) {
        Objects.requireNonNull(consumerGroup, "consumerGroup must not be null");
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            GroupState group = groups.computeIfAbsent(consumerGroup, GroupState::new);
            while (!hasWork(group)) {
                if (remainingNanos <= 0) {
                    return List.of();
                }
                remainingNanos = available.awaitNanos(remainingNanos);
            }
            return take(group);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(Delivery delivery) {
        Handle handle = handleOf(delivery);
        lock.lock();
        try {
            GroupState group = groups.get(handle.group);
            if (group == null || group.inFlight.remove(handle.id) == null) {
                LOG.warn("Ignoring ack of unknown delivery {}", delivery);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean nack(Delivery delivery, String reason) {
        Handle handle = handleOf(delivery);
        lock.lock();
        try {
            GroupState group = groups.get(handle.group);
            Pending pending = group != null ? group.inFlight.remove(handle.id) : null;
            if (pending == null) {
                LOG.warn("Ignoring nack of unknown delivery {}", delivery);
                return false;
            }
            if (pending.attempt >= maxDeliveries) {
                deadLetters.add(new DeadLetter<>(pending.event, pending.attempt, reason, clock.instant()));
                LOG.error("Event {} dead-lettered for group {} after {} deliveries: {}",
                        pending.event.getId(), handle.group, pending.attempt, reason);
                return true;
            }
            group.redeliveries.addLast(new Pending(pending.event, pending.attempt + 1));
            available.signalAll();
            LOG.warn("Event {} will be redelivered to group {} (attempt {} failed: {})",
                    pending.event.getId(), handle.group, pending.attempt, reason);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return events that exhausted their deliveries, oldest first
     */
    public List<DeadLetter<Event>> deadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of events delivered to the group and not yet acked
     */
    public int inFlight(String consumerGroup) {
        lock.lock();
        try {
            GroupState group = groups.get(consumerGroup);
            return group == null ? 0 : group.inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return partitions.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal (lock held)
    // ---------------------------------------------------------------

    private boolean hasWork(GroupState group) {
        if (!group.redeliveries.isEmpty()) {
            return true;
        }
        for (Map.Entry<Long, List<Event>> partition : partitions.entrySet()) {
            if (group.offsets.getOrDefault(partition.getKey(), 0) < partition.getValue().size()) {
                return true;
            }
        }
        return false;
    }

    private List<Delivery> take(GroupState group) {
        List<Delivery> batch = new ArrayList<>();
        while (!group.redeliveries.isEmpty() && batch.size() < MAX_BATCH) {
            batch.add(deliver(group, group.redeliveries.pollFirst()));
        }
        for (Map.Entry<Long, List<Event>> partition : partitions.entrySet()) {
            List<Event> events = partition.getValue();
            int offset = group.offsets.getOrDefault(partition.getKey(), 0);
            while (offset < events.size() && batch.size() < MAX_BATCH) {
                batch.add(deliver(group, new Pending(events.get(offset), 1)));
                offset++;
            }
            group.offsets.put(partition.getKey(), offset);
        }
        return batch;
    }

    private Delivery deliver(GroupState group, Pending pending) {
        long id = handles.incrementAndGet();
        group.inFlight.put(id, pending);
        return new Delivery(pending.event, pending.attempt, new Handle(group.name, id));
    }

    private static Handle handleOf(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery must not be null");
        if (delivery.getHandle() instanceof Handle handle) {
            return handle;
        }
        throw new IllegalArgumentException("Delivery was not issued by this log: " + delivery);
    }

    private static final class GroupState {
        private final String name;
        private final Map<Long, Integer> offsets = new HashMap<>();
        private final Map<Long, Pending> inFlight = new HashMap<>();
        private final Deque<Pending> redeliveries = new ArrayDeque<>();

        private GroupState(String name) {
            this.name = name;
        }
    }

    private static final class Pending {
        private final Event event;
        private final int attempt;

        private Pending(Event event, int attempt) {
            this.event = event;
            this.attempt = attempt;
        }
    }

    private static final class Handle {
        private final String group;
        private final long id;

        private Handle(String group, long id) {
            this.group = group;
            this.id = id;
        }
    }
}
