package com.soarsentinel.core.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Work item that exhausted its delivery attempts, held for operators.
 *
 * @param <T> the payload type (an event or a playbook job)
 */
public final class DeadLetter<T> {

    private final T payload;
    private final int attempts;
    private final String reason;
    private final Instant deadLetteredAt;

    public DeadLetter(T payload, int attempts, String reason, Instant deadLetteredAt) {
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.attempts = attempts;
        this.reason = reason;
        this.deadLetteredAt = deadLetteredAt;
    }

    public T getPayload() {
        return payload;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }

    public Instant getDeadLetteredAt() {
        return deadLetteredAt;
    }

    @Override
    public String toString() {
        return "DeadLetter{payload=" + payload + ", attempts=" + attempts + ", reason='" + reason + "'}";
    }
}
