package com.muts.ecu.safety.queue;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * SafetyEvent
 * -----------------------------------------------------------------------------
 * One durably recorded safety-relevant occurrence.
 *
 * <p>Immutable except for the delivery bookkeeping ({@code delivered},
 * {@code deliveryAttempts}, {@code deliveredAt}), which only changes through
 * {@link #markedDelivered(Instant)} and {@link #withAttemptRecorded()}.</p>
 *
 * @param deliveredAt {@code null} until delivered
 */
public record SafetyEvent(
    String id,
    SafetyEventType type,
    Map<String, String> payload,
    Instant createdAt,
    boolean delivered,
    int deliveryAttempts,
    Instant deliveredAt
) {
    public SafetyEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        if (deliveryAttempts < 0) {
            throw new IllegalArgumentException("deliveryAttempts must be >= 0");
        }
    }

    /**
     * A freshly appended, undelivered event.
     */
    public static SafetyEvent pending(String id, SafetyEventType type, Map<String, String> payload, Instant createdAt)
    {
        return new SafetyEvent(id, type, payload, createdAt, false, 0, null);
    }

    /**
     * Marks delivered. Already-delivered events are returned unchanged.
     */
    public SafetyEvent markedDelivered(Instant at)
    {
        if (delivered) {
            return this;
        }
        return new SafetyEvent(id, type, payload, createdAt, true, deliveryAttempts, at);
    }

    public SafetyEvent withAttemptRecorded()
    {
        return new SafetyEvent(id, type, payload, createdAt, delivered, deliveryAttempts + 1, deliveredAt);
    }
}
