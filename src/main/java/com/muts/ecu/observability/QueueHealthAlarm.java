package com.muts.ecu.observability;

import java.time.Instant;

/**
 * Hard alarm raised by the safety event queue.
 *
 * @param eventId the affected safety event, or {@code null} for store-level failures
 */
public record QueueHealthAlarm(
    Instant timestamp,
    String eventId,
    String message
) {
}
