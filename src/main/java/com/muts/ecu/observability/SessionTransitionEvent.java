package com.muts.ecu.observability;

import com.muts.ecu.session.ApplySessionStatus;

import java.time.Instant;

/**
 * Status change of a tuning-apply session.
 *
 * @param from previous status, {@code null} when the session was just created
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String sessionId,
    ApplySessionStatus from,
    ApplySessionStatus to,
    String cause
) {
}
