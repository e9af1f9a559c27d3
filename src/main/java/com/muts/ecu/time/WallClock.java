package com.muts.ecu.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for timestamps that are persisted or shown to operators
 * (command enqueue time, safety event creation, session expiry).
 *
 * <p>
 * Injected everywhere an {@link Instant} is produced so that expiry and
 * retention behavior can be tested without sleeping.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
