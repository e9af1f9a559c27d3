package com.muts.ecu.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational timing inside the pipeline.
 *
 * <h2>Binding invariant</h2>
 * Scheduling decisions (telemetry cadence, expiry sweep cadence, delivery
 * backoff, hardware response timeouts) MUST use a monotonic time source.
 * Persisted deadlines such as a session's {@code expiresAt} are wall-clock
 * values and are compared through {@link WallClock} instead.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
