package com.muts.ecu.time;

/**
 * Minimal cancellation handle for scheduled tasks (telemetry polling, expiry
 * sweeps, delivery ticks, response timeouts).
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
