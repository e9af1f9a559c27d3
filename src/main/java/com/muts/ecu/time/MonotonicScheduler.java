package com.muts.ecu.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used by the runtime for deferred work.
 *
 * <p>
 * Scheduled tasks never mutate pipeline state themselves. A telemetry tick or
 * an expiry sweep only <em>enqueues a command</em>; the command processor is
 * still the single writer.
 * </p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a delay measured on the provided monotonic clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }

    /**
     * Runs {@code task} every {@code period} until the returned handle is
     * cancelled. Each run is scheduled only after the previous one returned,
     * so slow tasks never overlap.
     */
    default Cancellable scheduleRepeating(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        RepeatingTask repeating = new RepeatingTask(this, clock, period, task);
        repeating.scheduleNext();
        return repeating;
    }

    /**
     * Self-rescheduling wrapper behind {@link #scheduleRepeating}.
     */
    final class RepeatingTask implements Cancellable
    {
        private final MonotonicScheduler scheduler;
        private final MonotonicClock clock;
        private final Duration period;
        private final Runnable task;

        private volatile boolean cancelled;
        private volatile Cancellable pending;

        private RepeatingTask(MonotonicScheduler scheduler, MonotonicClock clock, Duration period, Runnable task)
        {
            this.scheduler = scheduler;
            this.clock = clock;
            this.period = period;
            this.task = task;
        }

        private void scheduleNext()
        {
            if (!cancelled) {
                pending = scheduler.scheduleAfter(period, clock, this::runOnce);
            }
        }

        private void runOnce()
        {
            if (cancelled) {
                return;
            }
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        }

        @Override
        public boolean cancel()
        {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            Cancellable p = pending;
            if (p != null) {
                p.cancel();
            }
            return true;
        }
    }
}
