package com.muts.ecu.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery and retention settings for the durable safety event queue.
 *
 * @param batchSize     maximum events drained per delivery cycle. Cycles always
 *                      start from the oldest undelivered events, so with a
 *                      failing subscriber a backlog larger than one batch
 *                      reaches {@code maxRetries} a batch at a time
 * @param maxRetries    delivery attempts before an event raises a queue-health alarm
 * @param retryDelay    fixed backoff after a cycle with failures
 * @param idleDelay     pause between cycles otherwise
 * @param retentionDays age after which delivered events are cleaned up
 * @param cleanupInterval period of the retention cleanup while the queue runs
 */
public record SafetyQueueConfig(
    int batchSize,
    int maxRetries,
    Duration retryDelay,
    Duration idleDelay,
    int retentionDays,
    Duration cleanupInterval
) {
    public SafetyQueueConfig {
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(idleDelay, "idleDelay");
        Objects.requireNonNull(cleanupInterval, "cleanupInterval");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be > 0");
        }
        if (retryDelay.isNegative() || idleDelay.isNegative() || idleDelay.isZero()) {
            throw new IllegalArgumentException("delays must be positive");
        }
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
        if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanupInterval must be > 0");
        }
    }

    public static SafetyQueueConfig defaults()
    {
        return new SafetyQueueConfig(100, 3, Duration.ofSeconds(1), Duration.ofMillis(100), 7, Duration.ofHours(1));
    }

    public SafetyQueueConfig withBatchSize(int batchSize)
    {
        return new SafetyQueueConfig(batchSize, maxRetries, retryDelay, idleDelay, retentionDays, cleanupInterval);
    }

    public SafetyQueueConfig withMaxRetries(int maxRetries)
    {
        return new SafetyQueueConfig(batchSize, maxRetries, retryDelay, idleDelay, retentionDays, cleanupInterval);
    }

    public SafetyQueueConfig withRetentionDays(int retentionDays)
    {
        return new SafetyQueueConfig(batchSize, maxRetries, retryDelay, idleDelay, retentionDays, cleanupInterval);
    }

    public SafetyQueueConfig withCleanupInterval(Duration cleanupInterval)
    {
        return new SafetyQueueConfig(batchSize, maxRetries, retryDelay, idleDelay, retentionDays, cleanupInterval);
    }
}
