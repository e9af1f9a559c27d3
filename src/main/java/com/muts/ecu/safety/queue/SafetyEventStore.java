package com.muts.ecu.safety.queue;

import com.muts.ecu.persistence.PersistenceFailureException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * SafetyEventStore
 * -----------------------------------------------------------------------------
 * Durable storage behind the {@link SafetyEventQueue}.
 *
 * <p>Only append and update-by-id operations are offered, so the command
 * processor and the delivery loop can share one store without cross-loop
 * locking. Every mutating method either makes its change durable before
 * returning or throws {@link PersistenceFailureException}.</p>
 */
public interface SafetyEventStore
{
    void append(SafetyEvent event);

    /**
     * Undelivered events with {@code deliveryAttempts < maxAttempts}, oldest
     * first (ties keep append order), at most {@code limit} of them.
     */
    List<SafetyEvent> findUndelivered(int maxAttempts, int limit);

    /**
     * Undelivered events that reached {@code maxAttempts}.
     */
    List<SafetyEvent> findExhausted(int maxAttempts);

    Optional<SafetyEvent> find(String id);

    List<SafetyEvent> findAll();

    /**
     * Marks events delivered. Unknown ids and already-delivered events are
     * ignored.
     */
    void markDelivered(Collection<String> ids, Instant deliveredAt);

    /**
     * Increments the attempt counter of undelivered events. Unknown ids and
     * delivered events are ignored.
     */
    void incrementAttempts(Collection<String> ids);

    /**
     * Deletes delivered events whose {@code deliveredAt} is before
     * {@code cutoff}. Undelivered events are never deleted.
     *
     * @return number of deleted events
     */
    int deleteDeliveredBefore(Instant cutoff);
}
