package com.muts.ecu.safety.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Volatile {@link SafetyEventStore} for DEV mode and tests.
 *
 * <p>Insertion order is preserved so events with identical timestamps drain
 * in append order.</p>
 */
public class InMemorySafetyEventStore implements SafetyEventStore
{
    private final Map<String, SafetyEvent> events = new LinkedHashMap<>();

    @Override
    public synchronized void append(SafetyEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (events.containsKey(event.id())) {
            throw new IllegalArgumentException("duplicate safety event id " + event.id());
        }
        events.put(event.id(), event);
    }

    @Override
    public synchronized List<SafetyEvent> findUndelivered(int maxAttempts, int limit)
    {
        return events.values().stream()
            .filter(e -> !e.delivered() && e.deliveryAttempts() < maxAttempts)
            .sorted(Comparator.comparing(SafetyEvent::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<SafetyEvent> findExhausted(int maxAttempts)
    {
        return events.values().stream()
            .filter(e -> !e.delivered() && e.deliveryAttempts() >= maxAttempts)
            .sorted(Comparator.comparing(SafetyEvent::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<SafetyEvent> find(String id)
    {
        return Optional.ofNullable(events.get(id));
    }

    @Override
    public synchronized List<SafetyEvent> findAll()
    {
        return new ArrayList<>(events.values());
    }

    @Override
    public synchronized void markDelivered(Collection<String> ids, Instant deliveredAt)
    {
        for (String id : ids) {
            events.computeIfPresent(id, (k, e) -> e.markedDelivered(deliveredAt));
        }
    }

    @Override
    public synchronized void incrementAttempts(Collection<String> ids)
    {
        for (String id : ids) {
            events.computeIfPresent(id, (k, e) -> e.delivered() ? e : e.withAttemptRecorded());
        }
    }

    @Override
    public synchronized int deleteDeliveredBefore(Instant cutoff)
    {
        int removed = 0;
        Iterator<SafetyEvent> it = events.values().iterator();
        while (it.hasNext()) {
            SafetyEvent e = it.next();
            if (e.delivered() && e.deliveredAt() != null && e.deliveredAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
