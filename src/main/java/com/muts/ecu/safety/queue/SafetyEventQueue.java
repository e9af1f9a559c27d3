package com.muts.ecu.safety.queue;

import com.muts.ecu.api.Subscription;
import com.muts.ecu.config.SafetyQueueConfig;
import com.muts.ecu.observability.NullObservabilitySink;
import com.muts.ecu.observability.PipelineErrorEvent;
import com.muts.ecu.observability.PipelineObservabilitySink;
import com.muts.ecu.observability.QueueHealthAlarm;
import com.muts.ecu.persistence.PersistenceFailureException;
import com.muts.ecu.time.Cancellable;
import com.muts.ecu.time.MonotonicClock;
import com.muts.ecu.time.MonotonicScheduler;
import com.muts.ecu.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SafetyEventQueue
 * =============================================================================
 * Durable, at-least-once queue of safety-relevant events.
 *
 * <h2>Producers</h2>
 * {@link #append} persists the event with {@code delivered=false} and
 * {@code deliveryAttempts=0} before returning. If the store cannot make it
 * durable a {@link PersistenceFailureException} is thrown and the caller must
 * not proceed with any hardware action gated by the event.
 *
 * <h2>Delivery loop</h2>
 * While started, the loop runs one {@link #deliverPending()} cycle at a time
 * on the scheduler: oldest undelivered events first, every subscriber must
 * accept an event for it to be marked delivered, failures increment the
 * attempt counter. After a cycle with failures the next one waits
 * {@link SafetyQueueConfig#retryDelay()}, otherwise
 * {@link SafetyQueueConfig#idleDelay()}.
 *
 * <p>Events that reach {@link SafetyQueueConfig#maxRetries()} are no longer
 * drained. They stay in the store, are listed by {@link #exhaustedEvents()}
 * and raise exactly one {@link QueueHealthAlarm} each.</p>
 *
 * <h2>Retention</h2>
 * While started, {@link #cleanup(int)} runs every
 * {@link SafetyQueueConfig#cleanupInterval()} with
 * {@link SafetyQueueConfig#retentionDays()}.
 *
 * <h2>Isolation</h2>
 * The loop runs independently of the command processor. Store failures
 * inside the loop are reported as alarms and never propagate to producers.
 */
public final class SafetyEventQueue
{
    private static final Logger log = LoggerFactory.getLogger(SafetyEventQueue.class);

    private final SafetyEventStore store;
    private final SafetyQueueConfig config;
    private final WallClock wallClock;
    private final MonotonicClock monotonicClock;
    private final MonotonicScheduler scheduler;
    private final PipelineObservabilitySink observabilitySink;

    private final List<SafetyEventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Set<String> alarmed = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object cycleLock = new Object();

    private volatile Cancellable nextTick;
    private volatile Cancellable retention;

    public SafetyEventQueue(SafetyEventStore store,
                            SafetyQueueConfig config,
                            WallClock wallClock,
                            MonotonicClock monotonicClock,
                            MonotonicScheduler scheduler,
                            PipelineObservabilitySink observabilitySink)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    // ---------------------------------------------------------------------
    // Producer side
    // ---------------------------------------------------------------------

    /**
     * Durably records a new event.
     *
     * @return the stored event (its id identifies it in later bookkeeping)
     * @throws PersistenceFailureException if the event could not be made durable
     */
    public SafetyEvent append(SafetyEventType type, Map<String, String> payload)
    {
        Objects.requireNonNull(type, "type");
        SafetyEvent event = SafetyEvent.pending(UUID.randomUUID().toString(), type, payload, wallClock.now());
        try {
            store.append(event);
        } catch (PersistenceFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceFailureException("Failed to persist " + type.wireName() + " event", e);
        }
        log.debug("Appended safety event {} ({})", event.id(), type.wireName());
        return event;
    }

    // ---------------------------------------------------------------------
    // Bookkeeping
    // ---------------------------------------------------------------------

    /**
     * Undelivered events below the retry limit, oldest first.
     */
    public List<SafetyEvent> drain(int limit)
    {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return store.findUndelivered(config.maxRetries(), limit);
    }

    /**
     * Idempotent: ids that are unknown or already delivered are ignored.
     */
    public void markDelivered(Collection<String> ids)
    {
        store.markDelivered(List.copyOf(ids), wallClock.now());
    }

    public void incrementAttempts(Collection<String> ids)
    {
        store.incrementAttempts(List.copyOf(ids));
    }

    /**
     * Events that exhausted their delivery attempts. They are kept for manual
     * inspection and never deleted by {@link #cleanup(int)}.
     */
    public List<SafetyEvent> exhaustedEvents()
    {
        return store.findExhausted(config.maxRetries());
    }

    /**
     * Deletes delivered events whose delivery is older than the retention
     * window. Undelivered events are kept regardless of age.
     *
     * @return number of deleted events
     */
    public int cleanup(int retentionDays)
    {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
        Instant cutoff = wallClock.now().minus(Duration.ofDays(retentionDays));
        int removed = store.deleteDeliveredBefore(cutoff);
        if (removed > 0) {
            log.info("Cleaned up {} delivered safety events older than {} days", removed, retentionDays);
        }
        return removed;
    }

    // ---------------------------------------------------------------------
    // Subscribers
    // ---------------------------------------------------------------------

    public Subscription subscribe(SafetyEventSubscriber subscriber)
    {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    // ---------------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------------

    /**
     * Runs one delivery cycle. Events stay pending while nobody is
     * subscribed.
     */
    public DeliveryReport deliverPending()
    {
        synchronized (cycleLock) {
            if (subscribers.isEmpty()) {
                return DeliveryReport.EMPTY;
            }

            List<SafetyEvent> batch;
            try {
                batch = drain(config.batchSize());
            } catch (RuntimeException e) {
                raiseAlarm(null, "Safety event store unreadable: " + e.getMessage());
                return DeliveryReport.EMPTY;
            }
            if (batch.isEmpty()) {
                return DeliveryReport.EMPTY;
            }

            List<String> succeeded = new ArrayList<>();
            List<SafetyEvent> failed = new ArrayList<>();
            for (SafetyEvent event : batch) {
                if (deliverToAll(event)) {
                    succeeded.add(event.id());
                } else {
                    failed.add(event);
                }
            }

            try {
                if (!succeeded.isEmpty()) {
                    markDelivered(succeeded);
                }
                if (!failed.isEmpty()) {
                    incrementAttempts(failed.stream().map(SafetyEvent::id).toList());
                }
            } catch (RuntimeException e) {
                raiseAlarm(null, "Safety event bookkeeping failed: " + e.getMessage());
            }

            for (SafetyEvent event : failed) {
                if (event.deliveryAttempts() + 1 >= config.maxRetries()) {
                    raiseAlarm(event.id(), "Safety event " + event.type().wireName()
                        + " undelivered after " + config.maxRetries() + " attempts");
                }
            }

            return new DeliveryReport(batch.size(), succeeded.size(), failed.size());
        }
    }

    private boolean deliverToAll(SafetyEvent event)
    {
        boolean ok = true;
        for (SafetyEventSubscriber subscriber : subscribers) {
            try {
                subscriber.onSafetyEvent(event);
            } catch (Exception e) {
                log.warn("Delivery of safety event {} failed (attempt {}): {}",
                    event.id(), event.deliveryAttempts() + 1, e.toString());
                ok = false;
            }
        }
        return ok;
    }

    private void raiseAlarm(String eventId, String message)
    {
        if (eventId != null && !alarmed.add(eventId)) {
            return;
        }
        observabilitySink.onQueueAlarm(new QueueHealthAlarm(wallClock.now(), eventId, message));
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts the delivery loop on the scheduler. Idempotent.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            for (SafetyEvent event : exhaustedEvents()) {
                raiseAlarm(event.id(), "Safety event " + event.type().wireName() + " exhausted before restart");
            }
            scheduleTick(config.idleDelay());
            retention = scheduler.scheduleRepeating(config.cleanupInterval(), monotonicClock, this::runRetention);
        }
    }

    /**
     * Stops the delivery loop. Pending events remain in the store.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Cancellable t = nextTick;
            if (t != null) {
                t.cancel();
                nextTick = null;
            }
            Cancellable r = retention;
            if (r != null) {
                r.cancel();
                retention = null;
            }
        }
    }

    public boolean isRunning()
    {
        return running.get();
    }

    private void scheduleTick(Duration delay)
    {
        if (running.get()) {
            nextTick = scheduler.scheduleAfter(delay, monotonicClock, this::tick);
        }
    }

    private void tick()
    {
        if (!running.get()) {
            return;
        }
        Duration next = config.idleDelay();
        try {
            DeliveryReport report = deliverPending();
            if (report.hadFailures()) {
                next = config.retryDelay();
            }
        } catch (RuntimeException e) {
            next = config.retryDelay();
            observabilitySink.onError(new PipelineErrorEvent(wallClock.now(), "Safety event delivery cycle failed", e));
        } finally {
            scheduleTick(next);
        }
    }

    private void runRetention()
    {
        try {
            cleanup(config.retentionDays());
        } catch (RuntimeException e) {
            raiseAlarm(null, "Safety event cleanup failed: " + e.getMessage());
        }
    }
}
