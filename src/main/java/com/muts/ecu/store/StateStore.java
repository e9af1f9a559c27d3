package com.muts.ecu.store;

import com.muts.ecu.api.EcuPipelineException;
import com.muts.ecu.api.FailureKind;
import com.muts.ecu.api.Subscription;
import com.muts.ecu.observability.CommandRejectedEvent;
import com.muts.ecu.observability.NullObservabilitySink;
import com.muts.ecu.observability.PipelineErrorEvent;
import com.muts.ecu.observability.PipelineObservabilitySink;
import com.muts.ecu.observability.StateTransitionEvent;
import com.muts.ecu.time.SystemWallClock;
import com.muts.ecu.time.WallClock;
import com.muts.ecu.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * StateStore
 * =============================================================================
 * Serialized command processor and sole owner of {@link ApplicationState}.
 *
 * <h2>Concurrency invariant</h2>
 * At most one command executes at a time, commands execute in strict enqueue
 * order, and no command observes a partially applied predecessor. Producers
 * may enqueue from any thread; only the processor replaces the state. The
 * queue is the lock: the state object itself is never locked by handlers.
 *
 * <h2>Threading Model</h2>
 * <pre>
 *   store.start()      → starts the processor thread
 *   store.enqueue(...) → authorizes and appends to the FIFO, returns immediately
 *   store.stop()       → stops the processor; queued commands stay queued
 * </pre>
 * While stopped, {@link #drain()} and {@link #step()} process queued commands
 * on the caller's thread. Tests use this for deterministic, single-threaded
 * execution.
 *
 * <h2>Failure isolation</h2>
 * Unknown command types are logged and dropped. A handler failure degrades
 * only that command: it is reported to the observability sink and the loop
 * moves on. The processor never exits because of a single bad command.
 *
 * <h2>Subscriptions</h2>
 * State replacement and listener notification happen under one lock, and
 * {@link #subscribe} registers and replays the current value under the same
 * lock, so a subscriber never misses the first update.
 */
public final class StateStore implements InternalCommandQueue
{
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final Map<String, CommandHandler> handlers;
    private final CommandAuthorizer authorizer;
    private final WallClock wallClock;
    private final Duration hardwareTimeout;
    private final PipelineObservabilitySink observabilitySink;

    private final BlockingQueue<Command> queue = new LinkedBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object enqueueLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger outstanding = new AtomicInteger();
    private final Object idleMonitor = new Object();

    private final Object emitLock = new Object();
    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    private volatile ApplicationState currentState;
    private volatile Thread processorThread;

    private StateStore(Builder b)
    {
        this.handlers = Map.copyOf(b.handlers);
        this.authorizer = b.authorizer;
        this.wallClock = b.wallClock;
        this.hardwareTimeout = b.hardwareTimeout;
        this.observabilitySink = Objects.requireNonNullElse(b.observabilitySink, NullObservabilitySink.INSTANCE);
        this.currentState = ApplicationState.initial(wallClock.now());
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Producer side
    // ---------------------------------------------------------------------

    /**
     * Authorizes and enqueues an external command.
     *
     * @throws com.muts.ecu.api.PolicyDeniedException if the authorizer refuses it;
     *         nothing is enqueued in that case
     */
    public Command enqueue(String type, CommandPayload payload)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        authorizer.authorize(type, payload);
        return offer(type, payload, false);
    }

    @Override
    public Command enqueueInternal(String type, CommandPayload payload)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        return offer(type, payload, true);
    }

    private Command offer(String type, CommandPayload payload, boolean internal)
    {
        synchronized (enqueueLock) {
            Command command = new Command(UUID.randomUUID().toString(), type, payload,
                wallClock.now(), sequence.incrementAndGet(), internal);
            outstanding.incrementAndGet();
            queue.offer(command);
            return command;
        }
    }

    // ---------------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------------

    public ApplicationState getState()
    {
        return currentState;
    }

    public <T> Subscription subscribe(StateChannel<T> channel, Consumer<? super T> callback)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(callback, "callback");
        Listener<T> listener = new Listener<>(channel, callback);
        synchronized (emitLock) {
            listeners.add(listener);
            listener.deliver(currentState);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Number of commands enqueued but not yet fully processed.
     */
    public int pendingCommands()
    {
        return outstanding.get();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts the processor thread. Idempotent.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            processorThread = new Thread(this::runLoop, "ecu-state-store");
            processorThread.start();
        }
    }

    /**
     * Stops the processor thread and waits for it to finish its current
     * command.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = processorThread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            processorThread = null;
        }
    }

    public boolean isRunning()
    {
        return running.get();
    }

    /**
     * Processes queued commands on the caller's thread until the queue is
     * empty, including follow-ups they enqueue.
     *
     * @return number of commands processed
     * @throws IllegalStateException if the processor thread is running
     */
    public int drain()
    {
        int processed = 0;
        while (step()) {
            processed++;
        }
        return processed;
    }

    /**
     * Processes at most one queued command on the caller's thread.
     *
     * @return {@code true} if a command was processed
     * @throws IllegalStateException if the processor thread is running
     */
    public boolean step()
    {
        if (running.get()) {
            throw new IllegalStateException("step()/drain() are only available while the processor is stopped");
        }
        Command command = queue.poll();
        if (command == null) {
            return false;
        }
        processAndSettle(command);
        return true;
    }

    /**
     * Waits until every enqueued command (and every follow-up) has been
     * processed.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (outstanding.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    // ---------------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------------

    private void runLoop()
    {
        while (running.get()) {
            try {
                Command command = queue.take();
                if (running.get()) {
                    processAndSettle(command);
                } else {
                    // Put it back for a later drain() or restart.
                    requeueFront(command);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            } catch (Exception e) {
                observabilitySink.onError(new PipelineErrorEvent(
                    SystemWallClock.INSTANCE.now(), "Command loop error", e));
            }
        }
    }

    private void requeueFront(Command command)
    {
        synchronized (enqueueLock) {
            List<Command> rest = new ArrayList<>();
            queue.drainTo(rest);
            queue.offer(command);
            queue.addAll(rest);
        }
    }

    private void processAndSettle(Command command)
    {
        try {
            process(command);
        } finally {
            synchronized (idleMonitor) {
                if (outstanding.decrementAndGet() <= 0) {
                    idleMonitor.notifyAll();
                }
            }
        }
    }

    private void process(Command command)
    {
        CommandHandler handler = handlers.get(command.type());
        if (handler == null) {
            log.warn("Dropping command {} with unknown type '{}'", command.id(), command.type());
            observabilitySink.onCommandRejected(new CommandRejectedEvent(
                wallClock.now(), command, FailureKind.UNKNOWN_COMMAND, "Unknown command type " + command.type()));
            return;
        }

        ApplicationState before = currentState;
        try {
            handler.handle(command, new Context(command));
        } catch (CommandRejectedException e) {
            log.warn("Command {} ({}) rejected: {}", command.id(), command.type(), e.getMessage());
            observabilitySink.onCommandRejected(new CommandRejectedEvent(
                wallClock.now(), command, e.kind(), e.getMessage()));
        } catch (EcuPipelineException e) {
            log.warn("Command {} ({}) failed [{}]: {}", command.id(), command.type(), e.kind(), e.getMessage());
            observabilitySink.onError(new PipelineErrorEvent(
                wallClock.now(), "Command " + command.type() + " failed: " + e.getMessage(), e));
        } catch (RuntimeException e) {
            log.error("Command {} ({}) crashed", command.id(), command.type(), e);
            observabilitySink.onError(new PipelineErrorEvent(
                wallClock.now(), "Command " + command.type() + " crashed", e));
        }

        ApplicationState after = currentState;
        Set<String> changed = new LinkedHashSet<>();
        for (StateChannel<?> channel : StateChannel.values()) {
            if (channel.changed(before, after)) {
                changed.add(channel.name());
            }
        }
        if (!changed.isEmpty()) {
            observabilitySink.onStateTransition(new StateTransitionEvent(
                wallClock.now(), command, before, after, changed));
        }
    }

    private void commit(UnaryOperator<ApplicationState> change)
    {
        synchronized (emitLock) {
            ApplicationState before = currentState;
            ApplicationState after = Objects.requireNonNull(change.apply(before), "new state");
            if (after == before) {
                return;
            }
            currentState = after;
            for (Listener<?> listener : listeners) {
                if (listener.channel().changed(before, after)) {
                    listener.deliver(after);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private record Listener<T>(StateChannel<T> channel, Consumer<? super T> callback) {
        void deliver(ApplicationState state) {
            try {
                callback.accept(channel.extract(state));
            } catch (RuntimeException e) {
                log.warn("Subscriber to '{}' threw: {}", channel.name(), e.toString());
            }
        }
    }

    private final class Context implements CommandContext {
        private final Command command;

        private Context(Command command) {
            this.command = command;
        }

        @Override
        public ApplicationState state() {
            return currentState;
        }

        @Override
        public void update(UnaryOperator<ApplicationState> change) {
            commit(change);
        }

        @Override
        public Command enqueue(String type, CommandPayload payload) {
            return enqueueInternal(type, payload);
        }

        @Override
        public InternalCommandQueue queue() {
            return StateStore.this;
        }

        @Override
        public Instant now() {
            return wallClock.now();
        }

        @Override
        public <T> T await(CompletableFuture<T> future, String operation) {
            Objects.requireNonNull(future, "future");
            try {
                return future.get(hardwareTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TransportFailureException tfe) {
                    throw tfe;
                }
                throw new TransportFailureException(operation + " failed: " + cause, cause);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new TransportFailureException(
                    operation + " timed out after " + hardwareTimeout.toMillis() + " ms", e);
            } catch (CancellationException e) {
                throw new TransportFailureException(operation + " cancelled", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportFailureException(operation + " interrupted (command " + command.id() + ")", e);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();
        private CommandAuthorizer authorizer = CommandAuthorizer.ALLOW_ALL;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Duration hardwareTimeout = Duration.ofSeconds(10);
        private PipelineObservabilitySink observabilitySink;

        private Builder() {}

        public Builder handle(String type, CommandHandler handler) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(handler, "handler");
            if (handlers.putIfAbsent(type, handler) != null) {
                throw new IllegalArgumentException("Handler already registered for " + type);
            }
            return this;
        }

        public Builder withAuthorizer(CommandAuthorizer authorizer) {
            this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withHardwareTimeout(Duration hardwareTimeout) {
            this.hardwareTimeout = Objects.requireNonNull(hardwareTimeout, "hardwareTimeout");
            return this;
        }

        public Builder withObservabilitySink(PipelineObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public StateStore build() {
            return new StateStore(this);
        }
    }
}
