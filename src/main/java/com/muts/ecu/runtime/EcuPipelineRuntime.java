package com.muts.ecu.runtime;

import com.muts.ecu.api.EcuPipeline;
import com.muts.ecu.api.Subscription;
import com.muts.ecu.config.GatewayTransportConfig;
import com.muts.ecu.config.PipelineConfig;
import com.muts.ecu.flash.FlashJobCoordinator;
import com.muts.ecu.mode.CommandPolicy;
import com.muts.ecu.mode.OperatorModeGate;
import com.muts.ecu.observability.PipelineObservabilitySink;
import com.muts.ecu.observability.Slf4jPipelineObservabilitySink;
import com.muts.ecu.persistence.InMemoryTuningRecordStore;
import com.muts.ecu.persistence.TuningRecordStore;
import com.muts.ecu.safety.SafetyEvaluator;
import com.muts.ecu.safety.queue.InMemorySafetyEventStore;
import com.muts.ecu.safety.queue.SafetyEventQueue;
import com.muts.ecu.safety.queue.SafetyEventStore;
import com.muts.ecu.session.ApplySessionCoordinator;
import com.muts.ecu.session.ApplyTokens;
import com.muts.ecu.store.ApplicationState;
import com.muts.ecu.store.Command;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.StateChannel;
import com.muts.ecu.store.StateStore;
import com.muts.ecu.store.handlers.HardwareCommandHandlers;
import com.muts.ecu.store.handlers.SafetyArmingCommandHandlers;
import com.muts.ecu.time.Cancellable;
import com.muts.ecu.time.MonotonicClock;
import com.muts.ecu.time.MonotonicScheduler;
import com.muts.ecu.time.ScheduledExecutorScheduler;
import com.muts.ecu.time.SystemMonotonicClock;
import com.muts.ecu.time.SystemWallClock;
import com.muts.ecu.time.WallClock;
import com.muts.ecu.transport.EcuTransport;
import com.muts.ecu.transport.SimulatedEcuTransport;
import com.muts.ecu.transport.udp.GatewayFrameCodec;
import com.muts.ecu.transport.udp.UdpGatewayTransport;
import com.muts.ecu.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * EcuPipelineRuntime
 * =============================================================================
 * Composition root for the ECU tuning pipeline.
 *
 * <h2>Architectural Role</h2>
 * Wiring and ownership only. It connects the operator mode gate, the command
 * processor and its handler groups, the safety event queue and the record
 * store into one runnable {@link EcuPipeline}. No command semantics live here.
 *
 * <h2>Timers</h2>
 * Timers run on the {@link MonotonicScheduler}: the safety queue delivery
 * loop with its retention cleanup, and the session expiry sweep. The sweep
 * only enqueues an internal {@code session:expire-sweep} command, and never
 * a second one while the first is still queued; all state changes stay on
 * the processor thread.
 *
 * <h2>Threading</h2>
 * {@link #start()} starts the processor thread and both timers. Tests may
 * instead leave the runtime stopped and call {@link #drain()} to process
 * queued commands on the calling thread.
 */
public final class EcuPipelineRuntime implements EcuPipeline, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(EcuPipelineRuntime.class);

    private final PipelineConfig config;
    private final EcuTransport transport;
    private final TuningRecordStore recordStore;
    private final SafetyEventQueue safetyEventQueue;
    private final StateStore stateStore;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock monotonicClock;
    private final ScheduledExecutorService ownedExecutor;
    private final ApplySessionCoordinator sessions;
    private final UdpGatewayTransport ownedGateway;

    private Cancellable expirySweep;

    private EcuPipelineRuntime(Builder b)
    {
        this.config = b.config;
        this.monotonicClock = b.monotonicClock;
        this.recordStore = b.recordStore != null ? b.recordStore : new InMemoryTuningRecordStore();

        if (b.scheduler != null) {
            this.scheduler = b.scheduler;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "ecu-pipeline-timers");
                t.setDaemon(true);
                return t;
            });
            this.scheduler = new ScheduledExecutorScheduler(ownedExecutor, monotonicClock);
        }

        if (b.transport != null) {
            this.transport = b.transport;
            this.ownedGateway = null;
        } else if (b.gateway != null) {
            this.ownedGateway = new UdpGatewayTransport(new NettyUdpDatagramEndpoint(b.gateway.bindAddress()),
                b.gateway, new GatewayFrameCodec(), scheduler, monotonicClock, b.wallClock);
            this.transport = ownedGateway;
        } else {
            this.transport = new SimulatedEcuTransport(b.wallClock);
            this.ownedGateway = null;
        }

        PipelineObservabilitySink sink = b.observabilitySink;
        SafetyEventStore eventStore = b.safetyEventStore != null ? b.safetyEventStore : new InMemorySafetyEventStore();
        this.safetyEventQueue = new SafetyEventQueue(eventStore, config.safetyQueue(), b.wallClock,
            monotonicClock, scheduler, sink);

        OperatorModeGate gate = new OperatorModeGate(config.operatorMode());
        this.sessions = new ApplySessionCoordinator(gate, transport, recordStore,
            safetyEventQueue, new SafetyEvaluator(), b.applyTokens, config, sink);
        FlashJobCoordinator flash = new FlashJobCoordinator(transport, recordStore, sessions, config, sink);

        StateStore.Builder store = StateStore.builder()
            .withAuthorizer(new CommandPolicy(gate, transport::isSimulated))
            .withWallClock(b.wallClock)
            .withHardwareTimeout(config.hardwareTimeout())
            .withObservabilitySink(sink);
        new HardwareCommandHandlers(transport, scheduler, monotonicClock, config.telemetryInterval()).registerWith(store);
        new SafetyArmingCommandHandlers(gate, sessions, flash).registerWith(store);
        sessions.registerWith(store);
        flash.registerWith(store);
        this.stateStore = store.build();

        log.info("ECU pipeline configured: mode={}, transport={}", config.operatorMode().displayName(),
            transport.isSimulated() ? "simulated" : transport.getClass().getSimpleName());
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // EcuPipeline
    // ---------------------------------------------------------------------

    @Override
    public Command enqueueCommand(String type, CommandPayload payload)
    {
        return stateStore.enqueue(type, payload);
    }

    @Override
    public <T> Subscription subscribe(StateChannel<T> channel, Consumer<? super T> callback)
    {
        return stateStore.subscribe(channel, callback);
    }

    @Override
    public ApplicationState getState()
    {
        return stateStore.getState();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    public synchronized void start()
    {
        if (stateStore.isRunning()) {
            return;
        }
        if (ownedGateway != null) {
            ownedGateway.start();
        }
        stateStore.start();
        startTimers();
        log.info("ECU pipeline started");
    }

    /**
     * Starts the safety delivery loop and the expiry sweep without the
     * processor thread. Queued commands then run through {@link #drain()}.
     */
    synchronized void startTimers()
    {
        safetyEventQueue.start();
        if (expirySweep == null) {
            expirySweep = scheduler.scheduleRepeating(config.expirySweepInterval(), monotonicClock,
                () -> sessions.requestExpirySweep(stateStore));
        }
    }

    public synchronized void stop()
    {
        if (expirySweep != null) {
            expirySweep.cancel();
            expirySweep = null;
        }
        safetyEventQueue.stop();
        stateStore.stop();
        if (ownedGateway != null) {
            ownedGateway.stop();
        }
        log.info("ECU pipeline stopped");
    }

    @Override
    public void close()
    {
        stop();
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    /**
     * Processes every queued command on the calling thread, including
     * follow-ups enqueued along the way. Only valid while stopped.
     *
     * @return number of commands processed
     */
    public int drain()
    {
        return stateStore.drain();
    }

    public StateStore stateStore()
    {
        return stateStore;
    }

    public SafetyEventQueue safetyEventQueue()
    {
        return safetyEventQueue;
    }

    public TuningRecordStore recordStore()
    {
        return recordStore;
    }

    public EcuTransport transport()
    {
        return transport;
    }

    public PipelineConfig config()
    {
        return config;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private PipelineConfig config = PipelineConfig.defaults();
        private EcuTransport transport;
        private GatewayTransportConfig gateway;
        private SafetyEventStore safetyEventStore;
        private TuningRecordStore recordStore;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ApplyTokens applyTokens = new ApplyTokens();
        private PipelineObservabilitySink observabilitySink = new Slf4jPipelineObservabilitySink();

        private Builder() {}

        public Builder withConfig(PipelineConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withTransport(EcuTransport transport)
        {
            this.transport = transport;
            return this;
        }

        /**
         * Talks to a hardware gateway over UDP instead of the simulated ECU.
         * Ignored when an explicit transport is supplied. The runtime owns the
         * endpoint and binds it on {@link EcuPipelineRuntime#start()}.
         */
        public Builder withGateway(GatewayTransportConfig gateway)
        {
            this.gateway = gateway;
            return this;
        }

        public Builder withSafetyEventStore(SafetyEventStore safetyEventStore)
        {
            this.safetyEventStore = safetyEventStore;
            return this;
        }

        public Builder withRecordStore(TuningRecordStore recordStore)
        {
            this.recordStore = recordStore;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock monotonicClock)
        {
            this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
            return this;
        }

        /**
         * Timers run on this scheduler. Without one the runtime creates and
         * owns a single-thread executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withApplyTokens(ApplyTokens applyTokens)
        {
            this.applyTokens = Objects.requireNonNull(applyTokens, "applyTokens");
            return this;
        }

        public Builder withObservabilitySink(PipelineObservabilitySink observabilitySink)
        {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public EcuPipelineRuntime build()
        {
            return new EcuPipelineRuntime(this);
        }
    }
}
