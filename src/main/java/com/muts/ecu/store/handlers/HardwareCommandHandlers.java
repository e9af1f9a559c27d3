package com.muts.ecu.store.handlers;

import com.muts.ecu.api.ConnectionStatus;
import com.muts.ecu.store.Command;
import com.muts.ecu.store.CommandContext;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandRejectedException;
import com.muts.ecu.store.CommandTypes;
import com.muts.ecu.store.ConnectionState;
import com.muts.ecu.store.DiagnosticsState;
import com.muts.ecu.store.StateStore;
import com.muts.ecu.time.Cancellable;
import com.muts.ecu.time.MonotonicClock;
import com.muts.ecu.time.MonotonicScheduler;
import com.muts.ecu.transport.DiagnosticCode;
import com.muts.ecu.transport.EcuTransport;
import com.muts.ecu.transport.TelemetrySnapshot;
import com.muts.ecu.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connection, telemetry and diagnostics commands.
 *
 * <p>Telemetry polling runs on the scheduler but never touches state itself:
 * each tick only enqueues an internal {@code telemetry:sample} command, which
 * the processor executes in order with everything else. Ticks coalesce: while
 * a sample is still queued, further ticks enqueue nothing, so a slow transport
 * cannot build a backlog in front of operator commands.</p>
 */
public final class HardwareCommandHandlers
{
    private static final Logger log = LoggerFactory.getLogger(HardwareCommandHandlers.class);

    private final EcuTransport transport;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration telemetryInterval;

    // Processor thread only.
    private Cancellable polling;

    // Set by the timer thread, cleared by the processor.
    private final AtomicBoolean samplePending = new AtomicBoolean();

    public HardwareCommandHandlers(EcuTransport transport,
                                   MonotonicScheduler scheduler,
                                   MonotonicClock clock,
                                   Duration telemetryInterval)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.telemetryInterval = Objects.requireNonNull(telemetryInterval, "telemetryInterval");
    }

    public void registerWith(StateStore.Builder builder)
    {
        builder.handle(CommandTypes.CONNECTION_CONNECT, this::connect)
            .handle(CommandTypes.CONNECTION_DISCONNECT, this::disconnect)
            .handle(CommandTypes.TELEMETRY_START, this::startTelemetry)
            .handle(CommandTypes.TELEMETRY_STOP, this::stopTelemetry)
            .handle(CommandTypes.TELEMETRY_SAMPLE, this::sample)
            .handle(CommandTypes.DIAGNOSTICS_SCAN, this::scan);
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    void connect(Command command, CommandContext ctx)
    {
        String interfaceId = command.payload().requireString("interfaceId");
        ConnectionState current = ctx.state().connection();
        if (current.isConnected()) {
            if (interfaceId.equals(current.interfaceId())) {
                return;
            }
            throw CommandRejectedException.conflict("Already connected to " + current.interfaceId());
        }

        ctx.update(s -> s.withConnection(
            new ConnectionState(ConnectionStatus.CONNECTING, interfaceId, null, ctx.now())));
        try {
            ctx.await(transport.connect(interfaceId), "connect " + interfaceId);
        } catch (TransportFailureException e) {
            ctx.update(s -> s.withConnection(
                new ConnectionState(ConnectionStatus.ERROR, interfaceId, e.getMessage(), ctx.now())));
            throw e;
        }
        ctx.update(s -> s.withConnection(
            new ConnectionState(ConnectionStatus.CONNECTED, interfaceId, null, ctx.now())));
        log.info("Connected to {}{}", interfaceId, transport.isSimulated() ? " (simulated)" : "");
    }

    void disconnect(Command command, CommandContext ctx)
    {
        stopPolling(ctx);
        if (ctx.state().connection().status() == ConnectionStatus.DISCONNECTED) {
            return;
        }
        try {
            ctx.await(transport.disconnect(), "disconnect");
        } catch (TransportFailureException e) {
            ctx.update(s -> s.withConnection(
                new ConnectionState(ConnectionStatus.DISCONNECTED, null, e.getMessage(), ctx.now())));
            throw e;
        }
        ctx.update(s -> s.withConnection(ConnectionState.disconnected(ctx.now())));
    }

    // ---------------------------------------------------------------------
    // Telemetry
    // ---------------------------------------------------------------------

    void startTelemetry(Command command, CommandContext ctx)
    {
        if (!ctx.state().connection().isConnected()) {
            throw CommandRejectedException.conflict("Hardware not connected");
        }
        if (polling == null) {
            polling = scheduler.scheduleRepeating(telemetryInterval, clock, () -> {
                if (samplePending.compareAndSet(false, true)) {
                    ctx.queue().enqueueInternal(CommandTypes.TELEMETRY_SAMPLE, CommandPayload.empty());
                }
            });
        }
        ctx.update(s -> s.withTelemetry(s.telemetry().withStreaming(true)));
    }

    void stopTelemetry(Command command, CommandContext ctx)
    {
        stopPolling(ctx);
    }

    void sample(Command command, CommandContext ctx)
    {
        samplePending.set(false);
        if (!ctx.state().telemetry().streaming() || !ctx.state().connection().isConnected()) {
            return;
        }
        TelemetrySnapshot reading = ctx.await(transport.readTelemetry(), "readTelemetry");
        ctx.update(s -> s.withTelemetry(s.telemetry().withLatest(reading)));
    }

    private void stopPolling(CommandContext ctx)
    {
        if (polling != null) {
            polling.cancel();
            polling = null;
        }
        if (ctx.state().telemetry().streaming()) {
            ctx.update(s -> s.withTelemetry(s.telemetry().withStreaming(false)));
        }
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    void scan(Command command, CommandContext ctx)
    {
        if (!ctx.state().connection().isConnected()) {
            throw CommandRejectedException.conflict("Hardware not connected");
        }
        DiagnosticsState previous = ctx.state().diagnostics();
        ctx.update(s -> s.withDiagnostics(new DiagnosticsState(previous.codes(), previous.lastScan(), true)));
        List<DiagnosticCode> codes;
        try {
            codes = ctx.await(transport.readDtcs(), "readDtcs");
        } catch (TransportFailureException e) {
            ctx.update(s -> s.withDiagnostics(new DiagnosticsState(previous.codes(), previous.lastScan(), false)));
            throw e;
        }
        ctx.update(s -> s.withDiagnostics(new DiagnosticsState(codes, ctx.now(), false)));
    }
}
