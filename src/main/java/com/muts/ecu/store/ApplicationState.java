package com.muts.ecu.store;

import com.muts.ecu.session.TuningApplySession;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ApplicationState
 * =============================================================================
 * The single authoritative snapshot of vehicle-facing state.
 *
 * <p>Owned by {@link StateStore}: only the command processor replaces it.
 * Every instance is deeply immutable, so handing the current reference to a
 * reader is equivalent to handing out a copy.</p>
 */
public record ApplicationState(
    ConnectionState connection,
    TelemetryState telemetry,
    DiagnosticsState diagnostics,
    FlashState flash,
    SafetyState safety,
    Map<String, TuningApplySession> sessions
) {
    public ApplicationState {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(telemetry, "telemetry");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(flash, "flash");
        Objects.requireNonNull(safety, "safety");
        sessions = Collections.unmodifiableMap(new LinkedHashMap<>(sessions));
    }

    public static ApplicationState initial(Instant at)
    {
        return new ApplicationState(
            ConnectionState.disconnected(at),
            TelemetryState.empty(),
            DiagnosticsState.empty(),
            FlashState.empty(),
            SafetyState.disarmed(),
            Map.of());
    }

    public Optional<TuningApplySession> session(String id)
    {
        return Optional.ofNullable(sessions.get(id));
    }

    public ApplicationState withConnection(ConnectionState value)
    {
        return new ApplicationState(value, telemetry, diagnostics, flash, safety, sessions);
    }

    public ApplicationState withTelemetry(TelemetryState value)
    {
        return new ApplicationState(connection, value, diagnostics, flash, safety, sessions);
    }

    public ApplicationState withDiagnostics(DiagnosticsState value)
    {
        return new ApplicationState(connection, telemetry, value, flash, safety, sessions);
    }

    public ApplicationState withFlash(FlashState value)
    {
        return new ApplicationState(connection, telemetry, diagnostics, value, safety, sessions);
    }

    public ApplicationState withSafety(SafetyState value)
    {
        return new ApplicationState(connection, telemetry, diagnostics, flash, value, sessions);
    }

    /**
     * Replaces or adds a session. Only the {@code historyLimit} most recently
     * ended sessions are kept; older terminal sessions remain in the tuning
     * record store. Live sessions are never evicted.
     */
    public ApplicationState withSession(TuningApplySession value, int historyLimit)
    {
        Map<String, TuningApplySession> next = new LinkedHashMap<>(sessions);
        // Re-insert so iteration order follows the last update.
        next.remove(value.id());
        next.put(value.id(), value);

        long terminal = next.values().stream().filter(s -> s.status().isTerminal()).count();
        Iterator<TuningApplySession> it = next.values().iterator();
        while (terminal > historyLimit && it.hasNext()) {
            if (it.next().status().isTerminal()) {
                it.remove();
                terminal--;
            }
        }
        return new ApplicationState(connection, telemetry, diagnostics, flash, safety, next);
    }
}
