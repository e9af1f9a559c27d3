package com.muts.ecu.store;

import com.muts.ecu.transport.TelemetrySnapshot;

import java.util.Optional;

/**
 * Telemetry slice of {@link ApplicationState}.
 *
 * @param latest    most recent reading, {@code null} before the first one
 * @param streaming periodic polling is active
 */
public record TelemetryState(TelemetrySnapshot latest, boolean streaming)
{
    public static TelemetryState empty()
    {
        return new TelemetryState(null, false);
    }

    public Optional<TelemetrySnapshot> latestSnapshot()
    {
        return Optional.ofNullable(latest);
    }

    public TelemetryState withLatest(TelemetrySnapshot value)
    {
        return new TelemetryState(value, streaming);
    }

    public TelemetryState withStreaming(boolean value)
    {
        return new TelemetryState(latest, value);
    }
}
