package com.muts.ecu.safety;

import com.muts.ecu.transport.TelemetrySnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reading attached to a tuning-apply session for one check cycle, together
 * with the breaches it produced.
 */
public record SafetySnapshot(
    String id,
    String sessionId,
    TelemetrySnapshot reading,
    List<BoundBreach> breaches,
    Instant recordedAt
) {
    public SafetySnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(reading, "reading");
        Objects.requireNonNull(recordedAt, "recordedAt");
        breaches = List.copyOf(breaches);
    }

    public boolean isCritical()
    {
        return breaches.stream().anyMatch(BoundBreach::isCritical);
    }
}
