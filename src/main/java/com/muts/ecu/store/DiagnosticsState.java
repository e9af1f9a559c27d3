package com.muts.ecu.store;

import com.muts.ecu.transport.DiagnosticCode;

import java.time.Instant;
import java.util.List;

/**
 * Diagnostics slice of {@link ApplicationState}.
 *
 * @param lastScan {@code null} until the first completed scan
 */
public record DiagnosticsState(List<DiagnosticCode> codes, Instant lastScan, boolean scanning)
{
    public DiagnosticsState {
        codes = codes == null ? List.of() : List.copyOf(codes);
    }

    public static DiagnosticsState empty()
    {
        return new DiagnosticsState(List.of(), null, false);
    }
}
