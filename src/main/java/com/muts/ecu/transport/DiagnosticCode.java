package com.muts.ecu.transport;

import java.util.Objects;

/**
 * Diagnostic trouble code reported by the ECU.
 */
public record DiagnosticCode(String code, String description, String status)
{
    public DiagnosticCode {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(status, "status");
    }
}
