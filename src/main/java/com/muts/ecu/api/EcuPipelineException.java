package com.muts.ecu.api;

import java.util.Objects;

/**
 * Base type for every failure raised by the ECU pipeline.
 *
 * <p>All pipeline exceptions are unchecked. The {@link FailureKind} tells the
 * caller (or the command processor) how the failure must be propagated.</p>
 */
public class EcuPipelineException extends RuntimeException
{
    private final FailureKind kind;

    public EcuPipelineException(FailureKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public EcuPipelineException(FailureKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind()
    {
        return kind;
    }
}
