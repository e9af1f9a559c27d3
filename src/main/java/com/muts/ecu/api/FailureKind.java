package com.muts.ecu.api;

/**
 * FailureKind
 * -----------------------------------------------------------------------------
 * Classification carried by every {@link EcuPipelineException}.
 *
 * <p>Policy and validation failures are reported synchronously to the caller.
 * Safety and transport failures surface as session or flash-job transitions
 * plus a durable safety event; they never cross the command queue boundary.</p>
 */
public enum FailureKind
{
    /** Operator Mode Gate rejected the operation. No state change. */
    POLICY_DENIED,

    /** A critical safety bound was breached. */
    SAFETY_VIOLATION,

    /** Hardware I/O failed or timed out. */
    TRANSPORT_FAILURE,

    /** A record or safety event could not be made durable. */
    PERSISTENCE_FAILURE,

    /** No handler is registered for the command type. */
    UNKNOWN_COMMAND,

    /** The command payload is missing a field or carries a mistyped value. */
    INVALID_COMMAND,

    /** The command is not legal in the current session, job or connection state. */
    STATE_CONFLICT
}
