package com.muts.ecu.store;

import com.muts.ecu.api.EcuPipelineException;
import com.muts.ecu.api.FailureKind;

/**
 * Thrown by a command handler when the command is malformed or illegal in the
 * current state. The processor reports it and moves on; it never reaches the
 * producer that enqueued the command.
 */
public final class CommandRejectedException extends EcuPipelineException
{
    public CommandRejectedException(FailureKind kind, String message)
    {
        super(kind, message);
    }

    public static CommandRejectedException invalid(String message)
    {
        return new CommandRejectedException(FailureKind.INVALID_COMMAND, message);
    }

    public static CommandRejectedException conflict(String message)
    {
        return new CommandRejectedException(FailureKind.STATE_CONFLICT, message);
    }
}
