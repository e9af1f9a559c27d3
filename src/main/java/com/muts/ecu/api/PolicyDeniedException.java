package com.muts.ecu.api;

import java.util.Objects;

/**
 * Thrown synchronously from {@link EcuPipeline#enqueueCommand} when the
 * Operator Mode Gate refuses a command. The command is never enqueued and no
 * safety event is recorded.
 */
public final class PolicyDeniedException extends EcuPipelineException
{
    private final String commandType;
    private final String reason;

    public PolicyDeniedException(String commandType, String reason)
    {
        super(FailureKind.POLICY_DENIED, commandType + " denied: " + reason);
        this.commandType = Objects.requireNonNull(commandType, "commandType");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String commandType()
    {
        return commandType;
    }

    public String reason()
    {
        return reason;
    }
}
