package com.muts.ecu.transport.udp;

/**
 * A gateway frame body could not be built or parsed.
 */
public final class GatewayFrameException extends RuntimeException
{
    public GatewayFrameException(String message)
    {
        super(message);
    }

    public GatewayFrameException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
