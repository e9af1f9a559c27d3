package com.muts.ecu.transport;

import com.muts.ecu.api.EcuPipelineException;
import com.muts.ecu.api.FailureKind;

/**
 * Hardware I/O failed, was refused by the ECU, or timed out.
 */
public final class TransportFailureException extends EcuPipelineException
{
    public TransportFailureException(String message)
    {
        super(FailureKind.TRANSPORT_FAILURE, message);
    }

    public TransportFailureException(String message, Throwable cause)
    {
        super(FailureKind.TRANSPORT_FAILURE, message, cause);
    }
}
