package com.muts.ecu.persistence;

import com.muts.ecu.api.EcuPipelineException;
import com.muts.ecu.api.FailureKind;

/**
 * A record or safety event could not be made durable. The hardware action
 * that depended on it must not proceed.
 */
public final class PersistenceFailureException extends EcuPipelineException
{
    public PersistenceFailureException(String message)
    {
        super(FailureKind.PERSISTENCE_FAILURE, message);
    }

    public PersistenceFailureException(String message, Throwable cause)
    {
        super(FailureKind.PERSISTENCE_FAILURE, message, cause);
    }
}
