package com.muts.ecu.flash;

/**
 * Lifecycle of a flash job.
 *
 * <pre>
 *   PREPARED --start--> FLASHING --last block--> VERIFYING --readback ok--> COMPLETED
 *   any non-terminal --abort--> ABORTED
 *   any non-terminal --I/O or checksum failure--> FAILED
 * </pre>
 */
public enum FlashJobState
{
    PREPARED,
    FLASHING,
    VERIFYING,
    COMPLETED,
    FAILED,
    ABORTED;

    public boolean isTerminal()
    {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }

    /**
     * Whether the job is currently writing or verifying.
     */
    public boolean isInFlight()
    {
        return this == FLASHING || this == VERIFYING;
    }
}
