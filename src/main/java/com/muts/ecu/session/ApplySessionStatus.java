package com.muts.ecu.session;

/**
 * Lifecycle of a tuning-apply session.
 *
 * <pre>
 *   PENDING --arm--> ARMED --apply--> APPLYING --all written--> APPLIED
 *                      |                  |
 *                      +--expire--> EXPIRED  +--breach / write failure--> FAILED (auto revert)
 *                                            +--breach / write failure--> REVERTED (profile cannot revert)
 *   any non-terminal --cancel--> REVERTED
 * </pre>
 */
public enum ApplySessionStatus
{
    PENDING,
    ARMED,
    APPLYING,
    APPLIED,
    REVERTED,
    EXPIRED,
    FAILED;

    public boolean isTerminal()
    {
        return this == APPLIED || this == REVERTED || this == EXPIRED || this == FAILED;
    }

    /**
     * ARMED and APPLYING sessions count against the concurrency limit.
     */
    public boolean isActive()
    {
        return this == ARMED || this == APPLYING;
    }
}
