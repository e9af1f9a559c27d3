package com.muts.ecu.mode;

/**
 * Operation categories the {@link OperatorModeGate} knows how to judge.
 */
public enum OperationKind
{
    /** Anything that may change ECU memory or system arming. */
    ECU_WRITE,

    /** Use of a simulated (mock) ECU interface. */
    MOCK_INTERFACE,

    /** Operation that must reach real vehicle hardware. */
    HARDWARE_ACCESS,

    /** Operation that needs explicit operator confirmation. */
    DANGEROUS
}
