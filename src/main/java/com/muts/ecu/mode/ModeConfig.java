package com.muts.ecu.mode;

/**
 * Capabilities granted by an {@link OperatorMode}.
 *
 * @param allowsMockInterface  simulated transports may be connected
 * @param allowsEcuWrites      any write towards the ECU may be attempted
 * @param requiresRealHardware hardware-bound operations refuse simulated transports
 * @param requiresConfirmation dangerous operations need explicit operator confirmation
 */
public record ModeConfig(
    boolean allowsMockInterface,
    boolean allowsEcuWrites,
    boolean requiresRealHardware,
    boolean requiresConfirmation
) {
}
