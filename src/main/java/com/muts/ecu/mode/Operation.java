package com.muts.ecu.mode;

import java.util.Objects;

/**
 * One operation submitted to {@link OperatorModeGate#authorize(Operation)}.
 *
 * @param kind         operation category
 * @param confirmed    operator supplied explicit confirmation
 * @param realHardware the active transport reaches real hardware
 */
public record Operation(OperationKind kind, boolean confirmed, boolean realHardware)
{
    public Operation {
        Objects.requireNonNull(kind, "kind");
    }

    public static Operation of(OperationKind kind)
    {
        return new Operation(kind, false, false);
    }
}
