package com.muts.ecu.mode;

import com.muts.ecu.api.PolicyDeniedException;
import com.muts.ecu.store.CommandAuthorizer;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandTypes;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * CommandPolicy
 * -----------------------------------------------------------------------------
 * Maps each externally submitted command type to the operations the
 * {@link OperatorModeGate} must allow before the command is enqueued.
 *
 * <p>Commands that only read or that create bookkeeping records need no
 * authorization. Internal follow-up commands are enqueued by the processor
 * itself and never pass through this policy.</p>
 */
public final class CommandPolicy implements CommandAuthorizer
{
    private static final String CONFIRMED = "confirmed";

    private final OperatorModeGate gate;
    private final BooleanSupplier simulatedTransport;

    /**
     * @param gate               the process-wide gate
     * @param simulatedTransport reports whether the active transport is simulated
     */
    public CommandPolicy(OperatorModeGate gate, BooleanSupplier simulatedTransport)
    {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.simulatedTransport = Objects.requireNonNull(simulatedTransport, "simulatedTransport");
    }

    /**
     * Returns the operations a command of {@code type} must have authorized.
     */
    public List<Operation> requiredOperations(String type, CommandPayload payload)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");

        boolean confirmed = payload.flag(CONFIRMED);
        boolean real = !simulatedTransport.getAsBoolean();

        switch (type) {
            case CommandTypes.CONNECTION_CONNECT:
                return real
                    ? List.of()
                    : List.of(new Operation(OperationKind.MOCK_INTERFACE, confirmed, false));
            case CommandTypes.SAFETY_ARM:
            case CommandTypes.FLASH_PREPARE:
                return List.of(new Operation(OperationKind.ECU_WRITE, confirmed, real));
            case CommandTypes.SESSION_ARM:
            case CommandTypes.FLASH_START:
                return List.of(
                    new Operation(OperationKind.ECU_WRITE, confirmed, real),
                    new Operation(OperationKind.HARDWARE_ACCESS, confirmed, real),
                    new Operation(OperationKind.DANGEROUS, confirmed, real));
            case CommandTypes.SESSION_APPLY:
                return List.of(
                    new Operation(OperationKind.ECU_WRITE, confirmed, real),
                    new Operation(OperationKind.HARDWARE_ACCESS, confirmed, real));
            default:
                return List.of();
        }
    }

    @Override
    public void authorize(String type, CommandPayload payload)
    {
        Authorization result = gate.authorizeAll(requiredOperations(type, payload));
        if (!result.allowed()) {
            throw new PolicyDeniedException(type, result.reason());
        }
    }
}
