package com.muts.ecu.mode;

import java.util.Collection;
import java.util.Objects;

/**
 * OperatorModeGate
 * =============================================================================
 * Pure policy lookup consulted by every write-path entry point.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@link OperationKind#ECU_WRITE} requires {@link ModeConfig#allowsEcuWrites()}.</li>
 *   <li>{@link OperationKind#MOCK_INTERFACE} requires {@link ModeConfig#allowsMockInterface()}.</li>
 *   <li>{@link OperationKind#HARDWARE_ACCESS} requires a real transport when
 *       {@link ModeConfig#requiresRealHardware()} is set.</li>
 *   <li>{@link OperationKind#DANGEROUS} requires operator confirmation when
 *       {@link ModeConfig#requiresConfirmation()} is set.</li>
 * </ul>
 *
 * <p>No side effects and no I/O: the same mode and operation always produce
 * the same {@link Authorization}.</p>
 */
public final class OperatorModeGate
{
    private final OperatorMode mode;

    public OperatorModeGate(OperatorMode mode)
    {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public OperatorMode mode()
    {
        return mode;
    }

    public ModeConfig config()
    {
        return mode.config();
    }

    public Authorization authorize(Operation operation)
    {
        Objects.requireNonNull(operation, "operation");
        ModeConfig config = mode.config();

        switch (operation.kind()) {
            case ECU_WRITE:
                return config.allowsEcuWrites()
                    ? Authorization.allow()
                    : Authorization.deny("ECU writes not allowed in " + mode.displayName());
            case MOCK_INTERFACE:
                return config.allowsMockInterface()
                    ? Authorization.allow()
                    : Authorization.deny("Mock interfaces not allowed in " + mode.displayName());
            case HARDWARE_ACCESS:
                return !config.requiresRealHardware() || operation.realHardware()
                    ? Authorization.allow()
                    : Authorization.deny("Real hardware required in " + mode.displayName());
            case DANGEROUS:
                return !config.requiresConfirmation() || operation.confirmed()
                    ? Authorization.allow()
                    : Authorization.deny("Explicit confirmation required in " + mode.displayName());
            default:
                return Authorization.deny("Unknown operation " + operation.kind());
        }
    }

    /**
     * Authorizes every operation in order and returns the first denial, or
     * {@link Authorization#allow()} if all pass.
     */
    public Authorization authorizeAll(Collection<Operation> operations)
    {
        Objects.requireNonNull(operations, "operations");
        for (Operation op : operations) {
            Authorization result = authorize(op);
            if (!result.allowed()) {
                return result;
            }
        }
        return Authorization.allow();
    }
}
