package com.muts.ecu.mode;

import com.muts.ecu.api.FailureKind;
import com.muts.ecu.api.PolicyDeniedException;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandTypes;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandPolicyTest {

    @Test
    void devModeRejectsSystemArming() {
        CommandPolicy policy = new CommandPolicy(new OperatorModeGate(OperatorMode.DEV), () -> true);

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
            () -> policy.authorize(CommandTypes.SAFETY_ARM, CommandPayload.of("level", "simulation")));

        assertEquals(FailureKind.POLICY_DENIED, e.kind());
        assertEquals(CommandTypes.SAFETY_ARM, e.commandType());
        assertEquals("ECU writes not allowed in Development Mode", e.reason());
    }

    @Test
    void workshopModeRejectsConnectingASimulatedInterface() {
        CommandPolicy policy = new CommandPolicy(new OperatorModeGate(OperatorMode.WORKSHOP), () -> true);

        assertThrows(PolicyDeniedException.class,
            () -> policy.authorize(CommandTypes.CONNECTION_CONNECT, CommandPayload.of("interfaceId", "sim0")));
    }

    @Test
    void workshopModeAllowsConnectingRealHardware() {
        CommandPolicy policy = new CommandPolicy(new OperatorModeGate(OperatorMode.WORKSHOP), () -> false);

        assertDoesNotThrow(
            () -> policy.authorize(CommandTypes.CONNECTION_CONNECT, CommandPayload.of("interfaceId", "can0")));
    }

    @Test
    void sessionArmNeedsConfirmationInWorkshopMode() {
        CommandPolicy policy = new CommandPolicy(new OperatorModeGate(OperatorMode.WORKSHOP), () -> false);

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
            () -> policy.authorize(CommandTypes.SESSION_ARM, CommandPayload.of("sessionId", "s1")));
        assertEquals("Explicit confirmation required in Workshop Mode", e.reason());

        assertDoesNotThrow(() -> policy.authorize(CommandTypes.SESSION_ARM,
            CommandPayload.of("sessionId", "s1").with("confirmed", true)));
    }

    @Test
    void labModeRequiresRealHardwareForFlashStart() {
        CommandPolicy policy = new CommandPolicy(new OperatorModeGate(OperatorMode.LAB), () -> true);

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> policy.authorize(
            CommandTypes.FLASH_START, CommandPayload.of("jobId", "j1").with("confirmed", true)));
        assertEquals("Real hardware required in Lab Mode", e.reason());
    }

    @Test
    void readOnlyCommandsNeedNothing() {
        CommandPolicy policy = new CommandPolicy(new OperatorModeGate(OperatorMode.DEV), () -> true);

        assertTrue(policy.requiredOperations(CommandTypes.DIAGNOSTICS_SCAN, CommandPayload.empty()).isEmpty());
        assertTrue(policy.requiredOperations(CommandTypes.SAFETY_DISARM, CommandPayload.empty()).isEmpty());
        assertTrue(policy.requiredOperations(CommandTypes.SESSION_CANCEL, CommandPayload.empty()).isEmpty());
    }
}
