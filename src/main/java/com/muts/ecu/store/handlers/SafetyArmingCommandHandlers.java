package com.muts.ecu.store.handlers;

import com.muts.ecu.api.FailureKind;
import com.muts.ecu.flash.FlashJobCoordinator;
import com.muts.ecu.mode.OperatorModeGate;
import com.muts.ecu.session.ApplySessionCoordinator;
import com.muts.ecu.store.Command;
import com.muts.ecu.store.CommandContext;
import com.muts.ecu.store.CommandRejectedException;
import com.muts.ecu.store.CommandTypes;
import com.muts.ecu.store.SafetyLevel;
import com.muts.ecu.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * System-level arming.
 *
 * <p>Disarming is the operator's stop switch: it aborts the active flash job,
 * cancels every open session and drops the level to READ_ONLY.</p>
 */
public final class SafetyArmingCommandHandlers
{
    private static final Logger log = LoggerFactory.getLogger(SafetyArmingCommandHandlers.class);

    static final String DISARM_REASON = "system disarmed";

    private final OperatorModeGate gate;
    private final ApplySessionCoordinator sessions;
    private final FlashJobCoordinator flash;

    public SafetyArmingCommandHandlers(OperatorModeGate gate,
                                       ApplySessionCoordinator sessions,
                                       FlashJobCoordinator flash)
    {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.flash = Objects.requireNonNull(flash, "flash");
    }

    public void registerWith(StateStore.Builder builder)
    {
        builder.handle(CommandTypes.SAFETY_ARM, this::arm)
            .handle(CommandTypes.SAFETY_DISARM, this::disarm);
    }

    void arm(Command command, CommandContext ctx)
    {
        SafetyLevel level;
        try {
            level = SafetyLevel.parse(command.payload().requireString("level"));
        } catch (IllegalArgumentException e) {
            throw CommandRejectedException.invalid(e.getMessage());
        }
        if (level == SafetyLevel.LIVE_APPLY
            && gate.config().requiresConfirmation()
            && !command.payload().flag("confirmed"))
        {
            throw new CommandRejectedException(FailureKind.POLICY_DENIED,
                "Explicit confirmation required in " + gate.mode().displayName());
        }
        ctx.update(s -> s.withSafety(s.safety().withArming(level != SafetyLevel.READ_ONLY, level)));
        log.info("System armed at {}", level);
    }

    void disarm(Command command, CommandContext ctx)
    {
        flash.abortActive(ctx, DISARM_REASON);
        sessions.cancelAll(ctx, DISARM_REASON);
        ctx.update(s -> s.withSafety(s.safety().withArming(false, SafetyLevel.READ_ONLY)));
        log.info("System disarmed");
    }
}
