package com.muts.ecu.session;

import com.muts.ecu.session.ApplySessionIntents.Kind;

import java.util.Objects;
import java.util.Optional;

/**
 * ApplySessionReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state machine for tuning-apply sessions.
 *
 * <p>Given a session and one {@link ApplySessionEvent}, the reducer computes
 * the next session, the intents the coordinator must execute and, for events
 * that are illegal in the current status, a rejection reason. It performs no
 * I/O and never reads a clock: time arrives on the event.</p>
 *
 * <h2>Expiry</h2>
 * {@link ApplySessionEvent.BeginApply} re-checks
 * {@code status == ARMED && at < expiresAt} itself. An apply that arrives
 * after the deadline moves the session to EXPIRED and is rejected, whether or
 * not the periodic sweep has already run.
 */
public final class ApplySessionReducer
{
    /**
     * Result of applying an event.
     *
     * @param session   the resulting session (unchanged on a pure rejection)
     * @param intents   actions to execute, possibly alongside a rejection
     * @param rejection reason the triggering command must be rejected, if any
     */
    public record Result(TuningApplySession session,
                         ApplySessionIntents intents,
                         Optional<String> rejection) {

        static Result accepted(TuningApplySession session, ApplySessionIntents intents) {
            return new Result(session, intents, Optional.empty());
        }

        static Result rejected(TuningApplySession session, String reason) {
            return new Result(session, ApplySessionIntents.none(), Optional.of(reason));
        }

        public boolean isRejected() {
            return rejection.isPresent();
        }
    }

    public Result apply(TuningApplySession session, ApplySessionEvent event)
    {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(event, "event");

        if (event instanceof ApplySessionEvent.Arm e) {
            return onArm(session, e);
        }
        if (event instanceof ApplySessionEvent.BeginApply e) {
            return onBeginApply(session, e);
        }
        if (event instanceof ApplySessionEvent.ChangeWritten e) {
            return onChangeWritten(session, e);
        }
        if (event instanceof ApplySessionEvent.Completed e) {
            return onCompleted(session, e);
        }
        if (event instanceof ApplySessionEvent.Failed e) {
            return onFailed(session, e);
        }
        if (event instanceof ApplySessionEvent.ExpirySweep e) {
            return onExpirySweep(session, e);
        }
        if (event instanceof ApplySessionEvent.Cancel e) {
            return onCancel(session, e);
        }

        // Unknown events are ignored.
        return Result.accepted(session, ApplySessionIntents.none());
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onArm(TuningApplySession s, ApplySessionEvent.Arm e)
    {
        if (s.status() != ApplySessionStatus.PENDING) {
            return Result.rejected(s, "Session " + s.id() + " cannot be armed from " + s.status());
        }
        if (!e.expiresAt().isAfter(e.at())) {
            return Result.rejected(s, "Arm expiry must be in the future");
        }
        TuningApplySession armed = s.transition(ApplySessionStatus.ARMED, true, e.at())
            .withExpiresAt(e.expiresAt());
        return Result.accepted(armed, ApplySessionIntents.of(Kind.PERSIST, Kind.EMIT_ARMED));
    }

    private Result onBeginApply(TuningApplySession s, ApplySessionEvent.BeginApply e)
    {
        if (s.status() != ApplySessionStatus.ARMED) {
            return Result.rejected(s, "Session " + s.id() + " is " + s.status() + ", not ARMED");
        }
        if (s.isExpiredAt(e.at())) {
            TuningApplySession expired = s.transition(ApplySessionStatus.EXPIRED, false, e.at());
            return new Result(expired,
                ApplySessionIntents.of(Kind.PERSIST, Kind.EMIT_EXPIRED),
                Optional.of("Session " + s.id() + " expired at " + s.expiresAt()));
        }

        TuningApplySession applying = s.transition(ApplySessionStatus.APPLYING, true, e.at())
            .withChanges(e.changes(), 0);
        ApplySessionIntents intents = e.changes().isEmpty()
            ? ApplySessionIntents.of(Kind.PERSIST)
            : ApplySessionIntents.of(Kind.PERSIST, Kind.SCHEDULE_STEP);
        return Result.accepted(applying, intents);
    }

    private Result onChangeWritten(TuningApplySession s, ApplySessionEvent.ChangeWritten e)
    {
        if (s.status() != ApplySessionStatus.APPLYING || s.nextChange().isEmpty()) {
            return Result.rejected(s, "No pending change for session " + s.id());
        }
        int applied = s.appliedCount() + 1;
        TuningApplySession progressed = s.withChanges(s.changes(), applied);

        if (applied == s.changes().size()) {
            TuningApplySession done = progressed.transition(ApplySessionStatus.APPLIED, false, e.at());
            return Result.accepted(done, ApplySessionIntents.of(Kind.PERSIST, Kind.EMIT_APPLIED));
        }
        return Result.accepted(
            progressed.transition(ApplySessionStatus.APPLYING, true, e.at()),
            ApplySessionIntents.of(Kind.PERSIST, Kind.SCHEDULE_STEP));
    }

    private Result onCompleted(TuningApplySession s, ApplySessionEvent.Completed e)
    {
        if (s.status() != ApplySessionStatus.APPLYING) {
            return Result.rejected(s, "Session " + s.id() + " is not APPLYING");
        }
        TuningApplySession done = s.transition(ApplySessionStatus.APPLIED, false, e.at());
        return Result.accepted(done, ApplySessionIntents.of(Kind.PERSIST, Kind.EMIT_APPLIED));
    }

    private Result onFailed(TuningApplySession s, ApplySessionEvent.Failed e)
    {
        if (s.status().isTerminal()) {
            return Result.rejected(s, "Session " + s.id() + " already " + s.status());
        }
        if (e.revert() == ApplySessionEvent.Revert.UNSUPPORTED) {
            TuningApplySession reverted = s.transition(ApplySessionStatus.REVERTED, false, e.at())
                .withRevertReason(e.reason(), e.at());
            return Result.accepted(reverted, ApplySessionIntents.of(Kind.PERSIST));
        }

        TuningApplySession failed = s.transition(ApplySessionStatus.FAILED, false, e.at())
            .withRevertReason(e.reason(), e.at());

        ApplySessionIntents intents = ApplySessionIntents.of(Kind.PERSIST);
        if (e.revert() == ApplySessionEvent.Revert.AUTOMATIC && s.status() == ApplySessionStatus.APPLYING) {
            intents = intents.plus(Kind.REVERT_APPLIED);
        }
        return Result.accepted(failed, intents);
    }

    private Result onExpirySweep(TuningApplySession s, ApplySessionEvent.ExpirySweep e)
    {
        if (s.status() != ApplySessionStatus.ARMED || !s.isExpiredAt(e.at())) {
            return Result.accepted(s, ApplySessionIntents.none());
        }
        TuningApplySession expired = s.transition(ApplySessionStatus.EXPIRED, false, e.at());
        return Result.accepted(expired, ApplySessionIntents.of(Kind.PERSIST, Kind.EMIT_EXPIRED));
    }

    private Result onCancel(TuningApplySession s, ApplySessionEvent.Cancel e)
    {
        if (s.status().isTerminal()) {
            return Result.rejected(s, "Session " + s.id() + " already " + s.status());
        }
        TuningApplySession reverted = s.transition(ApplySessionStatus.REVERTED, false, e.at())
            .withRevertReason(e.reason(), e.at());

        ApplySessionIntents intents = ApplySessionIntents.of(Kind.PERSIST);
        if (s.status() == ApplySessionStatus.APPLYING && s.appliedCount() > 0) {
            intents = intents.plus(Kind.REVERT_APPLIED);
        }
        return Result.accepted(reverted, intents);
    }
}
