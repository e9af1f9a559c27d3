package com.muts.ecu.session;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Inputs to the {@link ApplySessionReducer}. Every event carries the wall
 * clock time at which the processor observed it.
 */
public sealed interface ApplySessionEvent
{
    Instant at();

    /** All arming preconditions passed; arm until {@code expiresAt}. */
    record Arm(Instant at, Instant expiresAt) implements ApplySessionEvent {
        public Arm {
            Objects.requireNonNull(at, "at");
            Objects.requireNonNull(expiresAt, "expiresAt");
        }
    }

    /** Start applying {@code changes}; empty for flash-driven sessions. */
    record BeginApply(Instant at, List<ParameterChange> changes) implements ApplySessionEvent {
        public BeginApply {
            Objects.requireNonNull(at, "at");
            changes = List.copyOf(changes);
        }
    }

    /** The next pending change was written (or simulated) successfully. */
    record ChangeWritten(Instant at) implements ApplySessionEvent {}

    /** A flash job linked to the session completed. */
    record Completed(Instant at) implements ApplySessionEvent {}

    /**
     * A critical breach or hardware failure stopped the apply.
     *
     * @param revert what can be done about changes already written
     */
    record Failed(Instant at, String reason, Revert revert) implements ApplySessionEvent {
        public Failed {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(revert, "revert");
        }
    }

    /** Handling of already-written changes when an apply fails. */
    enum Revert {
        /** The profile allows writing previous values back; the session ends FAILED. */
        AUTOMATIC,
        /** The profile cannot revert; the session ends REVERTED with the reason recorded. */
        UNSUPPORTED,
        /** Not a parameter-write failure; the session ends FAILED. */
        NONE;

        public static Revert forProfile(boolean supportsRevert)
        {
            return supportsRevert ? AUTOMATIC : UNSUPPORTED;
        }
    }

    /** Periodic expiry sweep. */
    record ExpirySweep(Instant at) implements ApplySessionEvent {}

    /** Explicit operator cancel. */
    record Cancel(Instant at, String reason) implements ApplySessionEvent {
        public Cancel {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
