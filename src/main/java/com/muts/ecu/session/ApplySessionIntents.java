package com.muts.ecu.session;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * ApplySessionIntents
 * -----------------------------------------------------------------------------
 * Immutable set of actions the {@link ApplySessionReducer} asks the
 * {@link ApplySessionCoordinator} to carry out after a transition.
 *
 * <p>The reducer decides <b>what</b> should happen; the coordinator performs
 * the I/O in a fixed order: persist, emit events, revert, schedule.</p>
 */
public final class ApplySessionIntents
{
    public enum Kind {
        /** Save the new session record. */
        PERSIST,

        /** Append a {@code sessionArmed} safety event. */
        EMIT_ARMED,

        /** Append a {@code sessionExpired} safety event. */
        EMIT_EXPIRED,

        /** Append a {@code sessionApplied} safety event. */
        EMIT_APPLIED,

        /** Write already-applied changes back in reverse order. */
        REVERT_APPLIED,

        /** Enqueue the next apply step. */
        SCHEDULE_STEP
    }

    private static final ApplySessionIntents NONE = new ApplySessionIntents(EnumSet.noneOf(Kind.class));

    private final Set<Kind> kinds;

    private ApplySessionIntents(Set<Kind> kinds) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public static ApplySessionIntents none() {
        return NONE;
    }

    public static ApplySessionIntents of(Kind first, Kind... rest) {
        return new ApplySessionIntents(EnumSet.of(first, rest));
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public ApplySessionIntents plus(Kind kind) {
        Objects.requireNonNull(kind, "kind");
        EnumSet<Kind> copy = kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds);
        copy.add(kind);
        return new ApplySessionIntents(copy);
    }

    @Override
    public String toString() {
        return "ApplySessionIntents" + kinds;
    }
}
