package com.muts.ecu.flash;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Actions requested by the {@link FlashJobReducer}.
 */
public final class FlashJobIntents
{
    public enum Kind {
        /** Save the job record. */
        PERSIST,

        /** Move the linked session ARMED to APPLYING. */
        LINK_SESSION_STARTED,

        /** Move the linked session to APPLIED. */
        LINK_SESSION_COMPLETED,

        /** Move the linked session to FAILED. */
        LINK_SESSION_FAILED,

        /** Enqueue the next block write. */
        WRITE_NEXT_BLOCK,

        /** Enqueue post-write verification. */
        VERIFY
    }

    private static final FlashJobIntents NONE = new FlashJobIntents(EnumSet.noneOf(Kind.class));

    private final Set<Kind> kinds;

    private FlashJobIntents(EnumSet<Kind> kinds) {
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    public static FlashJobIntents none() {
        return NONE;
    }

    public static FlashJobIntents of(Kind first, Kind... rest) {
        return new FlashJobIntents(EnumSet.of(first, rest));
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    @Override
    public String toString() {
        return "FlashJobIntents" + kinds;
    }
}
