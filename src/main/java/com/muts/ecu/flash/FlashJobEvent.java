package com.muts.ecu.flash;

import java.time.Instant;
import java.util.Objects;

/**
 * Inputs to the {@link FlashJobReducer}.
 */
public sealed interface FlashJobEvent
{
    Instant at();

    /** A pre-flash backup of the target region was stored. */
    record BackupStored(Instant at) implements FlashJobEvent {}

    /** Every start precondition outside the job itself passed. */
    record Start(Instant at) implements FlashJobEvent {}

    /** The next block was written and its checksum matched. */
    record BlockWritten(Instant at) implements FlashJobEvent {}

    /** Post-write readback finished. */
    record Verified(Instant at, boolean matches) implements FlashJobEvent {}

    /** I/O or checksum failure. */
    record Failed(Instant at, String message) implements FlashJobEvent {
        public Failed {
            Objects.requireNonNull(message, "message");
        }
    }

    /** Operator abort or linked session no longer applying. */
    record Abort(Instant at, String message) implements FlashJobEvent {
        public Abort {
            Objects.requireNonNull(message, "message");
        }
    }
}
