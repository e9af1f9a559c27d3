package com.muts.ecu.flash;

import com.muts.ecu.flash.FlashJobIntents.Kind;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure state machine for flash jobs.
 *
 * <p>Session linkage, hardware access and persistence are left to
 * {@link FlashJobCoordinator}, which executes the returned intents.</p>
 */
public final class FlashJobReducer
{
    public record Result(FlashJob job, FlashJobIntents intents, Optional<String> rejection) {

        static Result accepted(FlashJob job, FlashJobIntents intents) {
            return new Result(job, intents, Optional.empty());
        }

        static Result rejected(FlashJob job, String reason) {
            return new Result(job, FlashJobIntents.none(), Optional.of(reason));
        }

        public boolean isRejected() {
            return rejection.isPresent();
        }
    }

    public Result apply(FlashJob job, FlashJobEvent event)
    {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(event, "event");

        if (event instanceof FlashJobEvent.BackupStored e) {
            return onBackupStored(job, e);
        }
        if (event instanceof FlashJobEvent.Start e) {
            return onStart(job, e);
        }
        if (event instanceof FlashJobEvent.BlockWritten e) {
            return onBlockWritten(job, e);
        }
        if (event instanceof FlashJobEvent.Verified e) {
            return onVerified(job, e);
        }
        if (event instanceof FlashJobEvent.Failed e) {
            return terminate(job, FlashJobState.FAILED, e.message(), e.at());
        }
        if (event instanceof FlashJobEvent.Abort e) {
            return terminate(job, FlashJobState.ABORTED, e.message(), e.at());
        }

        return Result.accepted(job, FlashJobIntents.none());
    }

    private Result onBackupStored(FlashJob job, FlashJobEvent.BackupStored e)
    {
        if (job.state() != FlashJobState.PREPARED) {
            return Result.rejected(job, "Backup only possible while PREPARED, job is " + job.state());
        }
        return Result.accepted(job.withRollbackAvailable(e.at()), FlashJobIntents.of(Kind.PERSIST));
    }

    private Result onStart(FlashJob job, FlashJobEvent.Start e)
    {
        if (job.state() != FlashJobState.PREPARED) {
            return Result.rejected(job, "Job " + job.id() + " is " + job.state() + ", not PREPARED");
        }
        if (!job.checksumOk()) {
            return Result.rejected(job, "Image checksum does not match declared SHA-256");
        }
        if (!job.validationOk()) {
            return Result.rejected(job, "Image failed validation");
        }
        FlashJob flashing = job.withState(FlashJobState.FLASHING, e.at()).withBlocksCompleted(0);
        return Result.accepted(flashing,
            FlashJobIntents.of(Kind.PERSIST, Kind.LINK_SESSION_STARTED, Kind.WRITE_NEXT_BLOCK));
    }

    private Result onBlockWritten(FlashJob job, FlashJobEvent.BlockWritten e)
    {
        if (job.state() != FlashJobState.FLASHING || job.blocksCompleted() >= job.totalBlocks()) {
            return Result.rejected(job, "Job " + job.id() + " has no block in flight");
        }
        FlashJob progressed = job.withBlocksCompleted(job.blocksCompleted() + 1);
        if (progressed.blocksCompleted() == progressed.totalBlocks()) {
            return Result.accepted(progressed.withState(FlashJobState.VERIFYING, e.at()),
                FlashJobIntents.of(Kind.PERSIST, Kind.VERIFY));
        }
        return Result.accepted(progressed.withState(FlashJobState.FLASHING, e.at()),
            FlashJobIntents.of(Kind.PERSIST, Kind.WRITE_NEXT_BLOCK));
    }

    private Result onVerified(FlashJob job, FlashJobEvent.Verified e)
    {
        if (job.state() != FlashJobState.VERIFYING) {
            return Result.rejected(job, "Job " + job.id() + " is not VERIFYING");
        }
        if (!e.matches()) {
            return terminate(job, FlashJobState.FAILED, "Post-write checksum mismatch", e.at());
        }
        return Result.accepted(job.withState(FlashJobState.COMPLETED, e.at()),
            FlashJobIntents.of(Kind.PERSIST, Kind.LINK_SESSION_COMPLETED));
    }

    private Result terminate(FlashJob job, FlashJobState target, String message, Instant at)
    {
        if (job.state().isTerminal()) {
            return Result.rejected(job, "Job " + job.id() + " already " + job.state());
        }
        FlashJob ended = job.withState(target, at).withError(message);
        FlashJobIntents intents = job.state().isInFlight()
            ? FlashJobIntents.of(Kind.PERSIST, Kind.LINK_SESSION_FAILED)
            : FlashJobIntents.of(Kind.PERSIST);
        return Result.accepted(ended, intents);
    }
}
