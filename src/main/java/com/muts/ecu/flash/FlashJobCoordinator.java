package com.muts.ecu.flash;

import com.muts.ecu.flash.FlashJobIntents.Kind;
import com.muts.ecu.config.PipelineConfig;
import com.muts.ecu.observability.FlashTransitionEvent;
import com.muts.ecu.observability.NullObservabilitySink;
import com.muts.ecu.observability.PipelineErrorEvent;
import com.muts.ecu.observability.PipelineObservabilitySink;
import com.muts.ecu.persistence.PersistenceFailureException;
import com.muts.ecu.persistence.TuningRecordStore;
import com.muts.ecu.session.ApplySessionCoordinator;
import com.muts.ecu.session.ApplySessionStatus;
import com.muts.ecu.store.Command;
import com.muts.ecu.store.CommandContext;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandRejectedException;
import com.muts.ecu.store.CommandTypes;
import com.muts.ecu.store.StateStore;
import com.muts.ecu.transport.ChecksumResult;
import com.muts.ecu.transport.EcuTransport;
import com.muts.ecu.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * FlashJobCoordinator
 * =============================================================================
 * Executes flash job commands on the processor thread.
 *
 * <p>A job writes its image one block per {@code flash:block} command, so an
 * abort enqueued while flashing lands on a block boundary. The job is bound to
 * a FLASH-mode tuning session: starting requires that session to be ARMED and
 * unexpired, and every job outcome is mirrored onto it through
 * {@link ApplySessionCoordinator}.</p>
 *
 * <p>Re-flashing an engine whose previous job failed or was aborted requires a
 * stored backup of the target region ({@code flash:backup}) first.</p>
 */
public final class FlashJobCoordinator
{
    private static final Logger log = LoggerFactory.getLogger(FlashJobCoordinator.class);

    private static final String JOB_ID = "jobId";

    private final EcuTransport transport;
    private final TuningRecordStore records;
    private final ApplySessionCoordinator sessions;
    private final PipelineConfig config;
    private final PipelineObservabilitySink observabilitySink;
    private final FlashJobReducer reducer = new FlashJobReducer();

    public FlashJobCoordinator(EcuTransport transport,
                               TuningRecordStore records,
                               ApplySessionCoordinator sessions,
                               PipelineConfig config,
                               PipelineObservabilitySink observabilitySink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.records = Objects.requireNonNull(records, "records");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void registerWith(StateStore.Builder builder)
    {
        builder.handle(CommandTypes.FLASH_PREPARE, this::prepare)
            .handle(CommandTypes.FLASH_BACKUP, this::backup)
            .handle(CommandTypes.FLASH_START, this::start)
            .handle(CommandTypes.FLASH_BLOCK, this::block)
            .handle(CommandTypes.FLASH_VERIFY, this::verify)
            .handle(CommandTypes.FLASH_ABORT, this::abort);
    }

    // ---------------------------------------------------------------------
    // Command handlers
    // ---------------------------------------------------------------------

    void prepare(Command command, CommandContext ctx)
    {
        Optional<FlashJob> active = ctx.state().flash().active();
        if (active.isPresent() && !active.get().state().isTerminal()) {
            throw CommandRejectedException.conflict("Flash job " + active.get().id() + " is still " + active.get().state());
        }

        CommandPayload p = command.payload();
        String sessionId = p.requireString("sessionId");
        if (ctx.state().session(sessionId).isEmpty()) {
            throw CommandRejectedException.invalid("Unknown session " + sessionId);
        }
        String jobId = p.optionalString(JOB_ID).orElseGet(() -> UUID.randomUUID().toString());
        if (records.findFlashJob(jobId).isPresent()) {
            throw CommandRejectedException.conflict("Flash job " + jobId + " already exists");
        }

        FlashImage image = new FlashImage(p.requireBytes("image"), p.requireString("sha256"),
            p.has("baseAddress") ? p.requireLong("baseAddress") : 0L);
        boolean checksumOk = image.checksumMatches();
        boolean validationOk = image.isValid(config.maxFlashImageBytes());
        if (!checksumOk) {
            log.warn("Flash job {}: image digest {} does not match declared {}",
                jobId, FlashImage.sha256Hex(image.data()), image.declaredSha256());
        }

        FlashJob job = FlashJob.prepared(jobId, p.requireString("engineId"), sessionId,
            checksumOk, validationOk, image.blockCount(config.flashBlockSize()), ctx.now());
        records.saveFlashJob(job);
        records.saveFlashImage(jobId, image);
        ctx.update(s -> s.withFlash(s.flash().withJob(job, config.flashHistoryLimit())));
        observabilitySink.onFlashTransition(new FlashTransitionEvent(ctx.now(), jobId, null, job.state(), 0));
    }

    void backup(Command command, CommandContext ctx)
    {
        FlashJob job = requireActiveJob(ctx, command.payload().requireString(JOB_ID));
        if (job.state() != FlashJobState.PREPARED) {
            throw CommandRejectedException.conflict("Backup only possible while PREPARED, job is " + job.state());
        }
        FlashImage image = requireImage(job);
        byte[] region = ctx.await(transport.readBlock(image.baseAddress(), image.length()), "backup read");
        records.saveBackup(job.id(), region);
        transition(ctx, job, new FlashJobEvent.BackupStored(ctx.now()));
    }

    void start(Command command, CommandContext ctx)
    {
        FlashJob job = requireActiveJob(ctx, command.payload().requireString(JOB_ID));
        if (job.state() != FlashJobState.PREPARED) {
            throw CommandRejectedException.conflict("Job " + job.id() + " is " + job.state() + ", not PREPARED");
        }

        // Rejected without touching the job: it stays PREPARED.
        sessions.requireFlashReady(ctx, job.sessionId());

        Optional<FlashJob> previous = records.findFlashJobsByEngine(job.engineId()).stream()
            .filter(j -> !j.id().equals(job.id()))
            .findFirst();
        if (previous.isPresent()
            && (previous.get().state() == FlashJobState.FAILED || previous.get().state() == FlashJobState.ABORTED)
            && !job.rollbackAvailable())
        {
            throw CommandRejectedException.conflict("Previous flash of engine " + job.engineId() + " ended "
                + previous.get().state() + "; store a backup before re-flashing");
        }

        transition(ctx, job, new FlashJobEvent.Start(ctx.now()));
    }

    void block(Command command, CommandContext ctx)
    {
        String jobId = command.payload().requireString(JOB_ID);
        Optional<FlashJob> maybe = ctx.state().flash().active().filter(j -> j.id().equals(jobId));
        if (maybe.isEmpty() || maybe.get().state() != FlashJobState.FLASHING) {
            log.debug("Ignoring block write for flash job {} (not flashing)", jobId);
            return;
        }
        FlashJob job = maybe.get();

        boolean sessionApplying = ctx.state().session(job.sessionId())
            .map(s -> s.status() == ApplySessionStatus.APPLYING)
            .orElse(false);
        if (!sessionApplying) {
            transition(ctx, job, new FlashJobEvent.Abort(ctx.now(), "Session " + job.sessionId() + " no longer applying"));
            return;
        }

        FlashImage image = requireImage(job);
        int index = job.blocksCompleted();
        byte[] data = image.block(index, config.flashBlockSize());
        long address = image.blockAddress(index, config.flashBlockSize());
        try {
            ChecksumResult result = ctx.await(transport.writeBlock(address, data), "flash block " + index);
            if (!result.matches(data)) {
                throw new TransportFailureException("Checksum mismatch on block " + index);
            }
        } catch (TransportFailureException e) {
            transition(ctx, job, new FlashJobEvent.Failed(ctx.now(), e.getMessage()));
            return;
        }
        transition(ctx, job, new FlashJobEvent.BlockWritten(ctx.now()));
    }

    void verify(Command command, CommandContext ctx)
    {
        String jobId = command.payload().requireString(JOB_ID);
        Optional<FlashJob> maybe = ctx.state().flash().active().filter(j -> j.id().equals(jobId));
        if (maybe.isEmpty() || maybe.get().state() != FlashJobState.VERIFYING) {
            log.debug("Ignoring verify for flash job {} (not verifying)", jobId);
            return;
        }
        FlashJob job = maybe.get();
        FlashImage image = requireImage(job);
        byte[] readBack;
        try {
            readBack = ctx.await(transport.readBlock(image.baseAddress(), image.length()), "flash readback");
        } catch (TransportFailureException e) {
            transition(ctx, job, new FlashJobEvent.Failed(ctx.now(), e.getMessage()));
            return;
        }
        boolean matches = FlashImage.sha256Hex(readBack).equalsIgnoreCase(image.declaredSha256());
        transition(ctx, job, new FlashJobEvent.Verified(ctx.now(), matches));
    }

    void abort(Command command, CommandContext ctx)
    {
        FlashJob job = requireActiveJob(ctx, command.payload().requireString(JOB_ID));
        String reason = command.payload().optionalString("reason").orElse("aborted by operator");
        transition(ctx, job, new FlashJobEvent.Abort(ctx.now(), reason));
    }

    /**
     * Aborts the active job, if any. Used when the system is disarmed.
     */
    public void abortActive(CommandContext ctx, String reason)
    {
        Optional<FlashJob> active = ctx.state().flash().active();
        if (active.isPresent() && !active.get().state().isTerminal()) {
            transition(ctx, active.get(), new FlashJobEvent.Abort(ctx.now(), reason));
        }
    }

    // ---------------------------------------------------------------------
    // Transition execution
    // ---------------------------------------------------------------------

    private void transition(CommandContext ctx, FlashJob before, FlashJobEvent event)
    {
        FlashJobReducer.Result result = reducer.apply(before, event);
        if (result.isRejected()) {
            throw CommandRejectedException.conflict(result.rejection().get());
        }
        FlashJob after = result.job();
        FlashJobIntents intents = result.intents();

        if (intents.contains(Kind.PERSIST)) {
            try {
                records.saveFlashJob(after);
            } catch (PersistenceFailureException e) {
                if (!after.state().isTerminal()) {
                    if (before.state().isInFlight()) {
                        transition(ctx, before, new FlashJobEvent.Failed(ctx.now(),
                            "Job record not persisted: " + e.getMessage()));
                        return;
                    }
                    throw e;
                }
                log.error("Terminal state of flash job {} not persisted", after.id(), e);
                observabilitySink.onError(new PipelineErrorEvent(ctx.now(),
                    "Terminal state of flash job " + after.id() + " not persisted", e));
            }
        }

        ctx.update(s -> s.withFlash(s.flash().withJob(after, config.flashHistoryLimit())));
        if (before.state() != after.state()) {
            log.info("Flash job {}: {} -> {}", after.id(), before.state(), after.state());
            observabilitySink.onFlashTransition(new FlashTransitionEvent(
                ctx.now(), after.id(), before.state(), after.state(), after.progress()));
        }

        if (intents.contains(Kind.LINK_SESSION_STARTED)) {
            try {
                sessions.flashStarted(ctx, after.sessionId());
            } catch (RuntimeException e) {
                // No block may be written unless the session is APPLYING.
                log.warn("Flash job {} could not link session {}: {}", after.id(), after.sessionId(), e.toString());
                transition(ctx, after, new FlashJobEvent.Failed(ctx.now(),
                    "Session " + after.sessionId() + " not linked: " + e.getMessage()));
                return;
            }
        }
        if (intents.contains(Kind.LINK_SESSION_COMPLETED)) {
            sessions.flashCompleted(ctx, after.sessionId());
        }
        if (intents.contains(Kind.LINK_SESSION_FAILED)) {
            sessions.flashFailed(ctx, after.sessionId(), after.state() + ": " + after.errorMessage());
        }
        if (intents.contains(Kind.WRITE_NEXT_BLOCK)) {
            ctx.enqueue(CommandTypes.FLASH_BLOCK, CommandPayload.of(JOB_ID, after.id()));
        }
        if (intents.contains(Kind.VERIFY)) {
            ctx.enqueue(CommandTypes.FLASH_VERIFY, CommandPayload.of(JOB_ID, after.id()));
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private FlashJob requireActiveJob(CommandContext ctx, String jobId)
    {
        Optional<FlashJob> active = ctx.state().flash().active();
        if (active.isPresent() && active.get().id().equals(jobId)) {
            return active.get();
        }
        List<FlashJob> history = ctx.state().flash().history();
        for (FlashJob job : history) {
            if (job.id().equals(jobId)) {
                throw CommandRejectedException.conflict("Flash job " + jobId + " already " + job.state());
            }
        }
        throw CommandRejectedException.invalid("Unknown flash job " + jobId);
    }

    private FlashImage requireImage(FlashJob job)
    {
        return records.findFlashImage(job.id())
            .orElseThrow(() -> new PersistenceFailureException("Image for flash job " + job.id() + " missing"));
    }
}
