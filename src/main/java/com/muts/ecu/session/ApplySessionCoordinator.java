package com.muts.ecu.session;

import com.muts.ecu.api.FailureKind;
import com.muts.ecu.config.PipelineConfig;
import com.muts.ecu.mode.Authorization;
import com.muts.ecu.mode.Operation;
import com.muts.ecu.mode.OperationKind;
import com.muts.ecu.mode.OperatorModeGate;
import com.muts.ecu.observability.NullObservabilitySink;
import com.muts.ecu.observability.PipelineErrorEvent;
import com.muts.ecu.observability.PipelineObservabilitySink;
import com.muts.ecu.observability.SessionTransitionEvent;
import com.muts.ecu.persistence.PersistenceFailureException;
import com.muts.ecu.persistence.TuningRecordStore;
import com.muts.ecu.safety.BoundBreach;
import com.muts.ecu.safety.SafetyCheckProfile;
import com.muts.ecu.safety.SafetyEvaluation;
import com.muts.ecu.safety.SafetyEvaluator;
import com.muts.ecu.safety.SafetySnapshot;
import com.muts.ecu.safety.queue.SafetyEvent;
import com.muts.ecu.safety.queue.SafetyEventQueue;
import com.muts.ecu.safety.queue.SafetyEventType;
import com.muts.ecu.session.ApplySessionEvent.Revert;
import com.muts.ecu.session.ApplySessionIntents.Kind;
import com.muts.ecu.store.Command;
import com.muts.ecu.store.CommandContext;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandRejectedException;
import com.muts.ecu.store.CommandTypes;
import com.muts.ecu.store.InternalCommandQueue;
import com.muts.ecu.store.SafetyLevel;
import com.muts.ecu.store.StateStore;
import com.muts.ecu.transport.ChecksumResult;
import com.muts.ecu.transport.EcuTransport;
import com.muts.ecu.transport.TelemetrySnapshot;
import com.muts.ecu.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.Optional;
import java.util.UUID;

/**
 * ApplySessionCoordinator
 * =============================================================================
 * Executes tuning-apply session commands on the processor thread.
 *
 * <h2>Role</h2>
 * Checks arming preconditions, feeds events into the pure
 * {@link ApplySessionReducer} and carries out the resulting
 * {@link ApplySessionIntents}: persistence, safety events, reverts and
 * follow-up steps.
 *
 * <h2>Apply loop</h2>
 * Each {@code session:apply-step} handles exactly one change:
 * <ol>
 *   <li>read telemetry</li>
 *   <li>persist the {@link SafetySnapshot}</li>
 *   <li>on a critical breach, durably append a {@code violation} event, fail
 *       the session and revert; no write happens</li>
 *   <li>otherwise write the change (SIMULATE sessions skip the write) and
 *       enqueue the next step</li>
 * </ol>
 * Because each step is its own command, a cancel enqueued meanwhile takes
 * effect at the next step boundary.
 *
 * <h2>Fail-closed persistence</h2>
 * A persistence failure on a transition towards more hardware activity aborts
 * the command. Transitions into a terminal status are applied in memory even
 * if the record store rejects them, so the pipeline never keeps writing on
 * behalf of a session it could not persist.
 */
public final class ApplySessionCoordinator
{
    private static final Logger log = LoggerFactory.getLogger(ApplySessionCoordinator.class);

    private static final String SESSION_ID = "sessionId";

    private final OperatorModeGate gate;
    private final EcuTransport transport;
    private final TuningRecordStore records;
    private final SafetyEventQueue safetyEvents;
    private final SafetyEvaluator evaluator;
    private final ApplyTokens tokens;
    private final PipelineConfig config;
    private final PipelineObservabilitySink observabilitySink;
    private final ApplySessionReducer reducer = new ApplySessionReducer();
    private final AtomicBoolean sweepPending = new AtomicBoolean();

    public ApplySessionCoordinator(OperatorModeGate gate,
                                   EcuTransport transport,
                                   TuningRecordStore records,
                                   SafetyEventQueue safetyEvents,
                                   SafetyEvaluator evaluator,
                                   ApplyTokens tokens,
                                   PipelineConfig config,
                                   PipelineObservabilitySink observabilitySink)
    {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.records = Objects.requireNonNull(records, "records");
        this.safetyEvents = Objects.requireNonNull(safetyEvents, "safetyEvents");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void registerWith(StateStore.Builder builder)
    {
        builder.handle(CommandTypes.SESSION_CREATE, this::create)
            .handle(CommandTypes.SESSION_ARM, this::arm)
            .handle(CommandTypes.SESSION_APPLY, this::apply)
            .handle(CommandTypes.SESSION_APPLY_STEP, this::applyStep)
            .handle(CommandTypes.SESSION_CANCEL, this::cancel)
            .handle(CommandTypes.SESSION_EXPIRE_SWEEP, this::expireSweep);
    }

    // ---------------------------------------------------------------------
    // Command handlers
    // ---------------------------------------------------------------------

    void create(Command command, CommandContext ctx)
    {
        CommandPayload p = command.payload();
        String id = p.optionalString(SESSION_ID).orElseGet(() -> UUID.randomUUID().toString());
        if (ctx.state().session(id).isPresent() || records.findSession(id).isPresent()) {
            throw CommandRejectedException.conflict("Session " + id + " already exists");
        }
        String vehicleSessionId = p.requireString("vehicleSessionId");
        ApplyMode mode = parseMode(p.requireString("mode"));
        String profileId = p.optionalString("profileId").orElse(SafetyCheckProfile.DEFAULT_ID);
        if (records.findProfile(profileId).isEmpty()) {
            throw CommandRejectedException.invalid("Unknown safety profile " + profileId);
        }

        TuningApplySession session = TuningApplySession.pending(id, vehicleSessionId,
            p.optionalString("changesetId").orElse(null), mode, profileId, tokens.issue(), ctx.now());
        records.saveSession(session);
        ctx.update(s -> s.withSession(session, config.sessionHistoryLimit()));
        observabilitySink.onSessionTransition(new SessionTransitionEvent(
            ctx.now(), id, null, ApplySessionStatus.PENDING, "created"));

        recordEvent(ctx, SafetyEventType.SESSION_CREATED, Map.of(
            SESSION_ID, id,
            "vehicleSessionId", vehicleSessionId,
            "mode", mode.name()));
    }

    void arm(Command command, CommandContext ctx)
    {
        CommandPayload p = command.payload();
        TuningApplySession session = requireSession(ctx, p.requireString(SESSION_ID));
        if (session.status() != ApplySessionStatus.PENDING) {
            throw CommandRejectedException.conflict(
                "Session " + session.id() + " is " + session.status() + ", not PENDING");
        }

        boolean confirmed = p.flag("confirmed");
        requireAllowed(gate.authorize(Operation.of(OperationKind.ECU_WRITE)));

        if (!ApplyTokens.matches(session.applyToken(), p.requireString("applyToken"))) {
            throw CommandRejectedException.invalid("Invalid apply token");
        }
        if (!ctx.now().isBefore(session.tokenIssuedAt().plus(config.applyTokenTtl()))) {
            throw CommandRejectedException.invalid("Apply token expired");
        }

        requireAllowed(gate.authorize(new Operation(OperationKind.DANGEROUS, confirmed, !transport.isSimulated())));
        if (!ctx.state().connection().isConnected()) {
            throw CommandRejectedException.conflict("Hardware not connected");
        }
        requireAllowed(gate.authorize(new Operation(OperationKind.HARDWARE_ACCESS, confirmed, !transport.isSimulated())));

        SafetyLevel required = session.mode() == ApplyMode.SIMULATE ? SafetyLevel.SIMULATION : SafetyLevel.LIVE_APPLY;
        if (!ctx.state().safety().permits(required)) {
            throw CommandRejectedException.conflict(
                "System must be armed at " + required + " to arm a " + session.mode() + " session");
        }

        long active = ctx.state().sessions().values().stream()
            .filter(s -> !s.id().equals(session.id()) && s.status().isActive())
            .count();
        if (active >= config.maxConcurrentSessions()) {
            throw CommandRejectedException.conflict(
                "Maximum concurrent sessions (" + config.maxConcurrentSessions() + ") reached");
        }

        Instant now = ctx.now();
        transition(ctx, session, new ApplySessionEvent.Arm(now, now.plus(config.armTtl())), "armed", 0);
    }

    void apply(Command command, CommandContext ctx)
    {
        CommandPayload p = command.payload();
        TuningApplySession session = requireSession(ctx, p.requireString(SESSION_ID));
        if (session.mode() == ApplyMode.FLASH) {
            throw CommandRejectedException.invalid("FLASH sessions are applied through a flash job");
        }
        List<ParameterChange> changes = parseChanges(p.requireList("changes"));
        if (changes.isEmpty()) {
            throw CommandRejectedException.invalid("changes must not be empty");
        }
        transition(ctx, session, new ApplySessionEvent.BeginApply(ctx.now(), changes), "apply requested", 0);
    }

    void applyStep(Command command, CommandContext ctx)
    {
        String id = command.payload().requireString(SESSION_ID);
        Optional<TuningApplySession> current = ctx.state().session(id);
        if (current.isEmpty() || current.get().status() != ApplySessionStatus.APPLYING) {
            log.debug("Ignoring apply step for session {} (no longer applying)", id);
            return;
        }
        TuningApplySession session = current.get();
        Optional<ParameterChange> next = session.nextChange();
        if (next.isEmpty()) {
            return;
        }

        Optional<SafetyCheckProfile> maybeProfile = records.findProfile(session.profileId());
        if (maybeProfile.isEmpty()) {
            failSession(ctx, session, Revert.NONE, "profile_missing",
                "Safety profile " + session.profileId() + " not found", null, 0);
            return;
        }
        SafetyCheckProfile profile = maybeProfile.get();

        TelemetrySnapshot reading;
        try {
            reading = ctx.await(transport.readTelemetry(), "readTelemetry");
        } catch (TransportFailureException e) {
            failSession(ctx, session, Revert.forProfile(profile.supportsRevert()), "telemetry_failure",
                "Telemetry unavailable: " + e.getMessage(), null, session.appliedCount());
            return;
        }
        ctx.update(s -> s.withTelemetry(s.telemetry().withLatest(reading)));

        SafetyEvaluation evaluation = evaluator.evaluate(profile, reading);
        try {
            records.saveSnapshot(new SafetySnapshot(UUID.randomUUID().toString(), session.id(),
                reading, evaluation.breaches(), ctx.now()));
        } catch (PersistenceFailureException e) {
            failSession(ctx, session, Revert.forProfile(profile.supportsRevert()), "persistence_failure",
                "Safety snapshot not persisted: " + e.getMessage(), null, session.appliedCount());
            return;
        }

        for (BoundBreach warning : evaluation.warnings()) {
            log.warn("Session {}: {}", session.id(), warning.describe());
        }
        if (evaluation.isCritical()) {
            BoundBreach breach = evaluation.firstCritical().orElseThrow();
            failSession(ctx, session, Revert.forProfile(profile.supportsRevert()), "safety_bound",
                breach.describe(), breach, session.appliedCount());
            return;
        }

        ParameterChange change = next.get();
        if (session.mode() != ApplyMode.SIMULATE) {
            try {
                ChecksumResult result = ctx.await(
                    transport.writeBlock(change.address(), change.newValue()), "write " + change.name());
                if (!result.matches(change.newValue())) {
                    throw new TransportFailureException("Checksum mismatch after writing " + change.name());
                }
            } catch (TransportFailureException e) {
                // The failed block may be partially written; revert it as well.
                failSession(ctx, session, Revert.forProfile(profile.supportsRevert()), "write_failure",
                    e.getMessage(), null, session.appliedCount() + 1);
                return;
            }
        }

        transition(ctx, session, new ApplySessionEvent.ChangeWritten(ctx.now()),
            (session.mode() == ApplyMode.SIMULATE ? "simulated " : "wrote ") + change.name(), 0);
    }

    void cancel(Command command, CommandContext ctx)
    {
        CommandPayload p = command.payload();
        TuningApplySession session = requireSession(ctx, p.requireString(SESSION_ID));
        String reason = p.optionalString("reason").orElse("cancelled by operator");
        transition(ctx, session, new ApplySessionEvent.Cancel(ctx.now(), reason), reason, session.appliedCount());
    }

    /**
     * Timer entry point. Enqueues a sweep unless one is already waiting in
     * the queue.
     */
    public void requestExpirySweep(InternalCommandQueue queue)
    {
        if (sweepPending.compareAndSet(false, true)) {
            queue.enqueueInternal(CommandTypes.SESSION_EXPIRE_SWEEP, CommandPayload.empty());
        }
    }

    void expireSweep(Command command, CommandContext ctx)
    {
        sweepPending.set(false);
        Instant now = ctx.now();
        for (TuningApplySession session : List.copyOf(ctx.state().sessions().values())) {
            if (session.status() == ApplySessionStatus.ARMED && session.isExpiredAt(now)) {
                try {
                    transition(ctx, session, new ApplySessionEvent.ExpirySweep(now), "expired", 0);
                } catch (RuntimeException e) {
                    reportError(ctx, "Expiry of session " + session.id() + " failed", e);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Operations used by other coordinators
    // ---------------------------------------------------------------------

    /**
     * Cancels every non-terminal session. Used when the system is disarmed.
     */
    public void cancelAll(CommandContext ctx, String reason)
    {
        for (TuningApplySession session : List.copyOf(ctx.state().sessions().values())) {
            if (!session.status().isTerminal()) {
                try {
                    transition(ctx, session, new ApplySessionEvent.Cancel(ctx.now(), reason), reason,
                        session.appliedCount());
                } catch (RuntimeException e) {
                    reportError(ctx, "Cancel of session " + session.id() + " failed", e);
                }
            }
        }
    }

    /**
     * Returns the session if a flash job may start against it: mode FLASH,
     * status ARMED and not expired.
     *
     * @throws CommandRejectedException otherwise
     */
    public TuningApplySession requireFlashReady(CommandContext ctx, String sessionId)
    {
        TuningApplySession session = requireSession(ctx, sessionId);
        if (session.mode() != ApplyMode.FLASH) {
            throw CommandRejectedException.conflict("Session " + sessionId + " is " + session.mode() + ", not FLASH");
        }
        if (session.status() != ApplySessionStatus.ARMED) {
            throw CommandRejectedException.conflict("Session " + sessionId + " is " + session.status() + ", not ARMED");
        }
        if (session.isExpiredAt(ctx.now())) {
            transition(ctx, session, new ApplySessionEvent.ExpirySweep(ctx.now()), "expired", 0);
            throw CommandRejectedException.conflict("Session " + sessionId + " expired");
        }
        return session;
    }

    public void flashStarted(CommandContext ctx, String sessionId)
    {
        TuningApplySession session = requireSession(ctx, sessionId);
        transition(ctx, session, new ApplySessionEvent.BeginApply(ctx.now(), List.of()), "flash started", 0);
    }

    public void flashCompleted(CommandContext ctx, String sessionId)
    {
        TuningApplySession session = requireSession(ctx, sessionId);
        transition(ctx, session, new ApplySessionEvent.Completed(ctx.now()), "flash completed", 0);
    }

    /**
     * Marks the session FAILED after its flash job failed or was aborted.
     * Sessions that already ended are left alone.
     */
    public void flashFailed(CommandContext ctx, String sessionId, String reason)
    {
        Optional<TuningApplySession> session = ctx.state().session(sessionId);
        if (session.isEmpty() || session.get().status().isTerminal()) {
            return;
        }
        transition(ctx, session.get(), new ApplySessionEvent.Failed(ctx.now(), reason, Revert.NONE), reason, 0);
    }

    // ---------------------------------------------------------------------
    // Transition execution
    // ---------------------------------------------------------------------

    private void failSession(CommandContext ctx,
                             TuningApplySession session,
                             Revert revert,
                             String cause,
                             String reason,
                             BoundBreach breach,
                             int revertCount)
    {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(SESSION_ID, session.id());
        payload.put("cause", cause);
        payload.put("reason", reason);
        if (breach != null) {
            payload.put("parameter", breach.parameter().name());
            payload.put("level", breach.level().name());
            payload.put("value", Double.toString(breach.value()));
            payload.put("limit", Double.toString(breach.limit()));
        }

        // The violation must be durable before any further hardware call,
        // including revert writes.
        try {
            recordEvent(ctx, SafetyEventType.VIOLATION, payload);
        } catch (PersistenceFailureException e) {
            reportError(ctx, "Violation for session " + session.id() + " could not be persisted", e);
        }

        transition(ctx, session, new ApplySessionEvent.Failed(ctx.now(), reason, revert), cause, revertCount);

        if (revert == Revert.UNSUPPORTED && revertCount > 0 && session.mode() != ApplyMode.SIMULATE) {
            annotate(ctx, session.id(), reason + "; manual revert required");
        }
    }

    private void transition(CommandContext ctx,
                            TuningApplySession before,
                            ApplySessionEvent event,
                            String cause,
                            int revertCount)
    {
        ApplySessionReducer.Result result = reducer.apply(before, event);
        ApplySessionIntents intents = result.intents();
        TuningApplySession after = result.session();

        if (result.isRejected() && intents.isEmpty()) {
            throw CommandRejectedException.conflict(result.rejection().get());
        }

        if (intents.contains(Kind.PERSIST)) {
            try {
                records.saveSession(after);
            } catch (PersistenceFailureException e) {
                if (!after.status().isTerminal()) {
                    if (before.status() == ApplySessionStatus.APPLYING) {
                        failSession(ctx, before, Revert.NONE, "persistence_failure",
                            "Session record not persisted: " + e.getMessage(), null, 0);
                        return;
                    }
                    throw e;
                }
                reportError(ctx, "Terminal state of session " + after.id() + " not persisted", e);
            }
        }

        ctx.update(s -> s.withSession(after, config.sessionHistoryLimit()));
        if (before.status() != after.status()) {
            observabilitySink.onSessionTransition(new SessionTransitionEvent(
                ctx.now(), after.id(), before.status(), after.status(), cause));
        }

        if (intents.contains(Kind.EMIT_ARMED)) {
            recordEvent(ctx, SafetyEventType.SESSION_ARMED, Map.of(
                SESSION_ID, after.id(),
                "mode", after.mode().name(),
                "expiresAt", String.valueOf(after.expiresAt())));
        }
        if (intents.contains(Kind.EMIT_EXPIRED)) {
            recordEvent(ctx, SafetyEventType.SESSION_EXPIRED, Map.of(
                SESSION_ID, after.id(),
                "expiresAt", String.valueOf(after.expiresAt())));
        }
        if (intents.contains(Kind.EMIT_APPLIED)) {
            recordEvent(ctx, SafetyEventType.SESSION_APPLIED, Map.of(
                SESSION_ID, after.id(),
                "mode", after.mode().name(),
                "changes", Integer.toString(after.appliedCount())));
        }

        if (intents.contains(Kind.REVERT_APPLIED)) {
            String outcome = revert(ctx, after, Math.min(revertCount, after.changes().size()));
            annotate(ctx, after.id(), after.revertReason() + "; " + outcome);
        }

        if (intents.contains(Kind.SCHEDULE_STEP)) {
            ctx.enqueue(CommandTypes.SESSION_APPLY_STEP, CommandPayload.of(SESSION_ID, after.id()));
        }

        if (result.isRejected()) {
            throw CommandRejectedException.conflict(result.rejection().get());
        }
    }

    /**
     * Writes previous values back for the first {@code count} changes, newest
     * first, and describes the outcome.
     */
    private String revert(CommandContext ctx, TuningApplySession session, int count)
    {
        if (count == 0) {
            return "nothing to revert";
        }
        if (session.mode() == ApplyMode.SIMULATE) {
            return "simulated session, nothing written";
        }

        int reverted = 0;
        List<String> failures = new ArrayList<>();
        for (int i = count - 1; i >= 0; i--) {
            ParameterChange change = session.changes().get(i);
            try {
                ChecksumResult result = ctx.await(
                    transport.writeBlock(change.address(), change.previousValue()), "revert " + change.name());
                if (result.matches(change.previousValue())) {
                    reverted++;
                } else {
                    failures.add(change.name() + ": checksum mismatch");
                }
            } catch (TransportFailureException e) {
                failures.add(change.name() + ": " + e.getMessage());
            }
        }

        if (failures.isEmpty()) {
            log.info("Session {}: reverted {} change(s)", session.id(), reverted);
            return "reverted " + reverted + " change(s)";
        }
        log.error("Session {}: revert incomplete: {}", session.id(), failures);
        return "revert incomplete (" + String.join(", ", failures) + ")";
    }

    private void annotate(CommandContext ctx, String sessionId, String revertReason)
    {
        TuningApplySession current = requireSession(ctx, sessionId);
        TuningApplySession annotated = current.withRevertReason(revertReason, ctx.now());
        try {
            records.saveSession(annotated);
        } catch (PersistenceFailureException e) {
            reportError(ctx, "Revert reason of session " + sessionId + " not persisted", e);
        }
        ctx.update(s -> s.withSession(annotated, config.sessionHistoryLimit()));
    }

    private SafetyEvent recordEvent(CommandContext ctx, SafetyEventType type, Map<String, String> payload)
    {
        SafetyEvent event = safetyEvents.append(type, payload);
        ctx.update(s -> s.withSafety(s.safety().withLastEvent(event)));
        return event;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private TuningApplySession requireSession(CommandContext ctx, String id)
    {
        Optional<TuningApplySession> live = ctx.state().session(id);
        if (live.isPresent()) {
            return live.get();
        }
        // Ended sessions that aged out of the in-memory history.
        return records.findSession(id)
            .orElseThrow(() -> CommandRejectedException.invalid("Unknown session " + id));
    }

    private static void requireAllowed(Authorization authorization)
    {
        if (!authorization.allowed()) {
            throw new CommandRejectedException(FailureKind.POLICY_DENIED, authorization.reason());
        }
    }

    private void reportError(CommandContext ctx, String message, RuntimeException e)
    {
        log.error(message, e);
        observabilitySink.onError(new PipelineErrorEvent(ctx.now(), message, e));
    }

    private static ApplyMode parseMode(String raw)
    {
        try {
            return ApplyMode.parse(raw);
        } catch (IllegalArgumentException e) {
            throw CommandRejectedException.invalid(e.getMessage());
        }
    }

    static List<ParameterChange> parseChanges(List<?> raw)
    {
        List<ParameterChange> out = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item instanceof ParameterChange change) {
                out.add(change);
            } else if (item instanceof Map<?, ?> map) {
                Map<String, Object> fields = new LinkedHashMap<>();
                map.forEach((k, v) -> fields.put(String.valueOf(k), v));
                CommandPayload p = CommandPayload.of(fields);
                try {
                    out.add(new ParameterChange(p.requireString("name"), p.requireLong("address"),
                        p.requireBytes("previousValue"), p.requireBytes("newValue")));
                } catch (IllegalArgumentException e) {
                    throw CommandRejectedException.invalid("Invalid change: " + e.getMessage());
                }
            } else {
                throw CommandRejectedException.invalid("Unsupported change entry " + item);
            }
        }
        return out;
    }
}
