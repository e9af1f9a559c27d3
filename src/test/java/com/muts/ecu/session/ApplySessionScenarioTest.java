package com.muts.ecu.session;

import com.muts.ecu.api.FailureKind;
import com.muts.ecu.api.PolicyDeniedException;
import com.muts.ecu.config.PipelineConfig;
import com.muts.ecu.mode.OperatorMode;
import com.muts.ecu.observability.SessionTransitionEvent;
import com.muts.ecu.persistence.FailingTuningRecordStore;
import com.muts.ecu.persistence.InMemoryTuningRecordStore;
import com.muts.ecu.runtime.PipelineFixture;
import com.muts.ecu.safety.SafetyCheck;
import com.muts.ecu.safety.SafetyCheckProfile;
import com.muts.ecu.safety.SafetyParameter;
import com.muts.ecu.safety.SafetySnapshot;
import com.muts.ecu.safety.queue.InMemorySafetyEventStore;
import com.muts.ecu.safety.queue.SafetyEvent;
import com.muts.ecu.safety.queue.SafetyEventType;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandTypes;
import com.muts.ecu.transport.ScriptedEcuTransport;
import com.muts.ecu.transport.TelemetrySnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.muts.ecu.runtime.PipelineFixture.change;
import static com.muts.ecu.runtime.PipelineFixture.hex;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end apply-session behavior through the runtime, processed
 * synchronously on the test thread.
 */
class ApplySessionScenarioTest {

    private static final List<Map<String, Object>> TWO_CHANGES = List.of(
        change("fuel_trim", 0x1000, "10", "12"),
        change("boost_target", 0x1004, "0a0b", "0c0d"));

    private static final List<Map<String, Object>> THREE_CHANGES = List.of(
        change("a", 0x2000, "01", "11"),
        change("b", 0x2001, "02", "12"),
        change("c", 0x2002, "03", "13"));

    // ---------------------------------------------------------------------
    // Operator mode
    // ---------------------------------------------------------------------

    @Test
    void developmentModeRefusesArming() {
        PipelineFixture f = new PipelineFixture(OperatorMode.DEV);

        PolicyDeniedException denied = assertThrows(PolicyDeniedException.class,
            () -> f.runtime.enqueueCommand(CommandTypes.SAFETY_ARM, Map.of("level", "live_apply")));

        assertTrue(denied.reason().contains("Development Mode"));
        f.runtime.drain();
        assertFalse(f.state().safety().armed());
        assertEquals(0, f.runtime.safetyEventQueue().drain(100).size());
    }

    @Test
    void workshopArmingToLiveApplyNeedsConfirmation() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);

        f.send(CommandTypes.SAFETY_ARM, Map.of("level", "live_apply"));

        assertFalse(f.state().safety().armed());
        assertEquals(FailureKind.POLICY_DENIED, f.lastRejection().kind());
    }

    // ---------------------------------------------------------------------
    // Happy paths
    // ---------------------------------------------------------------------

    @Test
    void liveApplyWritesEveryChangeThenCompletes() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-1", "live_apply");
        assertEquals(ApplySessionStatus.ARMED, f.status(id));
        assertTrue(f.session(id).armed());

        f.apply(id, TWO_CHANGES);

        TuningApplySession done = f.session(id);
        assertEquals(ApplySessionStatus.APPLIED, done.status());
        assertEquals(2, done.appliedCount());
        assertFalse(done.armed());
        assertEquals(2, f.transport.writes().size());
        assertArrayEquals(hex("12"), f.transport.peek(0x1000, 1));
        assertArrayEquals(hex("0c0d"), f.transport.peek(0x1004, 2));

        assertEquals(1, f.events(SafetyEventType.SESSION_APPLIED).size());
        List<SafetySnapshot> snapshots = f.records.findSnapshots(id);
        assertEquals(2, snapshots.size());
        assertEquals(ApplySessionStatus.APPLIED, f.records.findSession(id).orElseThrow().status());

        List<ApplySessionStatus> path = f.sink.eventsOfType(SessionTransitionEvent.class).stream()
            .map(SessionTransitionEvent::to)
            .distinct()
            .toList();
        assertEquals(List.of(ApplySessionStatus.PENDING, ApplySessionStatus.ARMED,
            ApplySessionStatus.APPLYING, ApplySessionStatus.APPLIED), path);
    }

    @Test
    void simulateSessionEvaluatesButNeverWrites() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("sim", "simulate");

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.APPLIED, f.status(id));
        assertTrue(f.transport.writes().isEmpty());
        assertEquals(2, f.transport.telemetryReads());
    }

    // ---------------------------------------------------------------------
    // Safety violations
    // ---------------------------------------------------------------------

    @Test
    void criticalCoolantFailsSessionAndRecordsUndeliveredViolation() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-b", "live_apply");
        f.transport.setTelemetry(TelemetrySnapshot.idle(f.wallClock.now()).withCoolant(130));

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.FAILED, f.status(id));
        assertTrue(f.transport.writes().isEmpty());

        List<SafetyEvent> violations = f.events(SafetyEventType.VIOLATION);
        assertEquals(1, violations.size());
        SafetyEvent violation = violations.get(0);
        assertFalse(violation.delivered());
        assertEquals("safety_bound", violation.payload().get("cause"));
        assertEquals("COOLANT", violation.payload().get("parameter"));
        assertEquals("120.0", violation.payload().get("limit"));
        assertEquals(violation.id(), f.state().safety().last().orElseThrow().id());

        assertTrue(f.session(id).revertReason().contains("nothing to revert"));
    }

    @Test
    void breachAfterFirstWriteRevertsIt() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-2", "live_apply");
        TelemetrySnapshot ok = TelemetrySnapshot.idle(f.wallClock.now());
        f.transport.queueTelemetry(ok, ok.withKnock(25));

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.FAILED, f.status(id));
        List<ScriptedEcuTransport.Write> writes = f.transport.writes();
        assertEquals(2, writes.size());
        assertEquals(0x1000, writes.get(1).address());
        assertArrayEquals(hex("10"), writes.get(1).data());
        assertArrayEquals(hex("10"), f.transport.peek(0x1000, 1));
        assertTrue(f.session(id).revertReason().endsWith("reverted 1 change(s)"));
    }

    @Test
    void breachUnderProfileWithoutRevertEndsRevertedAndLeavesWritesInPlace() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        f.records.saveProfile(SafetyCheckProfile.of("race", "Race profile", false,
            List.of(SafetyCheck.rising(SafetyParameter.KNOCK, 10, 20))));
        f.connect();
        f.armSystem("live_apply");
        f.send(CommandTypes.SESSION_CREATE, Map.of("sessionId", "s-race", "vehicleSessionId", "veh-1",
            "mode", "live_apply", "profileId", "race"));
        f.armSession("s-race");
        TelemetrySnapshot ok = TelemetrySnapshot.idle(f.wallClock.now());
        f.transport.queueTelemetry(ok, ok.withKnock(25));

        f.apply("s-race", TWO_CHANGES);

        assertEquals(ApplySessionStatus.REVERTED, f.status("s-race"));
        assertEquals(1, f.transport.writes().size());
        assertArrayEquals(hex("12"), f.transport.peek(0x1000, 1));
        assertTrue(f.session("s-race").revertReason().endsWith("manual revert required"));
        List<SafetyEvent> violations = f.events(SafetyEventType.VIOLATION);
        assertEquals(1, violations.size());
        assertEquals("safety_bound", violations.get(0).payload().get("cause"));
    }

    @Test
    void writeFailureRevertsPartialBlockAndEarlierChanges() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-3", "live_apply");
        f.transport.failWriteAt(1);

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.FAILED, f.status(id));
        List<ScriptedEcuTransport.Write> writes = f.transport.writes();
        assertEquals(4, writes.size());
        assertEquals(0x1004, writes.get(2).address());
        assertArrayEquals(hex("0a0b"), writes.get(2).data());
        assertEquals(0x1000, writes.get(3).address());
        assertArrayEquals(hex("10"), writes.get(3).data());
        assertTrue(f.session(id).revertReason().endsWith("reverted 2 change(s)"));
        assertEquals("write_failure", f.events(SafetyEventType.VIOLATION).get(0).payload().get("cause"));
    }

    @Test
    void telemetryFailureFailsSessionBeforeAnyWrite() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-4", "live_apply");
        f.transport.failTelemetry(true);

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.FAILED, f.status(id));
        assertTrue(f.transport.writes().isEmpty());
        assertEquals("telemetry_failure", f.events(SafetyEventType.VIOLATION).get(0).payload().get("cause"));
    }

    // ---------------------------------------------------------------------
    // Persistence failures
    // ---------------------------------------------------------------------

    private static PipelineFixture failingRecords(FailingTuningRecordStore records) {
        return new PipelineFixture(PipelineConfig.builder().withOperatorMode(OperatorMode.WORKSHOP).build(),
            new ScriptedEcuTransport(false), new InMemorySafetyEventStore(), records);
    }

    @Test
    void unpersistedSnapshotStopsTheApplyBeforeWriting() {
        FailingTuningRecordStore records = new FailingTuningRecordStore();
        PipelineFixture f = failingRecords(records);
        String id = f.armedSession("s-p", "live_apply");
        records.failSnapshots(true);

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.FAILED, f.status(id));
        assertTrue(f.transport.writes().isEmpty());
        assertEquals("persistence_failure", f.events(SafetyEventType.VIOLATION).get(0).payload().get("cause"));
    }

    @Test
    void unpersistedArmLeavesSessionPending() {
        FailingTuningRecordStore records = new FailingTuningRecordStore();
        PipelineFixture f = failingRecords(records);
        f.connect();
        f.armSystem("live_apply");
        String id = f.createSession("s-q", "live_apply");
        records.failSessions(true);

        f.armSession(id);

        assertEquals(ApplySessionStatus.PENDING, f.status(id));
        assertEquals(1, f.sink.errors().size());
        assertTrue(f.events(SafetyEventType.SESSION_ARMED).isEmpty());
    }

    @Test
    void endedSessionsBeyondHistoryLimitLeaveMemoryButStayInRecords() {
        PipelineFixture f = new PipelineFixture(
            PipelineConfig.builder().withOperatorMode(OperatorMode.WORKSHOP).withSessionHistoryLimit(2).build(),
            new ScriptedEcuTransport(false), new InMemorySafetyEventStore(), new InMemoryTuningRecordStore());
        String live = f.armedSession("s-live", "live_apply");
        for (String id : List.of("s-a", "s-b", "s-c")) {
            f.createSession(id, "live_apply");
            f.send(CommandTypes.SESSION_CANCEL, Map.of("sessionId", id));
        }

        assertEquals(List.of(live, "s-b", "s-c"), List.copyOf(f.state().sessions().keySet()));
        assertEquals(ApplySessionStatus.ARMED, f.status(live));
        assertEquals(ApplySessionStatus.REVERTED, f.records.findSession("s-a").orElseThrow().status());

        // An evicted session is still known, so a second cancel is a state conflict.
        f.send(CommandTypes.SESSION_CANCEL, Map.of("sessionId", "s-a"));
        assertEquals(FailureKind.STATE_CONFLICT, f.lastRejection().kind());
        assertFalse(f.state().session("s-a").isPresent());
    }

    // ---------------------------------------------------------------------
    // Cancel and expiry
    // ---------------------------------------------------------------------

    @Test
    void cancelBetweenStepsRevertsWrittenChangesNewestFirst() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-5", "live_apply");

        f.runtime.enqueueCommand(CommandTypes.SESSION_APPLY, Map.of("sessionId", id, "changes", THREE_CHANGES));
        assertTrue(f.runtime.stateStore().step());
        assertTrue(f.runtime.stateStore().step());
        f.runtime.enqueueCommand(CommandTypes.SESSION_CANCEL, Map.of("sessionId", id, "reason", "stop"));
        f.runtime.drain();

        TuningApplySession s = f.session(id);
        assertEquals(ApplySessionStatus.REVERTED, s.status());
        assertEquals("stop; reverted 2 change(s)", s.revertReason());

        List<ScriptedEcuTransport.Write> writes = f.transport.writes();
        assertEquals(4, writes.size());
        assertEquals(0x2001, writes.get(2).address());
        assertEquals(0x2000, writes.get(3).address());
        assertArrayEquals(hex("0102"), f.transport.peek(0x2000, 2));
    }

    @Test
    void applyAfterExpiryIsRejectedBeforeTheSweepRuns() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-e", "live_apply");
        f.wallClock.advance(f.runtime.config().armTtl().plusSeconds(1));

        f.apply(id, TWO_CHANGES);

        assertEquals(ApplySessionStatus.EXPIRED, f.status(id));
        assertEquals(FailureKind.STATE_CONFLICT, f.lastRejection().kind());
        assertTrue(f.lastRejection().reason().contains("expired"));
        assertTrue(f.transport.writes().isEmpty());
        assertEquals(1, f.events(SafetyEventType.SESSION_EXPIRED).size());
    }

    @Test
    void expirySweepExpiresIdleArmedSessions() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-sweep", "live_apply");
        f.wallClock.advance(f.runtime.config().armTtl());

        f.runtime.stateStore().enqueueInternal(CommandTypes.SESSION_EXPIRE_SWEEP,
            CommandPayload.empty());
        f.runtime.drain();

        assertEquals(ApplySessionStatus.EXPIRED, f.status(id));
        assertFalse(f.session(id).armed());
    }

    // ---------------------------------------------------------------------
    // Arming preconditions
    // ---------------------------------------------------------------------

    @Test
    void wrongApplyTokenIsRejected() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        f.connect();
        f.armSystem("live_apply");
        String id = f.createSession("s-t", "live_apply");

        f.send(CommandTypes.SESSION_ARM, Map.of("sessionId", id, "applyToken", "not-the-token", "confirmed", true));

        assertEquals(ApplySessionStatus.PENDING, f.status(id));
        assertEquals(FailureKind.INVALID_COMMAND, f.lastRejection().kind());
    }

    @Test
    void staleApplyTokenIsRejected() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        f.connect();
        f.armSystem("live_apply");
        String id = f.createSession("s-old", "live_apply");
        f.wallClock.advance(f.runtime.config().applyTokenTtl());

        f.armSession(id);

        assertEquals(ApplySessionStatus.PENDING, f.status(id));
        assertEquals("Apply token expired", f.lastRejection().reason());
    }

    @Test
    void armingRequiresConnectedHardware() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        f.armSystem("live_apply");
        String id = f.createSession("s-nc", "live_apply");

        f.armSession(id);

        assertEquals(ApplySessionStatus.PENDING, f.status(id));
        assertEquals("Hardware not connected", f.lastRejection().reason());
    }

    @Test
    void liveSessionNeedsSystemArmedAtLiveApply() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        f.connect();
        f.armSystem("simulation");
        String id = f.createSession("s-lvl", "live_apply");

        f.armSession(id);

        assertEquals(ApplySessionStatus.PENDING, f.status(id));
        assertEquals(FailureKind.STATE_CONFLICT, f.lastRejection().kind());
    }

    @Test
    void concurrentSessionLimitIsEnforced() {
        PipelineConfig config = PipelineConfig.builder()
            .withOperatorMode(OperatorMode.WORKSHOP)
            .withMaxConcurrentSessions(1)
            .build();
        PipelineFixture f = new PipelineFixture(config, new ScriptedEcuTransport(false),
            new InMemorySafetyEventStore(), new InMemoryTuningRecordStore());
        f.armedSession("first", "live_apply");
        f.createSession("second", "live_apply");

        f.armSession("second");

        assertEquals(ApplySessionStatus.PENDING, f.status("second"));
        assertTrue(f.lastRejection().reason().contains("Maximum concurrent sessions"));
    }

    @Test
    void duplicateSessionIdIsRejected() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        f.createSession("dup", "live_apply");

        f.createSession("dup", "simulate");

        assertEquals(ApplyMode.LIVE_APPLY, f.session("dup").mode());
        assertEquals(FailureKind.STATE_CONFLICT, f.lastRejection().kind());
        assertEquals(1, f.events(SafetyEventType.SESSION_CREATED).size());
    }

    @Test
    void disarmCancelsActiveSessions() {
        PipelineFixture f = new PipelineFixture(OperatorMode.WORKSHOP);
        String id = f.armedSession("s-d", "live_apply");

        f.send(CommandTypes.SAFETY_DISARM);

        assertEquals(ApplySessionStatus.REVERTED, f.status(id));
        assertEquals("system disarmed", f.session(id).revertReason());
        assertFalse(f.state().safety().armed());
    }
}
