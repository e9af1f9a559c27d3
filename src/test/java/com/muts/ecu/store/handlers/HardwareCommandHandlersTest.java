package com.muts.ecu.store.handlers;

import com.muts.ecu.api.ConnectionStatus;
import com.muts.ecu.api.FailureKind;
import com.muts.ecu.api.PolicyDeniedException;
import com.muts.ecu.config.PipelineConfig;
import com.muts.ecu.mode.OperatorMode;
import com.muts.ecu.persistence.InMemoryTuningRecordStore;
import com.muts.ecu.runtime.PipelineFixture;
import com.muts.ecu.safety.queue.InMemorySafetyEventStore;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.CommandTypes;
import com.muts.ecu.store.ConnectionState;
import com.muts.ecu.store.StateChannel;
import com.muts.ecu.transport.ScriptedEcuTransport;
import com.muts.ecu.transport.TelemetrySnapshot;
import com.muts.ecu.observability.PipelineErrorEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HardwareCommandHandlersTest {

    private static PipelineFixture fixture(OperatorMode mode, boolean simulated) {
        PipelineConfig config = PipelineConfig.builder()
            .withOperatorMode(mode)
            .withTelemetryInterval(Duration.ofMillis(100))
            .build();
        return new PipelineFixture(config, new ScriptedEcuTransport(simulated),
            new InMemorySafetyEventStore(), new InMemoryTuningRecordStore());
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    @Test
    void connectPassesThroughConnectingToConnected() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        List<ConnectionStatus> seen = new ArrayList<>();
        f.runtime.subscribe(StateChannel.CONNECTION, c -> seen.add(c.status()));

        f.connect();

        assertEquals(List.of(ConnectionStatus.DISCONNECTED, ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED),
            seen);
        assertEquals("can0", f.state().connection().interfaceId());
    }

    @Test
    void failedConnectLeavesErrorStatus() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.transport.failConnect(true);

        f.connect();

        ConnectionState c = f.state().connection();
        assertEquals(ConnectionStatus.ERROR, c.status());
        assertTrue(c.lastError().contains("no response"));
        assertEquals(1, f.sink.errors().size());
    }

    @Test
    void connectingToSecondInterfaceIsRejected() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();

        f.send(CommandTypes.CONNECTION_CONNECT, Map.of("interfaceId", "can1"));

        assertEquals("can0", f.state().connection().interfaceId());
        assertEquals(FailureKind.STATE_CONFLICT, f.lastRejection().kind());
    }

    @Test
    void workshopRefusesMockInterface() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, true);

        assertThrows(PolicyDeniedException.class,
            () -> f.runtime.enqueueCommand(CommandTypes.CONNECTION_CONNECT, Map.of("interfaceId", "mock")));
        assertEquals(0, f.runtime.stateStore().pendingCommands());
    }

    @Test
    void developmentModeConnectsToMockInterface() {
        PipelineFixture f = fixture(OperatorMode.DEV, true);

        f.connect();

        assertTrue(f.state().connection().isConnected());
    }

    @Test
    void disconnectResetsConnection() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();

        f.send(CommandTypes.CONNECTION_DISCONNECT);

        assertEquals(ConnectionStatus.DISCONNECTED, f.state().connection().status());
        assertNull(f.state().connection().interfaceId());
    }

    // ---------------------------------------------------------------------
    // Telemetry
    // ---------------------------------------------------------------------

    @Test
    void streamingPollsOnTheConfiguredInterval() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();
        f.transport.setTelemetry(TelemetrySnapshot.idle(f.wallClock.now()).withRpm(2500));

        f.send(CommandTypes.TELEMETRY_START);
        assertTrue(f.state().telemetry().streaming());

        for (int i = 0; i < 3; i++) {
            f.monotonicClock.advanceMillis(100);
            f.scheduler.runDueTasks();
            f.runtime.drain();
        }

        assertEquals(3, f.transport.telemetryReads());
        assertEquals(2500, f.state().telemetry().latestSnapshot().orElseThrow().rpm());
    }

    @Test
    void pollingTicksCoalesceWhileASampleIsQueued() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();
        f.send(CommandTypes.TELEMETRY_START);

        for (int i = 0; i < 5; i++) {
            f.monotonicClock.advanceMillis(100);
            f.scheduler.runDueTasks();
        }
        assertEquals(1, f.runtime.stateStore().pendingCommands());

        f.runtime.drain();
        assertEquals(1, f.transport.telemetryReads());
        assertEquals(0, f.runtime.stateStore().pendingCommands());

        f.monotonicClock.advanceMillis(100);
        f.scheduler.runDueTasks();
        f.monotonicClock.advanceMillis(100);
        f.scheduler.runDueTasks();
        assertEquals(1, f.runtime.stateStore().pendingCommands());
        f.runtime.drain();
        assertEquals(2, f.transport.telemetryReads());
    }

    @Test
    void stopQueuedDuringPollingWaitsBehindAtMostOneSample() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();
        f.send(CommandTypes.TELEMETRY_START);

        for (int i = 0; i < 20; i++) {
            f.monotonicClock.advanceMillis(100);
            f.scheduler.runDueTasks();
        }
        f.runtime.enqueueCommand(CommandTypes.TELEMETRY_STOP, CommandPayload.empty());

        assertEquals(2, f.runtime.stateStore().pendingCommands());
        f.runtime.drain();
        assertFalse(f.state().telemetry().streaming());
        assertEquals(1, f.transport.telemetryReads());
    }

    @Test
    void stopTelemetryCancelsPolling() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();
        f.send(CommandTypes.TELEMETRY_START);

        f.send(CommandTypes.TELEMETRY_STOP);
        f.monotonicClock.advanceMillis(1000);
        f.scheduler.runDueTasks();
        f.runtime.drain();

        assertFalse(f.state().telemetry().streaming());
        assertEquals(0, f.transport.telemetryReads());
    }

    @Test
    void telemetryRequiresConnection() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);

        f.send(CommandTypes.TELEMETRY_START);

        assertFalse(f.state().telemetry().streaming());
        assertEquals("Hardware not connected", f.lastRejection().reason());
    }

    @Test
    void failedSampleIsReportedAndPollingContinues() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();
        f.send(CommandTypes.TELEMETRY_START);
        f.transport.failTelemetry(true);

        f.monotonicClock.advanceMillis(100);
        f.scheduler.runDueTasks();
        f.runtime.drain();
        f.transport.failTelemetry(false);
        f.monotonicClock.advanceMillis(100);
        f.scheduler.runDueTasks();
        f.runtime.drain();

        assertEquals(1, f.sink.eventsOfType(PipelineErrorEvent.class).size());
        assertTrue(f.state().telemetry().latestSnapshot().isPresent());
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    @Test
    void scanStoresCodesAndScanTime() {
        PipelineFixture f = fixture(OperatorMode.WORKSHOP, false);
        f.connect();

        f.send(CommandTypes.DIAGNOSTICS_SCAN);

        assertEquals("P0300", f.state().diagnostics().codes().get(0).code());
        assertEquals(f.wallClock.now(), f.state().diagnostics().lastScan());
        assertFalse(f.state().diagnostics().scanning());
    }
}
