package com.muts.ecu.store;

import com.muts.ecu.api.ConnectionStatus;
import com.muts.ecu.api.FailureKind;
import com.muts.ecu.api.PolicyDeniedException;
import com.muts.ecu.api.Subscription;
import com.muts.ecu.observability.CommandRejectedEvent;
import com.muts.ecu.observability.RecordingObservabilitySink;
import com.muts.ecu.observability.StateTransitionEvent;
import com.muts.ecu.time.ManualWallClock;
import com.muts.ecu.transport.TransportFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    private final ManualWallClock clock = new ManualWallClock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private StateStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.stop();
        }
    }

    private StateStore.Builder builder() {
        return StateStore.builder()
            .withWallClock(clock)
            .withHardwareTimeout(Duration.ofMillis(200))
            .withObservabilitySink(sink);
    }

    private static CommandHandler connectingTo(String interfaceId) {
        return (command, ctx) -> ctx.update(s -> s.withConnection(
            new ConnectionState(ConnectionStatus.CONNECTED, interfaceId, null, ctx.now())));
    }

    // ---------------------------------------------------------------------
    // Ordering
    // ---------------------------------------------------------------------

    @Test
    void commandsFromManyThreadsAreProcessedOneAtATimeInEnqueueOrder() throws Exception {
        List<Long> processed = Collections.synchronizedList(new ArrayList<>());
        store = builder()
            .handle("test:record", (command, ctx) -> processed.add(command.sequence()))
            .build();
        store.start();

        int producers = 4;
        int perProducer = 250;
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            Thread t = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perProducer; i++) {
                    store.enqueue("test:record", CommandPayload.empty());
                }
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        for (Thread t : threads) {
            t.join();
        }

        assertTrue(store.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(producers * perProducer, processed.size());
        for (int i = 1; i < processed.size(); i++) {
            assertTrue(processed.get(i - 1) < processed.get(i), "sequence order violated at " + i);
        }
    }

    @Test
    void followUpCommandsRunAfterEverythingAlreadyQueued() {
        List<String> order = new ArrayList<>();
        store = builder()
            .handle("test:first", (command, ctx) -> {
                order.add("first");
                ctx.enqueue("test:follow-up", CommandPayload.empty());
            })
            .handle("test:second", (command, ctx) -> order.add("second"))
            .handle("test:follow-up", (command, ctx) -> order.add("follow-up"))
            .build();

        store.enqueue("test:first", CommandPayload.empty());
        store.enqueue("test:second", CommandPayload.empty());

        assertEquals(3, store.drain());
        assertEquals(List.of("first", "second", "follow-up"), order);
    }

    // ---------------------------------------------------------------------
    // Failure isolation
    // ---------------------------------------------------------------------

    @Test
    void unknownCommandTypeIsDroppedAndProcessingContinues() {
        store = builder().handle("connection:connect", connectingTo("can0")).build();

        store.enqueue("bogus:type", CommandPayload.empty());
        store.enqueue("connection:connect", CommandPayload.empty());
        store.drain();

        assertTrue(store.getState().connection().isConnected());
        CommandRejectedEvent rejected = sink.rejections().get(0);
        assertEquals(FailureKind.UNKNOWN_COMMAND, rejected.kind());
        assertEquals("bogus:type", rejected.command().type());
    }

    @Test
    void crashingHandlerDoesNotStopTheLoop() throws Exception {
        store = builder()
            .handle("test:crash", (command, ctx) -> {
                throw new IllegalStateException("boom");
            })
            .handle("connection:connect", connectingTo("can0"))
            .build();
        store.start();

        store.enqueue("test:crash", CommandPayload.empty());
        store.enqueue("connection:connect", CommandPayload.empty());

        assertTrue(store.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(store.isRunning());
        assertTrue(store.getState().connection().isConnected());
        assertEquals(1, sink.errors().size());
    }

    @Test
    void rejectedCommandIsReportedWithItsKind() {
        store = builder()
            .handle("test:reject", (command, ctx) -> {
                throw CommandRejectedException.conflict("not now");
            })
            .build();

        store.enqueue("test:reject", CommandPayload.empty());
        store.drain();

        assertEquals(FailureKind.STATE_CONFLICT, sink.rejections().get(0).kind());
        assertEquals("not now", sink.rejections().get(0).reason());
    }

    @Test
    void policyDenialIsSynchronousAndEnqueuesNothing() {
        store = builder()
            .withAuthorizer((type, payload) -> {
                throw new PolicyDeniedException(type, "ECU writes not allowed in Development Mode");
            })
            .handle("safety:arm", (command, ctx) -> fail("must not run"))
            .build();

        assertThrows(PolicyDeniedException.class, () -> store.enqueue("safety:arm", CommandPayload.empty()));
        assertEquals(0, store.pendingCommands());
        assertEquals(0, store.drain());
    }

    @Test
    void awaitTurnsTimeoutsIntoTransportFailures() {
        List<Throwable> seen = new ArrayList<>();
        store = builder()
            .handle("test:hang", (command, ctx) -> {
                try {
                    ctx.await(new CompletableFuture<Void>(), "hang");
                } catch (TransportFailureException e) {
                    seen.add(e);
                }
            })
            .build();

        store.enqueue("test:hang", CommandPayload.empty());
        store.drain();

        assertEquals(1, seen.size());
        assertTrue(seen.get(0).getMessage().contains("timed out"));
    }

    // ---------------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------------

    @Test
    void subscriberGetsCurrentValueImmediatelyThenChanges() {
        store = builder().handle("connection:connect", connectingTo("can0")).build();
        List<ConnectionState> seen = new ArrayList<>();

        Subscription subscription = store.subscribe(StateChannel.CONNECTION, seen::add);
        assertEquals(1, seen.size());
        assertEquals(ConnectionStatus.DISCONNECTED, seen.get(0).status());

        store.enqueue("connection:connect", CommandPayload.empty());
        store.drain();
        assertEquals(2, seen.size());
        assertEquals(ConnectionStatus.CONNECTED, seen.get(1).status());

        subscription.unsubscribe();
        store.enqueue("connection:connect", CommandPayload.empty());
        store.drain();
        assertEquals(2, seen.size());
    }

    @Test
    void subscribersOfOtherChannelsAreNotNotified() {
        store = builder().handle("connection:connect", connectingTo("can0")).build();
        List<SafetyState> safety = new ArrayList<>();
        store.subscribe(StateChannel.SAFETY, safety::add);

        store.enqueue("connection:connect", CommandPayload.empty());
        store.drain();

        assertEquals(1, safety.size());
    }

    @Test
    void transitionEventNamesChangedChannels() {
        store = builder().handle("connection:connect", connectingTo("can0")).build();
        ApplicationState before = store.getState();

        store.enqueue("connection:connect", CommandPayload.empty());
        store.drain();

        StateTransitionEvent event = sink.eventsOfType(StateTransitionEvent.class).get(0);
        assertSame(before, event.oldState());
        assertTrue(event.changed(StateChannel.CONNECTION.name()));
        assertFalse(event.changed(StateChannel.SAFETY.name()));
        assertFalse(before.connection().isConnected());
    }

    @Test
    void drainIsRefusedWhileRunning() {
        store = builder().build();
        store.start();

        assertThrows(IllegalStateException.class, () -> store.drain());
    }

    @Test
    void stopLeavesUnprocessedCommandsQueued() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store = builder()
            .handle("test:block", (command, ctx) -> {
                entered.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            })
            .handle("connection:connect", connectingTo("can0"))
            .build();
        store.start();
        store.enqueue("test:block", CommandPayload.empty());
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        store.enqueue("connection:connect", CommandPayload.empty());

        store.stop();
        release.countDown();

        assertFalse(store.getState().connection().isConnected());
        assertEquals(1, store.drain());
        assertTrue(store.getState().connection().isConnected());
    }
}
