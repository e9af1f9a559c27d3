package com.muts.ecu.transport.udp;

import com.muts.ecu.config.GatewayTransportConfig;
import com.muts.ecu.time.DeterministicScheduler;
import com.muts.ecu.time.ManualMonotonicClock;
import com.muts.ecu.time.ManualWallClock;
import com.muts.ecu.transport.ChecksumResult;
import com.muts.ecu.transport.Crc16;
import com.muts.ecu.transport.DiagnosticCode;
import com.muts.ecu.transport.TelemetrySnapshot;
import com.muts.ecu.transport.TransportFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request/response matching of the gateway transport, driven through a fake
 * endpoint and a manual clock.
 */
class UdpGatewayTransportTest {

    private static final InetSocketAddress GATEWAY = new InetSocketAddress("127.0.0.1", 47000);

    private final GatewayFrameCodec codec = new GatewayFrameCodec();
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = new ManualWallClock();
    private DeterministicScheduler scheduler;
    private FakeDatagramEndpoint endpoint;
    private UdpGatewayTransport transport;

    @BeforeEach
    void setUp() {
        scheduler = new DeterministicScheduler(clock);
        endpoint = new FakeDatagramEndpoint();
        GatewayTransportConfig config = GatewayTransportConfig.builder()
            .withGatewayAddress(GATEWAY)
            .withResponseTimeout(Duration.ofMillis(500))
            .build();
        transport = new UdpGatewayTransport(endpoint, config, codec, scheduler, clock, wallClock);
        transport.start();
    }

    private GatewayFrame lastRequest() {
        FakeDatagramEndpoint.Sent sent = endpoint.lastSent();
        assertEquals(GATEWAY, sent.remote());
        return codec.decode(sent.payload()).orElseThrow();
    }

    private void reply(GatewayMessageType type, int correlationId, byte[] body) {
        endpoint.injectDatagram(GATEWAY, codec.encode(new GatewayFrame(type, correlationId, body)));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        return e.getCause();
    }

    // ---------------------------------------------------------------------
    // Matching
    // ---------------------------------------------------------------------

    @Test
    void connectSendsInterfaceIdAndCompletesOnAck() throws Exception {
        CompletableFuture<Void> f = transport.connect("can0");

        GatewayFrame request = lastRequest();
        assertEquals(GatewayMessageType.CONNECT, request.type());
        assertEquals("can0", new String(request.body(), StandardCharsets.UTF_8));
        assertFalse(f.isDone());

        reply(GatewayMessageType.ACK, request.correlationId(), new byte[0]);

        assertNull(f.get());
        assertEquals(0, transport.pendingRequests());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void writeBlockReturnsGatewayChecksum() throws Exception {
        byte[] data = {1, 2, 3, 4};
        CompletableFuture<ChecksumResult> f = transport.writeBlock(0x2000, data);

        GatewayFrame request = lastRequest();
        ByteBuffer body = ByteBuffer.wrap(request.body());
        assertEquals(0x2000, body.getLong());
        reply(GatewayMessageType.CHECKSUM, request.correlationId(),
            codec.checksumBody(new ChecksumResult(0x2000, 4, Crc16.compute(data))));

        assertTrue(f.get().matches(data));
    }

    @Test
    void responsesAreMatchedByCorrelationIdNotArrivalOrder() throws Exception {
        CompletableFuture<TelemetrySnapshot> telemetry = transport.readTelemetry();
        int telemetryId = lastRequest().correlationId();
        CompletableFuture<List<DiagnosticCode>> dtcs = transport.readDtcs();
        int dtcsId = lastRequest().correlationId();
        assertNotEquals(telemetryId, dtcsId);

        List<DiagnosticCode> codes = List.of(new DiagnosticCode("P0300", "Random misfire detected", "pending"));
        reply(GatewayMessageType.DTCS, dtcsId, codec.dtcsBody(codes));
        assertFalse(telemetry.isDone());

        TelemetrySnapshot reading = TelemetrySnapshot.idle(wallClock.now());
        reply(GatewayMessageType.TELEMETRY, telemetryId, codec.telemetryBody(reading));

        assertEquals(codes, dtcs.get());
        assertEquals(reading, telemetry.get());
    }

    @Test
    void unmatchedAndCorruptDatagramsAreIgnored() {
        CompletableFuture<byte[]> f = transport.readBlock(0x10, 2);
        int id = lastRequest().correlationId();

        reply(GatewayMessageType.BLOCK, id + 100, new byte[] {1, 2});
        byte[] corrupt = codec.encode(new GatewayFrame(GatewayMessageType.BLOCK, id, new byte[] {1, 2}));
        corrupt[5] ^= 0x01;
        endpoint.injectDatagram(GATEWAY, corrupt);

        assertFalse(f.isDone());
        assertEquals(1, transport.pendingRequests());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void errorResponseFailsRequestWithGatewayMessage() {
        CompletableFuture<ChecksumResult> f = transport.writeBlock(0x10, new byte[] {1});

        reply(GatewayMessageType.ERROR, lastRequest().correlationId(),
            "flash region locked".getBytes(StandardCharsets.UTF_8));

        Throwable cause = failureOf(f);
        assertInstanceOf(TransportFailureException.class, cause);
        assertTrue(cause.getMessage().contains("flash region locked"));
    }

    @Test
    void wrongResponseTypeFailsRequest() {
        CompletableFuture<TelemetrySnapshot> f = transport.readTelemetry();

        reply(GatewayMessageType.ACK, lastRequest().correlationId(), new byte[0]);

        assertInstanceOf(TransportFailureException.class, failureOf(f));
    }

    @Test
    void shortBlockResponseFailsRead() {
        CompletableFuture<byte[]> f = transport.readBlock(0x10, 4);

        reply(GatewayMessageType.BLOCK, lastRequest().correlationId(), new byte[] {1, 2});

        assertInstanceOf(GatewayFrameException.class, failureOf(f));
    }

    @Test
    void missingResponseTimesOutOnMonotonicClock() {
        CompletableFuture<Void> f = transport.connect("can0");
        int id = lastRequest().correlationId();

        clock.advanceMillis(499);
        scheduler.runDueTasks();
        assertFalse(f.isDone());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        Throwable cause = failureOf(f);
        assertInstanceOf(TransportFailureException.class, cause);
        assertTrue(cause.getMessage().contains("timed out"));

        reply(GatewayMessageType.ACK, id, new byte[0]);
        assertEquals(0, transport.pendingRequests());
    }

    @Test
    void transportDownFailsPendingAndNewRequests() {
        CompletableFuture<Void> pending = transport.connect("can0");

        endpoint.failTransport(new IOException("socket closed"));

        assertFalse(transport.isUp());
        assertInstanceOf(TransportFailureException.class, failureOf(pending));
        Throwable refused = failureOf(transport.readTelemetry());
        assertTrue(refused.getMessage().contains("down"));
        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void reportsRealHardware() {
        assertFalse(transport.isSimulated());
    }
}
