package com.muts.ecu.transport.udp;

import com.muts.ecu.config.GatewayTransportConfig;
import com.muts.ecu.time.Cancellable;
import com.muts.ecu.time.MonotonicClock;
import com.muts.ecu.time.MonotonicScheduler;
import com.muts.ecu.time.WallClock;
import com.muts.ecu.transport.ChecksumResult;
import com.muts.ecu.transport.DiagnosticCode;
import com.muts.ecu.transport.EcuTransport;
import com.muts.ecu.transport.TelemetrySnapshot;
import com.muts.ecu.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * UdpGatewayTransport
 * =============================================================================
 * {@link EcuTransport} that talks to a vehicle interface gateway over UDP.
 *
 * <h2>Request path</h2>
 * <pre>
 *   EcuTransport call
 *        → GatewayFrameCodec body + frame
 *            → DatagramEndpoint.send(gateway, bytes)
 * </pre>
 *
 * <h2>Response path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → GatewayFrameCodec.decode (invalid datagrams dropped)
 *            → pending request with the same correlation id
 *                → future completed or failed
 * </pre>
 *
 * <p>Each request has a response deadline measured on the monotonic clock.
 * An {@code ERROR} response, a response of the wrong type, a missed deadline
 * or the endpoint going down fails the request with
 * {@link TransportFailureException}. Late responses are dropped.</p>
 */
public final class UdpGatewayTransport implements EcuTransport, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpGatewayTransport.class);

    private final DatagramEndpoint endpoint;
    private final GatewayTransportConfig config;
    private final GatewayFrameCodec codec;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private final AtomicInteger nextCorrelationId = new AtomicInteger();
    private final Map<Integer, Pending> pending = new ConcurrentHashMap<>();
    private volatile boolean up;

    public UdpGatewayTransport(DatagramEndpoint endpoint,
                               GatewayTransportConfig config,
                               GatewayFrameCodec codec,
                               MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               WallClock wallClock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    public void start()
    {
        endpoint.start();
    }

    public void stop()
    {
        endpoint.stop();
    }

    public boolean isUp()
    {
        return up;
    }

    int pendingRequests()
    {
        return pending.size();
    }

    // ---------------------------------------------------------------------
    // EcuTransport
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> connect(String interfaceId)
    {
        return request(GatewayMessageType.CONNECT, codec.connectBody(interfaceId), GatewayMessageType.ACK)
            .thenApply(body -> null);
    }

    @Override
    public CompletableFuture<Void> disconnect()
    {
        return request(GatewayMessageType.DISCONNECT, new byte[0], GatewayMessageType.ACK)
            .thenApply(body -> null);
    }

    @Override
    public CompletableFuture<ChecksumResult> writeBlock(long address, byte[] data)
    {
        return request(GatewayMessageType.WRITE_BLOCK, codec.writeBlockBody(address, data), GatewayMessageType.CHECKSUM)
            .thenApply(codec::parseChecksum);
    }

    @Override
    public CompletableFuture<byte[]> readBlock(long address, int length)
    {
        return request(GatewayMessageType.READ_BLOCK, codec.readBlockBody(address, length), GatewayMessageType.BLOCK)
            .thenApply(requireLength(length));
    }

    @Override
    public CompletableFuture<TelemetrySnapshot> readTelemetry()
    {
        return request(GatewayMessageType.READ_TELEMETRY, new byte[0], GatewayMessageType.TELEMETRY)
            .thenApply(body -> codec.parseTelemetry(body, wallClock.now()));
    }

    @Override
    public CompletableFuture<List<DiagnosticCode>> readDtcs()
    {
        return request(GatewayMessageType.READ_DTCS, new byte[0], GatewayMessageType.DTCS)
            .thenApply(codec::parseDtcs);
    }

    @Override
    public boolean isSimulated()
    {
        return false;
    }

    private CompletableFuture<byte[]> request(GatewayMessageType type, byte[] body, GatewayMessageType expected)
    {
        if (!up) {
            return CompletableFuture.failedFuture(new TransportFailureException("Gateway transport is down"));
        }

        int correlationId = nextCorrelationId.incrementAndGet();
        Pending p = new Pending(type, expected);
        pending.put(correlationId, p);
        p.timeout = scheduler.scheduleAfter(config.responseTimeout(), clock, () -> {
            Pending expired = pending.remove(correlationId);
            if (expired != null) {
                expired.response.completeExceptionally(new TransportFailureException(
                    type + " timed out after " + config.responseTimeout().toMillis() + " ms"));
            }
        });
        p.response.whenComplete((r, e) -> {
            pending.remove(correlationId, p);
            Cancellable t = p.timeout;
            if (t != null) {
                t.cancel();
            }
        });

        endpoint.send(config.gatewayAddress(), codec.encode(new GatewayFrame(type, correlationId, body)));
        return p.response;
    }

    private static Function<byte[], byte[]> requireLength(int length)
    {
        return body -> {
            if (body.length != length) {
                throw new GatewayFrameException("BLOCK body has " + body.length + " bytes, expected " + length);
            }
            return body;
        };
    }

    // ---------------------------------------------------------------------
    // DatagramEndpointListener
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        up = true;
        log.info("Gateway transport up, gateway at {}", config.gatewayAddress());
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        up = false;
        if (cause != null) {
            log.warn("Gateway transport down: {}", cause.toString());
        } else {
            log.info("Gateway transport stopped");
        }
        for (Integer id : List.copyOf(pending.keySet())) {
            Pending p = pending.remove(id);
            if (p != null) {
                p.response.completeExceptionally(new TransportFailureException(
                    p.request + " aborted: transport down", cause));
            }
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload)
    {
        Optional<GatewayFrame> decoded = codec.decode(payload);
        if (decoded.isEmpty()) {
            log.debug("Dropping malformed datagram from {} ({} bytes)", remote, payload.length);
            return;
        }
        GatewayFrame frame = decoded.get();
        Pending p = pending.remove(frame.correlationId());
        if (p == null) {
            log.debug("Dropping unmatched {} (correlation {})", frame.type(), frame.correlationId());
            return;
        }

        if (frame.type() == GatewayMessageType.ERROR) {
            p.response.completeExceptionally(new TransportFailureException(
                p.request + " refused by gateway: " + codec.parseText(frame.body())));
        } else if (frame.type() != p.expected) {
            p.response.completeExceptionally(new TransportFailureException(
                p.request + " answered with " + frame.type() + ", expected " + p.expected));
        } else {
            p.response.complete(frame.body());
        }
    }

    private static final class Pending
    {
        final GatewayMessageType request;
        final GatewayMessageType expected;
        final CompletableFuture<byte[]> response = new CompletableFuture<>();
        volatile Cancellable timeout;

        Pending(GatewayMessageType request, GatewayMessageType expected)
        {
            this.request = request;
            this.expected = expected;
        }
    }
}
