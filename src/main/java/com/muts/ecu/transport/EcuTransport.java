package com.muts.ecu.transport;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * EcuTransport
 * =============================================================================
 * Opaque hardware capability consumed by the command processor.
 *
 * <h2>Ownership</h2>
 * The transport handle is owned exclusively by the command processor. Only
 * command handlers, running on the processor, may invoke it.
 *
 * <h2>Failures</h2>
 * Every operation completes exceptionally with a
 * {@link TransportFailureException} (or any other throwable, which the
 * processor treats the same way) when the hardware cannot fulfil it.
 *
 * <p>Implementations may be simulated ({@link SimulatedEcuTransport}) or reach a
 * real J2534/CAN interface (for instance through
 * {@link com.muts.ecu.transport.udp.UdpGatewayTransport}).</p>
 */
public interface EcuTransport
{
    CompletableFuture<Void> connect(String interfaceId);

    CompletableFuture<Void> disconnect();

    /**
     * Writes one block and returns the checksum the ECU computed over the
     * bytes it received.
     */
    CompletableFuture<ChecksumResult> writeBlock(long address, byte[] data);

    /**
     * Reads {@code length} bytes starting at {@code address}.
     */
    CompletableFuture<byte[]> readBlock(long address, int length);

    CompletableFuture<TelemetrySnapshot> readTelemetry();

    CompletableFuture<List<DiagnosticCode>> readDtcs();

    /**
     * Returns {@code true} if this transport does not reach real hardware.
     */
    boolean isSimulated();
}
