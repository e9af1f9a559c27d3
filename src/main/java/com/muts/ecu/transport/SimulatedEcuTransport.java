package com.muts.ecu.transport;

import com.muts.ecu.time.WallClock;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * SimulatedEcuTransport
 * -----------------------------------------------------------------------------
 * In-process ECU stand-in used in DEV mode and for bench demos.
 *
 * <p>Keeps a sparse byte-addressed memory image so written blocks can be read
 * back, reports idle telemetry and a fixed DTC list. All futures complete
 * immediately.</p>
 */
public final class SimulatedEcuTransport implements EcuTransport
{
    private final WallClock clock;
    private final Map<Long, Byte> memory = new TreeMap<>();
    private volatile boolean connected;

    public SimulatedEcuTransport(WallClock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<Void> connect(String interfaceId)
    {
        Objects.requireNonNull(interfaceId, "interfaceId");
        connected = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> disconnect()
    {
        connected = false;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<ChecksumResult> writeBlock(long address, byte[] data)
    {
        if (!connected) {
            return notConnected();
        }
        for (int i = 0; i < data.length; i++) {
            memory.put(address + i, data[i]);
        }
        return CompletableFuture.completedFuture(new ChecksumResult(address, data.length, Crc16.compute(data)));
    }

    @Override
    public synchronized CompletableFuture<byte[]> readBlock(long address, int length)
    {
        if (!connected) {
            return notConnected();
        }
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = memory.getOrDefault(address + i, (byte) 0xFF);
        }
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public CompletableFuture<TelemetrySnapshot> readTelemetry()
    {
        if (!connected) {
            return notConnected();
        }
        return CompletableFuture.completedFuture(TelemetrySnapshot.idle(clock.now()));
    }

    @Override
    public CompletableFuture<List<DiagnosticCode>> readDtcs()
    {
        if (!connected) {
            return notConnected();
        }
        return CompletableFuture.completedFuture(List.of(
            new DiagnosticCode("P0101", "Mass air flow circuit range/performance", "stored")));
    }

    @Override
    public boolean isSimulated()
    {
        return true;
    }

    private static <T> CompletableFuture<T> notConnected()
    {
        return CompletableFuture.failedFuture(new TransportFailureException("simulated interface not connected"));
    }
}
