package com.muts.ecu.transport;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Test transport with a byte-addressed memory, scriptable telemetry and
 * failure injection. Every call completes immediately.
 */
public final class ScriptedEcuTransport implements EcuTransport {

    public record Write(long address, byte[] data) {}

    private final boolean simulated;
    private final Map<Long, Byte> memory = new HashMap<>();
    private final List<Write> writes = new ArrayList<>();
    private final Deque<TelemetrySnapshot> scriptedTelemetry = new ArrayDeque<>();

    private TelemetrySnapshot telemetry = TelemetrySnapshot.idle(Instant.parse("2026-01-05T09:00:00Z"));
    private boolean failConnect;
    private boolean failTelemetry;
    private int failWriteAt = -1;
    private boolean corruptChecksums;
    private boolean corruptReads;
    private int telemetryReads;

    public ScriptedEcuTransport() {
        this(false);
    }

    public ScriptedEcuTransport(boolean simulated) {
        this.simulated = simulated;
    }

    // ---------------------------------------------------------------------
    // Scripting
    // ---------------------------------------------------------------------

    public synchronized void setTelemetry(TelemetrySnapshot value) {
        this.telemetry = value;
    }

    /**
     * Queues readings returned before falling back to {@link #setTelemetry}.
     */
    public synchronized void queueTelemetry(TelemetrySnapshot... values) {
        scriptedTelemetry.addAll(List.of(values));
    }

    public synchronized void failConnect(boolean value) {
        this.failConnect = value;
    }

    public synchronized void failTelemetry(boolean value) {
        this.failTelemetry = value;
    }

    /**
     * Fails the write with this zero-based index (counted over all writes).
     */
    public synchronized void failWriteAt(int index) {
        this.failWriteAt = index;
    }

    public synchronized void corruptChecksums(boolean value) {
        this.corruptChecksums = value;
    }

    public synchronized void corruptReads(boolean value) {
        this.corruptReads = value;
    }

    public synchronized void poke(long address, byte[] data) {
        for (int i = 0; i < data.length; i++) {
            memory.put(address + i, data[i]);
        }
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    public synchronized List<Write> writes() {
        return new ArrayList<>(writes);
    }

    public synchronized byte[] peek(long address, int length) {
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = memory.getOrDefault(address + i, (byte) 0xFF);
        }
        return out;
    }

    public synchronized int telemetryReads() {
        return telemetryReads;
    }

    // ---------------------------------------------------------------------
    // EcuTransport
    // ---------------------------------------------------------------------

    @Override
    public synchronized CompletableFuture<Void> connect(String interfaceId) {
        if (failConnect) {
            return CompletableFuture.failedFuture(new TransportFailureException("no response from " + interfaceId));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<ChecksumResult> writeBlock(long address, byte[] data) {
        int index = writes.size();
        writes.add(new Write(address, data.clone()));
        if (index == failWriteAt) {
            return CompletableFuture.failedFuture(new TransportFailureException("write " + index + " failed"));
        }
        poke(address, data);
        int crc = Crc16.compute(data);
        if (corruptChecksums) {
            crc ^= 0x0001;
        }
        return CompletableFuture.completedFuture(new ChecksumResult(address, data.length, crc));
    }

    @Override
    public synchronized CompletableFuture<byte[]> readBlock(long address, int length) {
        byte[] out = peek(address, length);
        if (corruptReads && length > 0) {
            out[0] ^= 0x01;
        }
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public synchronized CompletableFuture<TelemetrySnapshot> readTelemetry() {
        telemetryReads++;
        if (failTelemetry) {
            return CompletableFuture.failedFuture(new TransportFailureException("telemetry timeout"));
        }
        TelemetrySnapshot next = scriptedTelemetry.isEmpty() ? telemetry : scriptedTelemetry.poll();
        return CompletableFuture.completedFuture(next);
    }

    @Override
    public CompletableFuture<List<DiagnosticCode>> readDtcs() {
        return CompletableFuture.completedFuture(List.of(
            new DiagnosticCode("P0300", "Random misfire detected", "pending")));
    }

    @Override
    public boolean isSimulated() {
        return simulated;
    }
}
