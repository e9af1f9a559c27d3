package com.muts.ecu.transport.udp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.muts.ecu.transport.ChecksumResult;
import com.muts.ecu.transport.Crc16;
import com.muts.ecu.transport.DiagnosticCode;
import com.muts.ecu.transport.TelemetrySnapshot;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GatewayFrameCodec
 * -----------------------------------------------------------------------------
 * Byte-level codec for gateway frames and their bodies.
 *
 * <h2>Bodies</h2>
 * <ul>
 *   <li>{@code CONNECT}: interface id, UTF-8</li>
 *   <li>{@code WRITE_BLOCK}: {@code [address:8][data]}</li>
 *   <li>{@code READ_BLOCK}: {@code [address:8][length:4]}</li>
 *   <li>{@code CHECKSUM}: {@code [address:8][length:4][crc:2]}</li>
 *   <li>{@code BLOCK}: raw bytes</li>
 *   <li>{@code TELEMETRY}: nine IEEE-754 doubles (rpm, boost, afr, knock,
 *       coolant, iat, throttle, speed, oil pressure), NaN for absent</li>
 *   <li>{@code DTCS}: JSON array of {@code {code, description, status}}</li>
 *   <li>{@code ERROR}: message, UTF-8</li>
 * </ul>
 *
 * <p>{@link #decode(byte[])} treats malformed datagrams as transport defects
 * and returns empty. Body parsers throw {@link GatewayFrameException}.</p>
 */
public final class GatewayFrameCodec
{
    private static final int HEADER_LENGTH = 5;
    private static final int CRC_LENGTH = 2;
    private static final int TELEMETRY_FIELDS = 9;

    private static final TypeReference<List<DiagnosticCode>> DTC_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    // ---------------------------------------------------------------------
    // Frames
    // ---------------------------------------------------------------------

    public byte[] encode(GatewayFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        byte[] body = frame.body();
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + body.length);
        buf.put((byte) frame.type().code());
        buf.putInt(frame.correlationId());
        buf.put(body);
        return Crc16.append(buf.array());
    }

    public Optional<GatewayFrame> decode(byte[] datagram)
    {
        if (datagram == null || datagram.length < HEADER_LENGTH + CRC_LENGTH) {
            return Optional.empty();
        }
        if (!Crc16.verify(datagram)) {
            return Optional.empty();
        }
        Optional<GatewayMessageType> type = GatewayMessageType.fromCode(datagram[0]);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        int correlationId = ByteBuffer.wrap(datagram, 1, 4).getInt();
        byte[] body = Arrays.copyOfRange(datagram, HEADER_LENGTH, datagram.length - CRC_LENGTH);
        return Optional.of(new GatewayFrame(type.get(), correlationId, body));
    }

    // ---------------------------------------------------------------------
    // Request bodies
    // ---------------------------------------------------------------------

    public byte[] connectBody(String interfaceId)
    {
        return interfaceId.getBytes(StandardCharsets.UTF_8);
    }

    public byte[] writeBlockBody(long address, byte[] data)
    {
        return ByteBuffer.allocate(8 + data.length).putLong(address).put(data).array();
    }

    public byte[] readBlockBody(long address, int length)
    {
        return ByteBuffer.allocate(12).putLong(address).putInt(length).array();
    }

    // ---------------------------------------------------------------------
    // Response bodies
    // ---------------------------------------------------------------------

    public byte[] checksumBody(ChecksumResult result)
    {
        return ByteBuffer.allocate(14)
            .putLong(result.address())
            .putInt(result.length())
            .putShort((short) result.crc())
            .array();
    }

    public ChecksumResult parseChecksum(byte[] body)
    {
        if (body.length != 14) {
            throw new GatewayFrameException("CHECKSUM body must be 14 bytes, got " + body.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(body);
        long address = buf.getLong();
        int length = buf.getInt();
        int crc = buf.getShort() & 0xFFFF;
        try {
            return new ChecksumResult(address, length, crc);
        } catch (IllegalArgumentException e) {
            throw new GatewayFrameException("Invalid CHECKSUM body: " + e.getMessage(), e);
        }
    }

    public byte[] telemetryBody(TelemetrySnapshot t)
    {
        return ByteBuffer.allocate(TELEMETRY_FIELDS * 8)
            .putDouble(t.rpm())
            .putDouble(t.boost())
            .putDouble(t.afr())
            .putDouble(t.knock())
            .putDouble(t.coolant())
            .putDouble(t.iat())
            .putDouble(orNaN(t.throttle()))
            .putDouble(orNaN(t.speed()))
            .putDouble(orNaN(t.oilPressure()))
            .array();
    }

    public TelemetrySnapshot parseTelemetry(byte[] body, Instant receivedAt)
    {
        if (body.length != TELEMETRY_FIELDS * 8) {
            throw new GatewayFrameException("TELEMETRY body must be " + TELEMETRY_FIELDS * 8 + " bytes, got " + body.length);
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(body);
            return new TelemetrySnapshot(buf.getDouble(), buf.getDouble(), buf.getDouble(), buf.getDouble(),
                buf.getDouble(), buf.getDouble(), orNull(buf.getDouble()), orNull(buf.getDouble()),
                orNull(buf.getDouble()), receivedAt);
        } catch (BufferUnderflowException e) {
            throw new GatewayFrameException("Truncated TELEMETRY body", e);
        }
    }

    public byte[] dtcsBody(List<DiagnosticCode> codes)
    {
        try {
            return mapper.writeValueAsBytes(codes);
        } catch (JsonProcessingException e) {
            throw new GatewayFrameException("Cannot encode DTC list", e);
        }
    }

    public List<DiagnosticCode> parseDtcs(byte[] body)
    {
        try {
            return List.copyOf(mapper.readValue(body, DTC_LIST));
        } catch (IOException | RuntimeException e) {
            throw new GatewayFrameException("Invalid DTCS body", e);
        }
    }

    public String parseText(byte[] body)
    {
        return new String(body, StandardCharsets.UTF_8);
    }

    private static double orNaN(Double value)
    {
        return value == null ? Double.NaN : value;
    }

    private static Double orNull(double value)
    {
        return Double.isNaN(value) ? null : value;
    }
}
