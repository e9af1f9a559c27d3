package com.muts.ecu.transport.udp;

import java.util.Optional;

/**
 * Message type byte of a gateway frame. Requests use the low range, responses
 * have the high bit set.
 */
public enum GatewayMessageType
{
    CONNECT(0x01),
    DISCONNECT(0x02),
    WRITE_BLOCK(0x03),
    READ_BLOCK(0x04),
    READ_TELEMETRY(0x05),
    READ_DTCS(0x06),

    ACK(0x81),
    CHECKSUM(0x82),
    BLOCK(0x83),
    TELEMETRY(0x84),
    DTCS(0x85),
    ERROR(0xFF);

    private final int code;

    GatewayMessageType(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public boolean isResponse()
    {
        return (code & 0x80) != 0;
    }

    public static Optional<GatewayMessageType> fromCode(int code)
    {
        for (GatewayMessageType t : values()) {
            if (t.code == (code & 0xFF)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
