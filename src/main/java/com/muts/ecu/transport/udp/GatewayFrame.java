package com.muts.ecu.transport.udp;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * One decoded gateway datagram.
 *
 * <p>Wire layout: {@code [type:1][correlationId:4][body:n][crc16:2]}, big-endian,
 * CRC-16/ARC over everything before it.</p>
 *
 * @param correlationId echoed by the gateway in its response
 */
public record GatewayFrame(GatewayMessageType type, int correlationId, byte[] body)
{
    public GatewayFrame {
        Objects.requireNonNull(type, "type");
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body()
    {
        return body.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GatewayFrame other)) {
            return false;
        }
        return type == other.type && correlationId == other.correlationId && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        return 31 * Objects.hash(type, correlationId) + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "GatewayFrame[" + type + ", corr=" + correlationId + ", body=" + HexFormat.of().formatHex(body) + "]";
    }
}
