package com.muts.ecu.transport;

/**
 * Checksum reported by the ECU after a block write.
 *
 * @param address start address of the written block
 * @param length  number of bytes the ECU received
 * @param crc     CRC-16/ARC computed by the ECU over the received bytes
 */
public record ChecksumResult(long address, int length, int crc)
{
    public ChecksumResult {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        if (crc < 0 || crc > 0xFFFF) {
            throw new IllegalArgumentException("crc must be a 16-bit value");
        }
    }

    /**
     * Returns {@code true} if the ECU received exactly {@code data}.
     */
    public boolean matches(byte[] data)
    {
        return data.length == length && Crc16.compute(data) == crc;
    }
}
