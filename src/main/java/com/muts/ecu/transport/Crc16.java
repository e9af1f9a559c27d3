package com.muts.ecu.transport;

import java.util.Arrays;

/**
 * Crc16
 * -----------------------------------------------------------------------------
 * CRC-16/ARC used for block checksums and gateway frame integrity.
 *
 * <p>Parameters: width 16, reflected polynomial 0xA001 (normal 0x8005),
 * init 0x0000, input and output reflected, xorout 0x0000. Appended CRCs are
 * big-endian.</p>
 */
public final class Crc16
{
    private static final int REFLECTED_POLY = 0xA001;
    private static final int INIT = 0x0000;

    private Crc16() {}

    public static int compute(byte[] data)
    {
        return compute(data, 0, data.length);
    }

    public static int compute(byte[] data, int off, int len)
    {
        if (off < 0 || len < 0 || off + len > data.length) {
            throw new IndexOutOfBoundsException("range " + off + "+" + len + " outside " + data.length);
        }

        int crc = INIT;
        for (int i = off; i < off + len; i++) {
            crc ^= (data[i] & 0xFF);
            for (int b = 0; b < 8; b++) {
                if ((crc & 0x0001) != 0) {
                    crc = (crc >>> 1) ^ REFLECTED_POLY;
                } else {
                    crc = (crc >>> 1);
                }
            }
            crc &= 0xFFFF;
        }
        return crc;
    }

    /**
     * Returns {@code body} followed by its CRC (two bytes, big-endian).
     */
    public static byte[] append(byte[] body)
    {
        int crc = compute(body);
        byte[] out = Arrays.copyOf(body, body.length + 2);
        out[out.length - 2] = (byte) ((crc >>> 8) & 0xFF);
        out[out.length - 1] = (byte) (crc & 0xFF);
        return out;
    }

    /**
     * Returns {@code true} if the trailing two bytes of {@code framed} are the
     * CRC of everything before them.
     */
    public static boolean verify(byte[] framed)
    {
        if (framed == null || framed.length < 2) {
            return false;
        }
        int len = framed.length;
        int transmitted = ((framed[len - 2] & 0xFF) << 8) | (framed[len - 1] & 0xFF);
        return transmitted == compute(framed, 0, len - 2);
    }
}
