package com.muts.ecu.flash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Firmware image to be written by a flash job.
 *
 * @param data           raw image bytes
 * @param declaredSha256 64-character hex SHA-256 supplied by the operator
 * @param baseAddress    ECU address of the first byte
 */
public record FlashImage(byte[] data, String declaredSha256, long baseAddress)
{
    public FlashImage {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(declaredSha256, "declaredSha256");
        if (baseAddress < 0) {
            throw new IllegalArgumentException("baseAddress must be >= 0");
        }
        data = data.clone();
        declaredSha256 = declaredSha256.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public byte[] data()
    {
        return data.clone();
    }

    public int length()
    {
        return data.length;
    }

    public static String sha256Hex(byte[] bytes)
    {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * The image hashes to the declared digest.
     */
    public boolean checksumMatches()
    {
        return declaredSha256.matches("[0-9a-f]{64}") && sha256Hex(data).equals(declaredSha256);
    }

    /**
     * The image is non-empty and fits the allowed size.
     */
    public boolean isValid(int maxBytes)
    {
        return data.length > 0 && data.length <= maxBytes;
    }

    public int blockCount(int blockSize)
    {
        return (data.length + blockSize - 1) / blockSize;
    }

    public long blockAddress(int index, int blockSize)
    {
        return baseAddress + (long) index * blockSize;
    }

    public byte[] block(int index, int blockSize)
    {
        int from = index * blockSize;
        if (index < 0 || from >= data.length) {
            throw new IndexOutOfBoundsException("block " + index);
        }
        return Arrays.copyOfRange(data, from, Math.min(data.length, from + blockSize));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlashImage other)) {
            return false;
        }
        return baseAddress == other.baseAddress
            && declaredSha256.equals(other.declaredSha256)
            && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode()
    {
        return 31 * Objects.hash(declaredSha256, baseAddress) + Arrays.hashCode(data);
    }

    @Override
    public String toString()
    {
        return "FlashImage[" + data.length + " bytes @0x" + Long.toHexString(baseAddress) + "]";
    }
}
