package com.muts.ecu.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Issues and checks single-use apply tokens.
 */
public final class ApplyTokens
{
    private static final int TOKEN_BYTES = 32;

    private final SecureRandom random;

    public ApplyTokens()
    {
        this(new SecureRandom());
    }

    public ApplyTokens(SecureRandom random)
    {
        this.random = random;
    }

    /**
     * Returns 32 random bytes as lowercase hex.
     */
    public String issue()
    {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Constant-time comparison. A {@code null} on either side never matches.
     */
    public static boolean matches(String expected, String presented)
    {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            presented.getBytes(StandardCharsets.US_ASCII));
    }
}
