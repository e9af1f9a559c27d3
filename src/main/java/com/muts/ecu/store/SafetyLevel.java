package com.muts.ecu.store;

import java.util.Locale;

/**
 * System-wide arming level. Ordered from least to most permissive.
 */
public enum SafetyLevel
{
    READ_ONLY,
    SIMULATION,
    LIVE_APPLY;

    public boolean atLeast(SafetyLevel other)
    {
        return compareTo(other) >= 0;
    }

    /**
     * Accepts {@code read_only}, {@code simulation}, {@code live_apply} in any case.
     */
    public static SafetyLevel parse(String value)
    {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown safety level: " + value, e);
        }
    }
}
