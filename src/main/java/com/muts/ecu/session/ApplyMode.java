package com.muts.ecu.session;

import java.util.Locale;

/**
 * How a tuning-apply session reaches the ECU.
 */
public enum ApplyMode
{
    /** Full apply loop with safety checks, but no writes. */
    SIMULATE,

    /** Parameter writes to the running ECU. */
    LIVE_APPLY,

    /** Whole-image write driven by a flash job. */
    FLASH;

    public static ApplyMode parse(String value)
    {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown apply mode: " + value, e);
        }
    }
}
