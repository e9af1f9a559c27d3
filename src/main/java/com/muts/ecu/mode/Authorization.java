package com.muts.ecu.mode;

import java.util.Optional;

/**
 * Outcome of an {@link OperatorModeGate} decision.
 *
 * @param allowed whether the operation may proceed
 * @param reason  denial reason; {@code null} when allowed
 */
public record Authorization(boolean allowed, String reason)
{
    private static final Authorization ALLOWED = new Authorization(true, null);

    public Authorization {
        if (!allowed && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("a denial requires a reason");
        }
    }

    public static Authorization allow()
    {
        return ALLOWED;
    }

    public static Authorization deny(String reason)
    {
        return new Authorization(false, reason);
    }

    public Optional<String> denialReason()
    {
        return Optional.ofNullable(reason);
    }
}
