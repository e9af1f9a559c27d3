package com.muts.ecu.safety;

import java.util.Objects;

/**
 * A single parameter reading outside one of its bounds.
 *
 * @param parameter offending parameter
 * @param level     severity
 * @param value     observed value
 * @param limit     the bound that was crossed
 */
public record BoundBreach(SafetyParameter parameter, BreachLevel level, double value, double limit)
{
    public BoundBreach {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(level, "level");
    }

    public boolean isCritical()
    {
        return level == BreachLevel.CRITICAL;
    }

    public String describe()
    {
        return String.format("%s %s: %s=%.2f%s (limit %.2f)",
            level, parameter, parameter.name().toLowerCase(), value, parameter.unit(), limit);
    }
}
