package com.muts.ecu.safety;

import com.muts.ecu.transport.TelemetrySnapshot;

import java.util.OptionalDouble;

/**
 * Engine parameters that a {@link SafetyCheck} can bound.
 */
public enum SafetyParameter
{
    RPM("rpm"),
    BOOST("psi"),
    AFR("ratio"),
    KNOCK("count"),
    COOLANT("degC"),
    IAT("degC"),
    THROTTLE("%"),
    SPEED("km/h"),
    OIL_PRESSURE("psi");

    private final String unit;

    SafetyParameter(String unit)
    {
        this.unit = unit;
    }

    public String unit()
    {
        return unit;
    }

    /**
     * Extracts this parameter from a reading. Optional channels that the
     * interface did not report yield an empty result.
     */
    public OptionalDouble read(TelemetrySnapshot s)
    {
        switch (this) {
            case RPM: return OptionalDouble.of(s.rpm());
            case BOOST: return OptionalDouble.of(s.boost());
            case AFR: return OptionalDouble.of(s.afr());
            case KNOCK: return OptionalDouble.of(s.knock());
            case COOLANT: return OptionalDouble.of(s.coolant());
            case IAT: return OptionalDouble.of(s.iat());
            case THROTTLE: return optional(s.throttle());
            case SPEED: return optional(s.speed());
            case OIL_PRESSURE: return optional(s.oilPressure());
            default: return OptionalDouble.empty();
        }
    }

    private static OptionalDouble optional(Double value)
    {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
