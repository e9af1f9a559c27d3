package com.muts.ecu.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * One timestamped reading of engine parameters.
 *
 * <p>Throttle, speed and oil pressure are optional and {@code null} when the
 * interface does not report them. Units: rpm, psi, AFR ratio, knock counts,
 * degrees Celsius, percent, km/h, psi.</p>
 */
public record TelemetrySnapshot(
    double rpm,
    double boost,
    double afr,
    double knock,
    double coolant,
    double iat,
    Double throttle,
    Double speed,
    Double oilPressure,
    Instant timestamp
) {
    public TelemetrySnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Warm idle reading with every parameter well inside default bounds.
     */
    public static TelemetrySnapshot idle(Instant timestamp)
    {
        return new TelemetrySnapshot(850, 0, 14.7, 0, 90, 30, 0.0, 0.0, 40.0, timestamp);
    }

    public TelemetrySnapshot withRpm(double value)
    {
        return new TelemetrySnapshot(value, boost, afr, knock, coolant, iat, throttle, speed, oilPressure, timestamp);
    }

    public TelemetrySnapshot withBoost(double value)
    {
        return new TelemetrySnapshot(rpm, value, afr, knock, coolant, iat, throttle, speed, oilPressure, timestamp);
    }

    public TelemetrySnapshot withAfr(double value)
    {
        return new TelemetrySnapshot(rpm, boost, value, knock, coolant, iat, throttle, speed, oilPressure, timestamp);
    }

    public TelemetrySnapshot withKnock(double value)
    {
        return new TelemetrySnapshot(rpm, boost, afr, value, coolant, iat, throttle, speed, oilPressure, timestamp);
    }

    public TelemetrySnapshot withCoolant(double value)
    {
        return new TelemetrySnapshot(rpm, boost, afr, knock, value, iat, throttle, speed, oilPressure, timestamp);
    }

    public TelemetrySnapshot withTimestamp(Instant value)
    {
        return new TelemetrySnapshot(rpm, boost, afr, knock, coolant, iat, throttle, speed, oilPressure, value);
    }
}
