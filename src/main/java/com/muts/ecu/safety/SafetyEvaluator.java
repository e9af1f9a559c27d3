package com.muts.ecu.safety;

import com.muts.ecu.transport.TelemetrySnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Pure evaluation of a telemetry reading against a {@link SafetyCheckProfile}.
 *
 * <p>Breaches are reported in {@link SafetyParameter} declaration order.
 * Optional channels that were not reported are skipped.</p>
 */
public final class SafetyEvaluator
{
    public SafetyEvaluation evaluate(SafetyCheckProfile profile, TelemetrySnapshot reading)
    {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(reading, "reading");

        List<BoundBreach> breaches = new ArrayList<>();
        for (SafetyCheck check : profile.checks().values()) {
            OptionalDouble value = check.parameter().read(reading);
            if (value.isPresent()) {
                check.evaluate(value.getAsDouble()).ifPresent(breaches::add);
            }
        }
        return new SafetyEvaluation(breaches);
    }
}
