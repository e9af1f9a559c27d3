package com.muts.ecu.safety;

import java.util.Objects;
import java.util.Optional;

/**
 * SafetyCheck
 * -----------------------------------------------------------------------------
 * Bounds for one {@link SafetyParameter}.
 *
 * <p>{@code min}/{@code max} are hard limits; a value outside them is always
 * critical. The warning and critical levels describe a direction: when
 * {@code criticalLevel >= warningLevel} the parameter is dangerous when it
 * rises (boost, knock, coolant), otherwise when it falls (AFR running lean is
 * the usual example).</p>
 *
 * @param min           hard lower limit, or {@code null}
 * @param max           hard upper limit, or {@code null}
 * @param warningLevel  level past which a warning is raised
 * @param criticalLevel level past which writes must stop
 * @param enabled       disabled checks never produce breaches
 */
public record SafetyCheck(
    SafetyParameter parameter,
    Double min,
    Double max,
    double warningLevel,
    double criticalLevel,
    boolean enabled
) {
    public SafetyCheck {
        Objects.requireNonNull(parameter, "parameter");
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min must be <= max for " + parameter);
        }
    }

    public static SafetyCheck rising(SafetyParameter parameter, double warning, double critical)
    {
        if (critical < warning) {
            throw new IllegalArgumentException("rising check needs critical >= warning");
        }
        return new SafetyCheck(parameter, null, null, warning, critical, true);
    }

    public static SafetyCheck falling(SafetyParameter parameter, double warning, double critical)
    {
        if (critical >= warning) {
            throw new IllegalArgumentException("falling check needs critical < warning");
        }
        return new SafetyCheck(parameter, null, null, warning, critical, true);
    }

    public SafetyCheck withLimits(Double min, Double max)
    {
        return new SafetyCheck(parameter, min, max, warningLevel, criticalLevel, enabled);
    }

    public SafetyCheck disabled()
    {
        return new SafetyCheck(parameter, min, max, warningLevel, criticalLevel, false);
    }

    public boolean isRising()
    {
        return criticalLevel >= warningLevel;
    }

    /**
     * Evaluates a single value. Critical conditions take precedence over
     * warnings.
     */
    public Optional<BoundBreach> evaluate(double value)
    {
        if (!enabled) {
            return Optional.empty();
        }
        if (min != null && value < min) {
            return Optional.of(new BoundBreach(parameter, BreachLevel.CRITICAL, value, min));
        }
        if (max != null && value > max) {
            return Optional.of(new BoundBreach(parameter, BreachLevel.CRITICAL, value, max));
        }

        if (isRising()) {
            if (value > criticalLevel) {
                return Optional.of(new BoundBreach(parameter, BreachLevel.CRITICAL, value, criticalLevel));
            }
            if (value > warningLevel) {
                return Optional.of(new BoundBreach(parameter, BreachLevel.WARNING, value, warningLevel));
            }
        } else {
            if (value < criticalLevel) {
                return Optional.of(new BoundBreach(parameter, BreachLevel.CRITICAL, value, criticalLevel));
            }
            if (value < warningLevel) {
                return Optional.of(new BoundBreach(parameter, BreachLevel.WARNING, value, warningLevel));
            }
        }
        return Optional.empty();
    }
}
