package com.muts.ecu.safety;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of evaluating one reading against a profile.
 */
public record SafetyEvaluation(List<BoundBreach> breaches)
{
    public SafetyEvaluation {
        breaches = List.copyOf(breaches);
    }

    public static SafetyEvaluation clean()
    {
        return new SafetyEvaluation(List.of());
    }

    public boolean isCritical()
    {
        return breaches.stream().anyMatch(BoundBreach::isCritical);
    }

    public Optional<BoundBreach> firstCritical()
    {
        return breaches.stream().filter(BoundBreach::isCritical).findFirst();
    }

    public List<BoundBreach> warnings()
    {
        return breaches.stream().filter(b -> !b.isCritical()).collect(Collectors.toList());
    }
}
