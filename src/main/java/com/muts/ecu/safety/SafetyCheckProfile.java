package com.muts.ecu.safety;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named set of {@link SafetyCheck}s applied during a tuning-apply session.
 *
 * @param supportsRevert whether applied changes can be written back
 *                       automatically after a failure
 */
public record SafetyCheckProfile(
    String id,
    String name,
    Map<SafetyParameter, SafetyCheck> checks,
    boolean supportsRevert
) {
    public static final String DEFAULT_ID = "default";

    public SafetyCheckProfile {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(checks, "checks");
        EnumMap<SafetyParameter, SafetyCheck> copy = new EnumMap<>(SafetyParameter.class);
        copy.putAll(checks);
        checks = Collections.unmodifiableMap(copy);
    }

    public static SafetyCheckProfile of(String id, String name, boolean supportsRevert, Collection<SafetyCheck> checks)
    {
        EnumMap<SafetyParameter, SafetyCheck> byParameter = new EnumMap<>(SafetyParameter.class);
        for (SafetyCheck c : checks) {
            if (byParameter.put(c.parameter(), c) != null) {
                throw new IllegalArgumentException("duplicate check for " + c.parameter());
            }
        }
        return new SafetyCheckProfile(id, name, byParameter, supportsRevert);
    }

    /**
     * Conservative street-engine thresholds.
     */
    public static SafetyCheckProfile defaultProfile()
    {
        return of(DEFAULT_ID, "Default street profile", true, List.of(
            SafetyCheck.rising(SafetyParameter.KNOCK, 10, 20),
            SafetyCheck.rising(SafetyParameter.BOOST, 25, 30),
            SafetyCheck.rising(SafetyParameter.COOLANT, 110, 120),
            SafetyCheck.falling(SafetyParameter.AFR, 12.0, 10.5)
        ));
    }
}
