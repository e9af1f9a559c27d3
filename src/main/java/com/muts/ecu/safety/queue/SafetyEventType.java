package com.muts.ecu.safety.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Safety-relevant occurrences that must be delivered at least once.
 */
public enum SafetyEventType
{
    VIOLATION("violation"),
    SESSION_CREATED("sessionCreated"),
    SESSION_EXPIRED("sessionExpired"),
    SESSION_ARMED("sessionArmed"),
    SESSION_APPLIED("sessionApplied");

    private final String wireName;

    SafetyEventType(String wireName)
    {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName()
    {
        return wireName;
    }

    @JsonCreator
    public static SafetyEventType fromWireName(String wireName)
    {
        for (SafetyEventType t : values()) {
            if (t.wireName.equals(wireName)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown safety event type: " + wireName);
    }
}
