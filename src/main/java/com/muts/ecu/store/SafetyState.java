package com.muts.ecu.store;

import com.muts.ecu.safety.queue.SafetyEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Safety slice of {@link ApplicationState}.
 *
 * @param lastEvent most recent safety event recorded by the processor, or {@code null}
 */
public record SafetyState(boolean armed, SafetyLevel level, SafetyEvent lastEvent)
{
    public SafetyState {
        Objects.requireNonNull(level, "level");
    }

    public static SafetyState disarmed()
    {
        return new SafetyState(false, SafetyLevel.READ_ONLY, null);
    }

    public Optional<SafetyEvent> last()
    {
        return Optional.ofNullable(lastEvent);
    }

    public SafetyState withArming(boolean value, SafetyLevel newLevel)
    {
        return new SafetyState(value, newLevel, lastEvent);
    }

    public SafetyState withLastEvent(SafetyEvent event)
    {
        return new SafetyState(armed, level, event);
    }

    /**
     * The system is armed at {@code required} or higher.
     */
    public boolean permits(SafetyLevel required)
    {
        return armed && level.atLeast(required);
    }
}
