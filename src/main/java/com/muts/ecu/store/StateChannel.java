package com.muts.ecu.store;

import com.muts.ecu.session.TuningApplySession;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed name of one slice of {@link ApplicationState} that can be subscribed
 * to independently.
 *
 * @param <T> slice type
 */
public final class StateChannel<T>
{
    public static final StateChannel<ConnectionState> CONNECTION =
        new StateChannel<>("connection", ApplicationState::connection);
    public static final StateChannel<TelemetryState> TELEMETRY =
        new StateChannel<>("telemetry", ApplicationState::telemetry);
    public static final StateChannel<DiagnosticsState> DIAGNOSTICS =
        new StateChannel<>("diagnostics", ApplicationState::diagnostics);
    public static final StateChannel<FlashState> FLASH =
        new StateChannel<>("flash", ApplicationState::flash);
    public static final StateChannel<SafetyState> SAFETY =
        new StateChannel<>("safety", ApplicationState::safety);
    public static final StateChannel<Map<String, TuningApplySession>> SESSIONS =
        new StateChannel<>("sessions", ApplicationState::sessions);

    private static final List<StateChannel<?>> VALUES =
        List.of(CONNECTION, TELEMETRY, DIAGNOSTICS, FLASH, SAFETY, SESSIONS);

    private final String name;
    private final Function<ApplicationState, T> extractor;

    private StateChannel(String name, Function<ApplicationState, T> extractor)
    {
        this.name = name;
        this.extractor = extractor;
    }

    public static List<StateChannel<?>> values()
    {
        return VALUES;
    }

    public String name()
    {
        return name;
    }

    public T extract(ApplicationState state)
    {
        return extractor.apply(state);
    }

    public boolean changed(ApplicationState before, ApplicationState after)
    {
        return !Objects.equals(extract(before), extract(after));
    }

    @Override
    public String toString()
    {
        return name;
    }
}
