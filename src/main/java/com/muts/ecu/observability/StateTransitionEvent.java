package com.muts.ecu.observability;

import com.muts.ecu.store.ApplicationState;
import com.muts.ecu.store.Command;

import java.time.Instant;
import java.util.Set;

/**
 * Record representing the effect of one command on the application state.
 *
 * @param changedChannels names of the state channels whose value changed
 */
public record StateTransitionEvent(
    Instant timestamp,
    Command command,
    ApplicationState oldState,
    ApplicationState newState,
    Set<String> changedChannels
) {
    public StateTransitionEvent {
        changedChannels = Set.copyOf(changedChannels);
    }

    public boolean changed(String channel) {
        return changedChannels.contains(channel);
    }
}
