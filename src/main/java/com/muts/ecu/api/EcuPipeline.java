package com.muts.ecu.api;

import com.muts.ecu.store.ApplicationState;
import com.muts.ecu.store.Command;
import com.muts.ecu.store.CommandPayload;
import com.muts.ecu.store.StateChannel;

import java.util.Map;
import java.util.function.Consumer;

/**
 * EcuPipeline
 * =============================================================================
 * The only mutation and observation surface exposed to outer layers
 * (HTTP/WebSocket routes, operator consoles).
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #enqueueCommand} authorizes the command against the operator
 *       mode, appends it to the FIFO command queue and returns immediately.
 *       A policy denial is thrown synchronously as
 *       {@link PolicyDeniedException}; every other failure is reported
 *       asynchronously as a state transition.</li>
 *   <li>{@link #subscribe} registers for one state slice and immediately
 *       receives its current value.</li>
 *   <li>{@link #getState()} returns an immutable snapshot.</li>
 * </ul>
 */
public interface EcuPipeline
{
    /**
     * Authorizes and enqueues a command.
     *
     * @return the accepted command (its id can be correlated with observability events)
     * @throws PolicyDeniedException if the operator mode forbids the command
     */
    Command enqueueCommand(String type, CommandPayload payload);

    /**
     * Convenience overload taking a raw payload map.
     */
    default Command enqueueCommand(String type, Map<String, ?> payload)
    {
        return enqueueCommand(type, CommandPayload.of(payload));
    }

    /**
     * Subscribes to a state slice. The callback receives the current value
     * before this method returns and then every subsequent change.
     */
    <T> Subscription subscribe(StateChannel<T> channel, Consumer<? super T> callback);

    /**
     * Returns the current immutable application state.
     */
    ApplicationState getState();
}
