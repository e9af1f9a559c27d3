package com.muts.ecu.store;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * View of the processor offered to a running {@link CommandHandler}.
 */
public interface CommandContext
{
    /**
     * Current state, including updates this handler already made.
     */
    ApplicationState state();

    /**
     * Replaces the state and notifies subscribers of the changed channels.
     */
    void update(UnaryOperator<ApplicationState> change);

    /**
     * Enqueues a follow-up command behind everything already queued.
     */
    Command enqueue(String type, CommandPayload payload);

    /**
     * Queue handle that outlives this command, for timers started by a handler.
     */
    InternalCommandQueue queue();

    /**
     * Wall clock time for this command's effects.
     */
    Instant now();

    /**
     * Blocks until the hardware future settles or the hardware timeout elapses.
     *
     * @throws com.muts.ecu.transport.TransportFailureException on failure, timeout or interrupt
     */
    <T> T await(CompletableFuture<T> future, String operation);
}
