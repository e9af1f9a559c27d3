package com.muts.ecu.store;

/**
 * Enqueue path for commands produced by the pipeline itself (follow-up
 * steps, polling and sweep timers). Bypasses authorization; the external
 * command that started the work was already authorized.
 */
@FunctionalInterface
public interface InternalCommandQueue
{
    Command enqueueInternal(String type, CommandPayload payload);
}
