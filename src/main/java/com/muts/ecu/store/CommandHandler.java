package com.muts.ecu.store;

/**
 * Executes one command type on the processor thread.
 *
 * <p>A handler is synchronous from the queue's point of view: the next
 * command starts only after it returns. It may block on hardware futures via
 * {@link CommandContext#await}.</p>
 */
@FunctionalInterface
public interface CommandHandler
{
    void handle(Command command, CommandContext context);
}
