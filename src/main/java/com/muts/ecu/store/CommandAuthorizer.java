package com.muts.ecu.store;

/**
 * Synchronous gate consulted before an external command is enqueued.
 */
@FunctionalInterface
public interface CommandAuthorizer
{
    CommandAuthorizer ALLOW_ALL = (type, payload) -> {};

    /**
     * @throws com.muts.ecu.api.PolicyDeniedException if the command must not be enqueued
     */
    void authorize(String type, CommandPayload payload);
}
