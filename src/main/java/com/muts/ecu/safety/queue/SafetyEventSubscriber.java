package com.muts.ecu.safety.queue;

/**
 * Receives safety events from the delivery loop (UI bridge, audit log).
 *
 * <p>Returning normally acknowledges the event. Throwing counts as a failed
 * delivery attempt and the event is offered again after the retry delay.</p>
 */
@FunctionalInterface
public interface SafetyEventSubscriber
{
    void onSafetyEvent(SafetyEvent event) throws Exception;
}
