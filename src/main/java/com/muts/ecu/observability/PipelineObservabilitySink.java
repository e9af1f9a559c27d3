package com.muts.ecu.observability;

/**
 * Receives operational events from the ECU pipeline.
 * Implementations can provide logging, metrics, or audit forwarding.
 *
 * <p>Callbacks run on the thread that produced the event (the command
 * processor or the safety queue delivery loop) and must not block.</p>
 */
public interface PipelineObservabilitySink {
    /**
     * Called after a command changed at least one state channel.
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called when the processor rejected or dropped a command.
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called on every tuning-apply session status change.
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called on every flash job state change.
     */
    void onFlashTransition(FlashTransitionEvent event);

    /**
     * Called when the safety event queue can no longer deliver or persist.
     */
    void onQueueAlarm(QueueHealthAlarm alarm);

    /**
     * Called when an unexpected error occurs anywhere in the pipeline.
     */
    void onError(PipelineErrorEvent event);
}
