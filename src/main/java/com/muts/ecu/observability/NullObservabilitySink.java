package com.muts.ecu.observability;

/**
 * No-op implementation of PipelineObservabilitySink.
 */
public final class NullObservabilitySink implements PipelineObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onFlashTransition(FlashTransitionEvent event) {}

    @Override
    public void onQueueAlarm(QueueHealthAlarm alarm) {}

    @Override
    public void onError(PipelineErrorEvent event) {}
}
