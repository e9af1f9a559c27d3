package com.muts.ecu.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PipelineObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPipelineObservabilitySink implements PipelineObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPipelineObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        if (event.changed("connection")) {
            log.info("Connection: {} -> {}",
                event.oldState().connection().status(),
                event.newState().connection().status());
        }
        if (event.changed("safety")) {
            log.info("Safety: armed={} level={}",
                event.newState().safety().armed(),
                event.newState().safety().level());
        }
        log.debug("Command {} ({}) changed {}", event.command().id(), event.command().type(), event.changedChannels());
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        log.warn("Command {} ({}) rejected [{}]: {}",
            event.command().id(), event.command().type(), event.kind(), event.reason());
    }

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        log.info("Session {}: {} -> {} ({})", event.sessionId(), event.from(), event.to(), event.cause());
    }

    @Override
    public void onFlashTransition(FlashTransitionEvent event) {
        if (event.from() != event.to()) {
            log.info("Flash job {}: {} -> {} at {}%", event.jobId(), event.from(), event.to(), event.progress());
        } else {
            log.debug("Flash job {}: {}%", event.jobId(), event.progress());
        }
    }

    @Override
    public void onQueueAlarm(QueueHealthAlarm alarm) {
        log.error("Safety queue alarm: {} (event {})", alarm.message(), alarm.eventId());
    }

    @Override
    public void onError(PipelineErrorEvent event) {
        log.error("Pipeline error: {}", event.message(), event.cause());
    }
}
