package com.muts.ecu.observability;

import com.muts.ecu.flash.FlashJobState;

import java.time.Instant;

/**
 * State or progress change of a flash job.
 */
public record FlashTransitionEvent(
    Instant timestamp,
    String jobId,
    FlashJobState from,
    FlashJobState to,
    int progress
) {
}
