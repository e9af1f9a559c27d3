package com.muts.ecu.observability;

import com.muts.ecu.api.FailureKind;
import com.muts.ecu.store.Command;

import java.time.Instant;

/**
 * A command was dropped or rejected inside the processor.
 */
public record CommandRejectedEvent(
    Instant timestamp,
    Command command,
    FailureKind kind,
    String reason
) {
}
