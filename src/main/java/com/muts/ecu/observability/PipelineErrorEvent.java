package com.muts.ecu.observability;

import java.time.Instant;

/**
 * Record representing an error in the pipeline.
 */
public record PipelineErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
