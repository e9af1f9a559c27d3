package com.muts.ecu.store;

import java.time.Instant;
import java.util.Objects;

/**
 * A request to mutate pipeline state. Created by any producer, consumed
 * exactly once by the {@link StateStore} processor and never mutated.
 *
 * @param sequence position in the command queue; strictly increasing in
 *                 enqueue order
 * @param internal enqueued by the pipeline itself (follow-up steps, timers)
 *                 rather than by an external producer
 */
public record Command(
    String id,
    String type,
    CommandPayload payload,
    Instant enqueuedAt,
    long sequence,
    boolean internal
) {
    public Command {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }
}
