package com.muts.ecu.flash;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one flash job.
 *
 * @param sessionId         the tuning-apply session (mode FLASH) this job belongs to
 * @param progress          0..100
 * @param checksumOk        image SHA-256 matched the declared digest
 * @param validationOk      image passed size validation
 * @param errorMessage      {@code null} unless FAILED or ABORTED
 * @param rollbackAvailable a pre-flash backup of the target region is stored
 */
public record FlashJob(
    String id,
    String engineId,
    String sessionId,
    FlashJobState state,
    int progress,
    boolean checksumOk,
    boolean validationOk,
    String errorMessage,
    boolean rollbackAvailable,
    int blocksCompleted,
    int totalBlocks,
    Instant createdAt,
    Instant updatedAt
) {
    public FlashJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(engineId, "engineId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100");
        }
        if (blocksCompleted < 0 || blocksCompleted > totalBlocks) {
            throw new IllegalArgumentException("blocksCompleted out of range");
        }
    }

    public static FlashJob prepared(String id, String engineId, String sessionId,
                                    boolean checksumOk, boolean validationOk,
                                    int totalBlocks, Instant now)
    {
        return new FlashJob(id, engineId, sessionId, FlashJobState.PREPARED, 0, checksumOk, validationOk,
            null, false, 0, totalBlocks, now, now);
    }

    FlashJob withState(FlashJobState value, Instant now)
    {
        return new FlashJob(id, engineId, sessionId, value, progress, checksumOk, validationOk,
            errorMessage, rollbackAvailable, blocksCompleted, totalBlocks, createdAt, now);
    }

    FlashJob withError(String value)
    {
        return new FlashJob(id, engineId, sessionId, state, progress, checksumOk, validationOk,
            value, rollbackAvailable, blocksCompleted, totalBlocks, createdAt, updatedAt);
    }

    FlashJob withBlocksCompleted(int value)
    {
        int pct = totalBlocks == 0 ? 100 : (int) ((long) value * 100 / totalBlocks);
        return new FlashJob(id, engineId, sessionId, state, pct, checksumOk, validationOk,
            errorMessage, rollbackAvailable, value, totalBlocks, createdAt, updatedAt);
    }

    FlashJob withRollbackAvailable(Instant now)
    {
        return new FlashJob(id, engineId, sessionId, state, progress, checksumOk, validationOk,
            errorMessage, true, blocksCompleted, totalBlocks, createdAt, now);
    }
}
