package com.muts.ecu.session;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TuningApplySession
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one tuning-apply session.
 *
 * <p>Transitions are computed by {@link ApplySessionReducer}; this record only
 * offers copy-with helpers. {@code changesetId}, {@code applyToken},
 * {@code expiresAt} and {@code revertReason} are {@code null} when absent.</p>
 *
 * @param tokenIssuedAt when {@code applyToken} was issued
 * @param profileId     safety check profile evaluated during APPLYING
 * @param changes       changes requested by the current apply, in write order
 * @param appliedCount  how many of {@code changes} were written successfully
 */
public record TuningApplySession(
    String id,
    String vehicleSessionId,
    String changesetId,
    ApplyMode mode,
    boolean armed,
    String applyToken,
    Instant tokenIssuedAt,
    Instant expiresAt,
    ApplySessionStatus status,
    String revertReason,
    String profileId,
    List<ParameterChange> changes,
    int appliedCount,
    Instant createdAt,
    Instant updatedAt
) {
    public TuningApplySession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vehicleSessionId, "vehicleSessionId");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(profileId, "profileId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        changes = changes == null ? List.of() : List.copyOf(changes);
        if (appliedCount < 0 || appliedCount > changes.size()) {
            throw new IllegalArgumentException("appliedCount out of range");
        }
    }

    public static TuningApplySession pending(String id,
                                             String vehicleSessionId,
                                             String changesetId,
                                             ApplyMode mode,
                                             String profileId,
                                             String applyToken,
                                             Instant now)
    {
        return new TuningApplySession(id, vehicleSessionId, changesetId, mode, false, applyToken, now,
            null, ApplySessionStatus.PENDING, null, profileId, List.of(), 0, now, now);
    }

    public Optional<Instant> expiry()
    {
        return Optional.ofNullable(expiresAt);
    }

    /**
     * A session with an expiry is expired from {@code expiresAt} onwards.
     */
    public boolean isExpiredAt(Instant now)
    {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public Optional<ParameterChange> nextChange()
    {
        return appliedCount < changes.size() ? Optional.of(changes.get(appliedCount)) : Optional.empty();
    }

    TuningApplySession transition(ApplySessionStatus newStatus, boolean newArmed, Instant now)
    {
        return new TuningApplySession(id, vehicleSessionId, changesetId, mode, newArmed, applyToken, tokenIssuedAt,
            expiresAt, newStatus, revertReason, profileId, changes, appliedCount, createdAt, now);
    }

    TuningApplySession withExpiresAt(Instant value)
    {
        return new TuningApplySession(id, vehicleSessionId, changesetId, mode, armed, applyToken, tokenIssuedAt,
            value, status, revertReason, profileId, changes, appliedCount, createdAt, updatedAt);
    }

    TuningApplySession withChanges(List<ParameterChange> value, int applied)
    {
        return new TuningApplySession(id, vehicleSessionId, changesetId, mode, armed, applyToken, tokenIssuedAt,
            expiresAt, status, revertReason, profileId, value, applied, createdAt, updatedAt);
    }

    /**
     * Replaces the revert reason, for instance to append the outcome of an
     * automatic revert.
     */
    public TuningApplySession withRevertReason(String value, Instant now)
    {
        return new TuningApplySession(id, vehicleSessionId, changesetId, mode, armed, applyToken, tokenIssuedAt,
            expiresAt, status, value, profileId, changes, appliedCount, createdAt, now);
    }
}
