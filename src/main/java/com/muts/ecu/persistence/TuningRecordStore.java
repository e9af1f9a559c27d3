package com.muts.ecu.persistence;

import com.muts.ecu.flash.FlashImage;
import com.muts.ecu.flash.FlashJob;
import com.muts.ecu.safety.SafetyCheckProfile;
import com.muts.ecu.safety.SafetySnapshot;
import com.muts.ecu.session.TuningApplySession;

import java.util.List;
import java.util.Optional;

/**
 * TuningRecordStore
 * =============================================================================
 * Persistence port for the records the pipeline reads and writes.
 *
 * <h2>Relationships</h2>
 * <ul>
 *   <li>A {@link SafetySnapshot} and a {@link FlashJob} reference exactly one
 *       {@link TuningApplySession}; saving one for an unknown session fails.</li>
 *   <li>Deleting a session cascades to its snapshots, flash jobs, images and
 *       backups.</li>
 * </ul>
 *
 * <p>Only atomic create/update-by-id and query-by-filter are assumed. Every
 * failure surfaces as {@link PersistenceFailureException}.</p>
 */
public interface TuningRecordStore
{
    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    void saveSession(TuningApplySession session);

    Optional<TuningApplySession> findSession(String id);

    List<TuningApplySession> findSessions();

    /**
     * Deletes a session and every record referencing it.
     *
     * @return {@code true} if the session existed
     */
    boolean deleteSession(String id);

    // ---------------------------------------------------------------------
    // Safety snapshots and profiles
    // ---------------------------------------------------------------------

    void saveSnapshot(SafetySnapshot snapshot);

    /**
     * Snapshots for a session in recording order.
     */
    List<SafetySnapshot> findSnapshots(String sessionId);

    void saveProfile(SafetyCheckProfile profile);

    Optional<SafetyCheckProfile> findProfile(String id);

    // ---------------------------------------------------------------------
    // Flash jobs
    // ---------------------------------------------------------------------

    void saveFlashJob(FlashJob job);

    Optional<FlashJob> findFlashJob(String id);

    /**
     * Jobs for an engine, most recently updated first.
     */
    List<FlashJob> findFlashJobsByEngine(String engineId);

    void saveFlashImage(String jobId, FlashImage image);

    Optional<FlashImage> findFlashImage(String jobId);

    void saveBackup(String jobId, byte[] backup);

    Optional<byte[]> findBackup(String jobId);
}
