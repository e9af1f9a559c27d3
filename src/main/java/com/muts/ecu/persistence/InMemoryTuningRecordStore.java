package com.muts.ecu.persistence;

import com.muts.ecu.flash.FlashImage;
import com.muts.ecu.flash.FlashJob;
import com.muts.ecu.safety.SafetyCheckProfile;
import com.muts.ecu.safety.SafetySnapshot;
import com.muts.ecu.session.TuningApplySession;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Map-backed {@link TuningRecordStore} enforcing the same references and
 * cascades a relational schema would.
 */
public class InMemoryTuningRecordStore implements TuningRecordStore
{
    private final Map<String, TuningApplySession> sessions = new LinkedHashMap<>();
    private final Map<String, List<SafetySnapshot>> snapshots = new HashMap<>();
    private final Map<String, SafetyCheckProfile> profiles = new HashMap<>();
    private final Map<String, FlashJob> jobs = new LinkedHashMap<>();
    private final Map<String, FlashImage> images = new HashMap<>();
    private final Map<String, byte[]> backups = new HashMap<>();

    public InMemoryTuningRecordStore()
    {
        profiles.put(SafetyCheckProfile.DEFAULT_ID, SafetyCheckProfile.defaultProfile());
    }

    @Override
    public synchronized void saveSession(TuningApplySession session)
    {
        Objects.requireNonNull(session, "session");
        sessions.put(session.id(), session);
    }

    @Override
    public synchronized Optional<TuningApplySession> findSession(String id)
    {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public synchronized List<TuningApplySession> findSessions()
    {
        return new ArrayList<>(sessions.values());
    }

    @Override
    public synchronized boolean deleteSession(String id)
    {
        if (sessions.remove(id) == null) {
            return false;
        }
        snapshots.remove(id);
        List<String> jobIds = jobs.values().stream()
            .filter(j -> j.sessionId().equals(id))
            .map(FlashJob::id)
            .collect(Collectors.toList());
        for (String jobId : jobIds) {
            jobs.remove(jobId);
            images.remove(jobId);
            backups.remove(jobId);
        }
        return true;
    }

    @Override
    public synchronized void saveSnapshot(SafetySnapshot snapshot)
    {
        Objects.requireNonNull(snapshot, "snapshot");
        requireSession(snapshot.sessionId());
        snapshots.computeIfAbsent(snapshot.sessionId(), k -> new ArrayList<>()).add(snapshot);
    }

    @Override
    public synchronized List<SafetySnapshot> findSnapshots(String sessionId)
    {
        return List.copyOf(snapshots.getOrDefault(sessionId, List.of()));
    }

    @Override
    public synchronized void saveProfile(SafetyCheckProfile profile)
    {
        Objects.requireNonNull(profile, "profile");
        profiles.put(profile.id(), profile);
    }

    @Override
    public synchronized Optional<SafetyCheckProfile> findProfile(String id)
    {
        return Optional.ofNullable(profiles.get(id));
    }

    @Override
    public synchronized void saveFlashJob(FlashJob job)
    {
        Objects.requireNonNull(job, "job");
        requireSession(job.sessionId());
        jobs.put(job.id(), job);
    }

    @Override
    public synchronized Optional<FlashJob> findFlashJob(String id)
    {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized List<FlashJob> findFlashJobsByEngine(String engineId)
    {
        return jobs.values().stream()
            .filter(j -> j.engineId().equals(engineId))
            .sorted(Comparator.comparing(FlashJob::updatedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void saveFlashImage(String jobId, FlashImage image)
    {
        Objects.requireNonNull(image, "image");
        requireJob(jobId);
        images.put(jobId, image);
    }

    @Override
    public synchronized Optional<FlashImage> findFlashImage(String jobId)
    {
        return Optional.ofNullable(images.get(jobId));
    }

    @Override
    public synchronized void saveBackup(String jobId, byte[] backup)
    {
        Objects.requireNonNull(backup, "backup");
        requireJob(jobId);
        backups.put(jobId, backup.clone());
    }

    @Override
    public synchronized Optional<byte[]> findBackup(String jobId)
    {
        byte[] b = backups.get(jobId);
        return b == null ? Optional.empty() : Optional.of(b.clone());
    }

    private void requireSession(String sessionId)
    {
        if (!sessions.containsKey(sessionId)) {
            throw new PersistenceFailureException("No tuning apply session " + sessionId);
        }
    }

    private void requireJob(String jobId)
    {
        if (!jobs.containsKey(jobId)) {
            throw new PersistenceFailureException("No flash job " + jobId);
        }
    }
}
