package com.muts.ecu.safety.queue;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.muts.ecu.persistence.PersistenceFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JournalSafetyEventStore
 * =============================================================================
 * Crash-safe {@link SafetyEventStore} backed by an append-only JSON-lines
 * journal.
 *
 * <h2>Durability</h2>
 * Every mutation is written as one journal line and forced to the storage
 * device before the method returns. An append that cannot be forced throws
 * {@link PersistenceFailureException} and the event is not considered to
 * have happened.
 *
 * <h2>Recovery</h2>
 * The journal is replayed on construction. A torn final line (crash during a
 * write) is truncated away with a warning before the journal is reopened for
 * appending; every fully written entry is restored, so undelivered events
 * survive restarts and are delivered again. A failed write is rolled back to
 * the previous journal length.
 *
 * <h2>Compaction</h2>
 * {@link #deleteDeliveredBefore(Instant)} rewrites the journal as one
 * {@code APPEND} entry per remaining event and atomically replaces the old
 * file.
 */
public final class JournalSafetyEventStore implements SafetyEventStore, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(JournalSafetyEventStore.class);

    enum Op { APPEND, DELIVERED, ATTEMPT }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record JournalEntry(Op op, SafetyEvent event, List<String> ids, Instant at) {}

    private final Path journal;
    private final ObjectMapper mapper;
    private final InMemorySafetyEventStore index = new InMemorySafetyEventStore();

    private FileChannel channel;

    /**
     * Opens (or creates) the journal and replays it.
     *
     * @throws PersistenceFailureException if the journal cannot be opened or read
     */
    public JournalSafetyEventStore(Path journal)
    {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        try {
            Path parent = journal.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(journal)) {
                replay();
            }
            this.channel = openForAppend(journal);
        } catch (IOException e) {
            throw new PersistenceFailureException("Cannot open safety event journal " + journal, e);
        }
    }

    private void replay() throws IOException
    {
        byte[] content = Files.readAllBytes(journal);
        int restored = 0;
        int lineNo = 0;
        int start = 0;
        int end;
        while ((end = indexOf(content, (byte) '\n', start)) >= 0) {
            lineNo++;
            String line = new String(content, start, end - start, StandardCharsets.UTF_8);
            start = end + 1;
            if (line.isBlank()) {
                continue;
            }
            JournalEntry entry;
            try {
                entry = mapper.readValue(line, JournalEntry.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable journal line {} in {}: {}", lineNo, journal, e.getOriginalMessage());
                continue;
            }
            applyToIndex(entry);
            restored++;
        }

        // Unterminated tail from an interrupted write; appends must start on a fresh line.
        if (start < content.length) {
            log.warn("Truncating {} bytes of torn journal tail in {}", content.length - start, journal);
            try (FileChannel ch = FileChannel.open(journal, StandardOpenOption.WRITE)) {
                ch.truncate(start);
                ch.force(true);
            }
        }
        log.info("Replayed {} journal entries from {} ({} undelivered events)",
            restored, journal, index.findUndelivered(Integer.MAX_VALUE, Integer.MAX_VALUE).size());
    }

    private static int indexOf(byte[] bytes, byte b, int from)
    {
        for (int i = from; i < bytes.length; i++) {
            if (bytes[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private void applyToIndex(JournalEntry entry)
    {
        switch (entry.op()) {
            case APPEND:
                if (index.find(entry.event().id()).isEmpty()) {
                    index.append(entry.event());
                }
                break;
            case DELIVERED:
                index.markDelivered(entry.ids(), entry.at());
                break;
            case ATTEMPT:
                index.incrementAttempts(entry.ids());
                break;
            default:
                log.warn("Ignoring journal entry with unknown op {}", entry.op());
        }
    }

    private static FileChannel openForAppend(Path path) throws IOException
    {
        return FileChannel.open(path,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private void write(JournalEntry entry)
    {
        byte[] line;
        try {
            line = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new PersistenceFailureException("Cannot serialize journal entry (" + entry.op() + ")", e);
        }

        long before = -1;
        try {
            before = channel.size();
            ByteBuffer buf = ByteBuffer.wrap(line);
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
            channel.force(true);
        } catch (IOException e) {
            PersistenceFailureException failure =
                new PersistenceFailureException("Safety event journal write failed (" + entry.op() + ")", e);
            if (before >= 0) {
                try {
                    channel.truncate(before);
                } catch (IOException rollback) {
                    failure.addSuppressed(rollback);
                }
            }
            throw failure;
        }
    }

    @Override
    public synchronized void append(SafetyEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (index.find(event.id()).isPresent()) {
            throw new IllegalArgumentException("duplicate safety event id " + event.id());
        }
        write(new JournalEntry(Op.APPEND, event, null, null));
        index.append(event);
    }

    @Override
    public synchronized List<SafetyEvent> findUndelivered(int maxAttempts, int limit)
    {
        return index.findUndelivered(maxAttempts, limit);
    }

    @Override
    public synchronized List<SafetyEvent> findExhausted(int maxAttempts)
    {
        return index.findExhausted(maxAttempts);
    }

    @Override
    public synchronized Optional<SafetyEvent> find(String id)
    {
        return index.find(id);
    }

    @Override
    public synchronized List<SafetyEvent> findAll()
    {
        return index.findAll();
    }

    @Override
    public synchronized void markDelivered(Collection<String> ids, Instant deliveredAt)
    {
        if (ids.isEmpty()) {
            return;
        }
        write(new JournalEntry(Op.DELIVERED, null, List.copyOf(ids), deliveredAt));
        index.markDelivered(ids, deliveredAt);
    }

    @Override
    public synchronized void incrementAttempts(Collection<String> ids)
    {
        if (ids.isEmpty()) {
            return;
        }
        write(new JournalEntry(Op.ATTEMPT, null, List.copyOf(ids), null));
        index.incrementAttempts(ids);
    }

    @Override
    public synchronized int deleteDeliveredBefore(Instant cutoff)
    {
        int removed = index.deleteDeliveredBefore(cutoff);
        if (removed > 0) {
            compact();
        }
        return removed;
    }

    private void compact()
    {
        Path tmp = journal.resolveSibling(journal.getFileName() + ".compact");
        try {
            List<String> lines = new ArrayList<>();
            for (SafetyEvent e : index.findAll()) {
                lines.add(mapper.writeValueAsString(new JournalEntry(Op.APPEND, e, null, null)));
            }
            try (FileChannel out = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(
                    (String.join("\n", lines) + (lines.isEmpty() ? "" : "\n")).getBytes(StandardCharsets.UTF_8));
                while (buf.hasRemaining()) {
                    out.write(buf);
                }
                out.force(true);
            }
            channel.close();
            Files.move(tmp, journal, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            channel = openForAppend(journal);
            log.debug("Compacted safety event journal {} to {} events", journal, lines.size());
        } catch (IOException e) {
            throw new PersistenceFailureException("Safety event journal compaction failed", e);
        }
    }

    @Override
    public synchronized void close() throws IOException
    {
        channel.close();
    }
}
