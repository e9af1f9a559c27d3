package com.muts.ecu.safety.queue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JournalSafetyEventStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    @TempDir
    Path dir;

    private static SafetyEvent event(String id, Instant at) {
        return SafetyEvent.pending(id, SafetyEventType.VIOLATION, Map.of("sessionId", "s1", "cause", "safety_bound"), at);
    }

    @Test
    void eventsSurviveReopen() throws Exception {
        Path journal = dir.resolve("safety.journal");
        try (JournalSafetyEventStore store = new JournalSafetyEventStore(journal)) {
            store.append(event("e1", T0));
            store.append(event("e2", T0.plusSeconds(1)));
            store.markDelivered(List.of("e1"), T0.plusSeconds(5));
            store.incrementAttempts(List.of("e2"));
        }

        try (JournalSafetyEventStore reopened = new JournalSafetyEventStore(journal)) {
            SafetyEvent e1 = reopened.find("e1").orElseThrow();
            SafetyEvent e2 = reopened.find("e2").orElseThrow();

            assertTrue(e1.delivered());
            assertEquals(T0.plusSeconds(5), e1.deliveredAt());
            assertFalse(e2.delivered());
            assertEquals(1, e2.deliveryAttempts());
            assertEquals("safety_bound", e2.payload().get("cause"));
            assertEquals(List.of("e2"), reopened.findUndelivered(3, 10).stream().map(SafetyEvent::id).toList());
        }
    }

    @Test
    void tornTrailingLineIsSkippedOnReplay() throws Exception {
        Path journal = dir.resolve("safety.journal");
        try (JournalSafetyEventStore store = new JournalSafetyEventStore(journal)) {
            store.append(event("e1", T0));
        }
        Files.writeString(journal, "{\"op\":\"APPEND\",\"event\":{\"id\":\"e2\"", StandardCharsets.UTF_8,
            StandardOpenOption.APPEND);

        try (JournalSafetyEventStore reopened = new JournalSafetyEventStore(journal)) {
            assertEquals(1, reopened.findAll().size());
            assertTrue(reopened.find("e1").isPresent());
        }
    }

    @Test
    void appendAfterTornLineSurvivesTheNextRestart() throws Exception {
        Path journal = dir.resolve("safety.journal");
        try (JournalSafetyEventStore store = new JournalSafetyEventStore(journal)) {
            store.append(event("e1", T0));
        }
        Files.writeString(journal, "{\"op\":\"APPEND\",\"event\":{\"id\":\"e2\"", StandardCharsets.UTF_8,
            StandardOpenOption.APPEND);

        try (JournalSafetyEventStore recovered = new JournalSafetyEventStore(journal)) {
            recovered.append(event("e3", T0.plusSeconds(2)));
            recovered.incrementAttempts(List.of("e3"));
        }

        try (JournalSafetyEventStore reopened = new JournalSafetyEventStore(journal)) {
            assertEquals(List.of("e1", "e3"), reopened.findAll().stream().map(SafetyEvent::id).toList());
            assertEquals(1, reopened.find("e3").orElseThrow().deliveryAttempts());
        }
        assertTrue(Files.readString(journal).endsWith("\n"));
        assertFalse(Files.readString(journal).contains("\"e2\""));
    }

    @Test
    void cleanupCompactsTheJournal() throws Exception {
        Path journal = dir.resolve("safety.journal");
        try (JournalSafetyEventStore store = new JournalSafetyEventStore(journal)) {
            store.append(event("old", T0));
            store.append(event("kept", T0));
            store.markDelivered(List.of("old"), T0);

            assertEquals(1, store.deleteDeliveredBefore(T0.plus(Duration.ofDays(8))));
            store.append(event("after", T0.plusSeconds(10)));
        }

        try (JournalSafetyEventStore reopened = new JournalSafetyEventStore(journal)) {
            assertTrue(reopened.find("old").isEmpty());
            assertTrue(reopened.find("kept").isPresent());
            assertTrue(reopened.find("after").isPresent());
        }
        assertFalse(Files.readString(journal).contains("\"old\""));
    }
}
