package com.openforge.scanmate.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.PropertiesFixture;
import com.openforge.scanmate.config.JacksonConfig;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import com.openforge.scanmate.task.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileSessionStoreTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private JsonFileSessionStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileSessionStore(objectMapper, PropertiesFixture.builder()
                .dataDir(dataDir)
                .maxMemoryTurns(3)
                .maxScanHistory(2)
                .reportLimit(60)
                .build());
    }

    @Test
    @DisplayName("Unknown users start with empty logs and no files are created by reading")
    void load_unknownUserIsEmpty() {
        assertTrue(store.loadConversation("nobody").isEmpty());
        assertTrue(store.loadScans("nobody").isEmpty());
        assertFalse(Files.exists(dataDir.resolve("conversations")));
    }

    @Test
    @DisplayName("Conversation keeps only the most recent 2 x max-memory-turns entries in order")
    void appendExchange_trimsToMostRecentTurns() {
        for (int i = 1; i <= 10; i++) {
            store.appendExchange("alice", ConversationTurn.user("q" + i), ConversationTurn.assistant("a" + i));
            assertTrue(store.loadConversation("alice").size() <= 6);
        }

        List<ConversationTurn> history = store.loadConversation("alice");
        assertEquals(List.of(
                ConversationTurn.user("q8"), ConversationTurn.assistant("a8"),
                ConversationTurn.user("q9"), ConversationTurn.assistant("a9"),
                ConversationTurn.user("q10"), ConversationTurn.assistant("a10")), history);
    }

    @Test
    void appendExchange_rejectsAnythingButAUserAssistantPair() {
        assertThrows(IllegalArgumentException.class, () -> store.appendExchange("alice",
                ConversationTurn.assistant("a"), ConversationTurn.user("q")));
        assertTrue(store.loadConversation("alice").isEmpty());
    }

    @Test
    @DisplayName("Scan history evicts oldest first and caps report text at a sentence boundary")
    void appendScan_evictsOldestAndCapsReport() {
        for (int i = 1; i <= 4; i++) {
            store.appendScan("alice", record("https://site" + i + ".example", "Report " + i + "."));
        }
        store.appendScan("alice", record("https://long.example",
                "First sentence is here. Second sentence is here. Third sentence overflows the cap."));

        List<ScanRecord> scans = store.loadScans("alice");
        assertEquals(2, scans.size());
        assertEquals("https://site4.example", scans.get(0).page());
        assertEquals("https://long.example", scans.get(1).page());
        assertEquals("First sentence is here. Second sentence is here.", scans.get(1).result());
    }

    @Test
    @DisplayName("Deleting a user entry followed by its answer removes both")
    void deleteTurn_removesPair() {
        store.appendExchange("alice", ConversationTurn.user("q1"), ConversationTurn.assistant("a1"));
        store.appendExchange("alice", ConversationTurn.user("q2"), ConversationTurn.assistant("a2"));

        List<ConversationTurn> remaining = store.deleteTurn("alice", 0);

        assertEquals(List.of(ConversationTurn.user("q2"), ConversationTurn.assistant("a2")), remaining);
        assertEquals(remaining, store.loadConversation("alice"));
    }

    @Test
    void deleteTurn_assistantEntryIsRemovedAlone() {
        store.appendExchange("alice", ConversationTurn.user("q1"), ConversationTurn.assistant("a1"));

        List<ConversationTurn> remaining = store.deleteTurn("alice", 1);

        assertEquals(List.of(ConversationTurn.user("q1")), remaining);
    }

    @Test
    @DisplayName("Out-of-bounds delete is a validation error and leaves history unchanged")
    void deleteTurn_outOfBoundsLeavesHistoryUnchanged() {
        store.appendExchange("alice", ConversationTurn.user("q1"), ConversationTurn.assistant("a1"));
        List<ConversationTurn> before = store.loadConversation("alice");

        ValidationException e = assertThrows(ValidationException.class, () -> store.deleteTurn("alice", 2));
        assertThrows(ValidationException.class, () -> store.deleteTurn("alice", -1));

        assertEquals("Invalid index 2", e.getMessage());
        assertEquals(before, store.loadConversation("alice"));
    }

    @Test
    void clearConversation_emptiesHistory() {
        store.appendExchange("alice", ConversationTurn.user("q1"), ConversationTurn.assistant("a1"));

        store.clearConversation("alice");

        assertTrue(store.loadConversation("alice").isEmpty());
    }

    @Test
    @DisplayName("Stored files are plain JSON arrays with snake_case fields")
    void files_useReadableJson() throws Exception {
        store.appendExchange("alice", ConversationTurn.user("q1"), ConversationTurn.assistant("a1"));
        store.appendScan("alice", new ScanRecord("https://a.example", "No", 200, "Threat Level: Safe.",
                Instant.parse("2026-01-02T03:04:05Z")));

        JsonNode conversation = objectMapper.readTree(dataDir.resolve("conversations/alice.json").toFile());
        JsonNode scans = objectMapper.readTree(dataDir.resolve("scan_pages/alice.json").toFile());

        assertEquals("user", conversation.get(0).get("role").asText());
        assertFalse(conversation.get(0).has("user"));
        assertEquals(200, scans.get(0).get("status_code").asInt());
        assertEquals("2026-01-02T03:04:05Z", scans.get(0).get("scanned_at").asText());
    }

    @Test
    @DisplayName("Concurrent writers for the same user never lose an update")
    void appendScan_concurrentWritersAreSerialized() throws Exception {
        JsonFileSessionStore wideStore = new JsonFileSessionStore(objectMapper, PropertiesFixture.builder()
                .dataDir(dataDir)
                .maxScanHistory(100)
                .build());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            IntStream.range(0, 40).forEach(i -> futures.add(pool.submit(() -> {
                start.await();
                wideStore.appendScan("alice", record("https://p" + i + ".example", "r."));
                return null;
            })));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, wideStore.loadScans("alice").size());
        assertEquals(0, wideStore.trackedLocks());
    }

    @Test
    @DisplayName("A corrupt conversation file is reported and left untouched instead of overwritten")
    void appendExchange_corruptFileIsNotOverwritten() throws Exception {
        Path file = dataDir.resolve("conversations").resolve("alice.json");
        Files.createDirectories(file.getParent());
        String truncated = "[{\"role\":\"user\",\"content\":\"q1\"},{\"role\":\"assistant\",\"cont";
        Files.writeString(file, truncated);

        GatewayException thrown = assertThrows(GatewayException.class, () -> store.appendExchange("alice",
                ConversationTurn.user("q2"), ConversationTurn.assistant("a2")));

        assertEquals(ErrorKind.INTERNAL, thrown.kind());
        assertEquals(truncated, Files.readString(file));
        assertTrue(store.loadConversation("alice").isEmpty());
        assertEquals(0, store.trackedLocks());
    }

    private static ScanRecord record(String page, String result) {
        return new ScanRecord(page, "No", 200, result, Instant.now());
    }
}
