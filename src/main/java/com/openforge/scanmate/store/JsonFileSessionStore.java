package com.openforge.scanmate.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.support.TextLimits;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import com.openforge.scanmate.task.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * File-backed {@link SessionStore}: one pretty-printed JSON array per user
 * and log kind.
 *
 * Layout under the configured data directory:
 *   conversations/{user}.json  - [{role, content}, ...]
 *   scan_pages/{user}.json     - [{page, redirects, status_code, result, scanned_at}, ...]
 *
 * Every mutation is a read-modify-write under a per-file lock, and the
 * new content replaces the old file with an atomic move, so readers never
 * observe a half-written file.
 */
@Slf4j
@Component
public class JsonFileSessionStore implements SessionStore {

    private static final TypeReference<List<ConversationTurn>> TURN_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<ScanRecord>>       SCAN_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path         conversationDir;
    private final Path         scanDir;
    private final int          maxConversationEntries;
    private final int          maxScanHistory;
    private final int          reportLimit;

    // entries live only while some thread holds or waits for the file
    private final ConcurrentHashMap<String, FileLock> fileLocks = new ConcurrentHashMap<>();

    public JsonFileSessionStore(ObjectMapper objectMapper, GatewayProperties properties) {
        Path dataDir = Path.of(properties.dataDir());
        this.objectMapper           = objectMapper;
        this.conversationDir        = dataDir.resolve("conversations");
        this.scanDir                = dataDir.resolve("scan_pages");
        this.maxConversationEntries = properties.memory().maxMemoryTurns() * 2;
        this.maxScanHistory         = properties.memory().maxScanHistory();
        this.reportLimit            = properties.scan().reportLimit();
    }

    // ── Conversation ─────────────────────────────────────────────────────────

    @Override
    public List<ConversationTurn> loadConversation(String user) {
        return read(conversationFile(user), TURN_LIST_TYPE);
    }

    @Override
    public void appendExchange(String user, ConversationTurn userTurn, ConversationTurn assistantTurn) {
        if (!userTurn.isUser() || !assistantTurn.isAssistant()) {
            throw new IllegalArgumentException("An exchange is a user turn followed by an assistant turn");
        }
        update(conversationFile(user), TURN_LIST_TYPE, turns -> {
            turns.add(userTurn);
            turns.add(assistantTurn);
            return keepLast(turns, maxConversationEntries);
        });
    }

    @Override
    public void clearConversation(String user) {
        update(conversationFile(user), TURN_LIST_TYPE, turns -> new ArrayList<>());
        log.info("[Store] Conversation cleared for {}", user);
    }

    @Override
    public List<ConversationTurn> deleteTurn(String user, int index) {
        return update(conversationFile(user), TURN_LIST_TYPE, turns -> {
            if (index < 0 || index >= turns.size()) {
                throw new ValidationException("Invalid index " + index);
            }
            boolean pairedAnswer = turns.get(index).isUser()
                    && index + 1 < turns.size()
                    && turns.get(index + 1).isAssistant();
            if (pairedAnswer) {
                turns.remove(index + 1);
            }
            turns.remove(index);
            return turns;
        });
    }

    // ── Scans ────────────────────────────────────────────────────────────────

    @Override
    public List<ScanRecord> loadScans(String user) {
        return read(scanFile(user), SCAN_LIST_TYPE);
    }

    @Override
    public void appendScan(String user, ScanRecord scanRecord) {
        ScanRecord bounded = scanRecord.withResult(TextLimits.capAtSentence(scanRecord.result(), reportLimit));
        update(scanFile(user), SCAN_LIST_TYPE, scans -> {
            scans.add(bounded);
            return keepLast(scans, maxScanHistory);
        });
    }

    // ── File plumbing ────────────────────────────────────────────────────────

    private Path conversationFile(String user) {
        return conversationDir.resolve(UserIds.validate(user) + ".json");
    }

    private Path scanFile(String user) {
        return scanDir.resolve(UserIds.validate(user) + ".json");
    }

    /** Lenient read for display: an unreadable file is logged and shown as empty. */
    private <E> List<E> read(Path file, TypeReference<List<E>> type) {
        try {
            return readStrict(file, type);
        } catch (IOException e) {
            log.error("[Store] Failed to read {}: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    private <E> List<E> readStrict(Path file, TypeReference<List<E>> type) throws IOException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        List<E> entries = objectMapper.readValue(file.toFile(), type);
        return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
    }

    /** Read-modify-write; a file that cannot be read is left untouched. */
    private <E> List<E> update(Path file, TypeReference<List<E>> type, UnaryOperator<List<E>> mutation) {
        String key = file.toString();
        FileLock fileLock = fileLocks.compute(key, (k, held) -> held == null ? new FileLock() : held.retain());
        fileLock.lock.lock();
        try {
            List<E> current;
            try {
                current = readStrict(file, type);
            } catch (IOException e) {
                log.error("[Store] Refusing to rewrite unreadable {}: {}", file, e.getMessage());
                throw new GatewayException(ErrorKind.INTERNAL, "Failed to read " + file.getFileName(), e);
            }
            List<E> updated = mutation.apply(current);
            write(file, updated);
            return List.copyOf(updated);
        } finally {
            fileLock.lock.unlock();
            fileLocks.compute(key, (k, held) -> held.release() ? null : held);
        }
    }

    int trackedLocks() {
        return fileLocks.size();
    }

    private void write(Path file, List<?> entries) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Store] Wrote {} entries to {}", entries.size(), file);
        } catch (IOException e) {
            throw new GatewayException(ErrorKind.INTERNAL, "Failed to persist " + file.getFileName(), e);
        }
    }

    /** A lock plus the number of threads currently using it; mutated only inside map compute calls. */
    private static final class FileLock {

        private final ReentrantLock lock = new ReentrantLock();
        private int users = 1;

        FileLock retain() {
            users++;
            return this;
        }

        /** @return true when no thread uses the lock any more */
        boolean release() {
            return --users == 0;
        }
    }

    private static <E> List<E> keepLast(List<E> entries, int max) {
        if (entries.size() <= max) {
            return entries;
        }
        return new ArrayList<>(entries.subList(entries.size() - max, entries.size()));
    }
}
