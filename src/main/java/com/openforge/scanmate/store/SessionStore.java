package com.openforge.scanmate.store;

import java.util.List;

/**
 * Persisted conversation and scan logs, one of each per user identity.
 *
 * Invariants enforced on every write:
 *   conversation length ≤ 2 × max-memory-turns, most recent entries kept in order
 *   scan history length ≤ max-scan-history, oldest dropped first
 *   scan report text ≤ report-limit, cut at a sentence boundary
 *
 * Writes for the same identity are serialized, so concurrent operations from
 * different connections cannot lose each other's updates.
 */
public interface SessionStore {

    List<ConversationTurn> loadConversation(String user);

    /** Appends a user/assistant pair; a lone entry is never appended. */
    void appendExchange(String user, ConversationTurn userTurn, ConversationTurn assistantTurn);

    void clearConversation(String user);

    /**
     * Deletes the entry at {@code index}; a user entry immediately followed by
     * an assistant entry is deleted together with it.
     *
     * @return the conversation after deletion
     * @throws com.openforge.scanmate.task.ValidationException if index is out of bounds
     */
    List<ConversationTurn> deleteTurn(String user, int index);

    List<ScanRecord> loadScans(String user);

    void appendScan(String user, ScanRecord scanRecord);
}
