package com.openforge.scanmate.connection;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of live sessions keyed by connection id.  Only the
 * {@link ConnectionManager} registers and removes entries.
 */
@Component
public class SessionRegistry {

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();

    void register(ClientSession session) {
        sessions.put(session.id(), session);
    }

    void remove(ClientSession session) {
        sessions.remove(session.id(), session);
    }

    public Optional<ClientSession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public Collection<ClientSession> snapshot() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
