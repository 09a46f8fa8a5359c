package com.openforge.scanmate.connection;

import com.openforge.scanmate.task.OperationScope;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ephemeral state of one live connection.  Owned by the
 * {@link ConnectionManager}; nothing here outlives the connection.
 */
public final class ClientSession {

    private final String              id;
    private final SessionEndpoint     endpoint;
    private final ConnectionTransport transport;
    private final OperationScope      operations;

    private final BlockingQueue<SessionSignal>     mailbox = new LinkedBlockingQueue<>();
    private final AtomicReference<ConnectionState> state   = new AtomicReference<>(ConnectionState.CONNECTING);

    private volatile String  userId;
    private volatile Instant lastActivity;

    ClientSession(String id,
                  SessionEndpoint endpoint,
                  ConnectionTransport transport,
                  OperationScope operations,
                  Instant openedAt) {
        this.id           = id;
        this.endpoint     = endpoint;
        this.transport    = transport;
        this.operations   = operations;
        this.lastActivity = openedAt;
    }

    public String id() {
        return id;
    }

    public SessionEndpoint endpoint() {
        return endpoint;
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == ConnectionState.ACTIVE;
    }

    /** Identity from the most recent domain request, empty until one arrives. */
    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    ConnectionTransport transport() {
        return transport;
    }

    OperationScope operations() {
        return operations;
    }

    void bindUser(String user) {
        this.userId = user;
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    boolean transition(ConnectionState from, ConnectionState to) {
        return state.compareAndSet(from, to);
    }

    void markClosed() {
        state.set(ConnectionState.CLOSED);
    }

    /** Queues a signal for the receive loop; dropped once the session stopped accepting. */
    boolean deliver(SessionSignal signal) {
        if (state.get() == ConnectionState.CLOSED) {
            return false;
        }
        return mailbox.offer(signal);
    }

    SessionSignal next(Duration wait) throws InterruptedException {
        return mailbox.poll(Math.max(0, wait.toMillis()), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "%s[%s user=%s]".formatted(endpoint, id, userId);
    }
}
