package com.openforge.scanmate.connection;

import com.openforge.scanmate.activity.ActivityLog;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.connection.frame.FrameCodec;
import com.openforge.scanmate.connection.frame.FrameDecodeException;
import com.openforge.scanmate.connection.frame.InboundFrame;
import com.openforge.scanmate.connection.frame.OutboundFrame;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import com.openforge.scanmate.task.OperationEvent;
import com.openforge.scanmate.task.TaskOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of every duplex connection.
 *
 * Each accepted connection gets one receive loop on the connection executor:
 *
 *   loop while ACTIVE:
 *     signal = mailbox.poll(receive-timeout)
 *       InboundText     → touch activity, decode
 *                           Ping        → {type:"pong"}
 *                           domain frame → acknowledge + start operation
 *                           malformed    → {error}, keep going
 *       OperationUpdate → progress / result / error frame
 *       Disconnected    → close
 *       (timeout)       → operation in flight: keep waiting
 *                         abort-on-receive-timeout: {error} + close
 *                         idle longer than idle-limit: close 1000 "Session timeout"
 *
 * Frames from the server framework and orchestrator events share the
 * mailbox, so one thread serializes everything a session sends.  Closing
 * cancels all outstanding operations; a second close is a no-op.
 */
@Slf4j
@Component
public class ConnectionManager {

    private final SessionRegistry                registry;
    private final TaskOrchestrator               orchestrator;
    private final SessionRequestHandler          requests;
    private final FrameCodec                     codec;
    private final ActivityLog                    activityLog;
    private final GatewayProperties.Connection   policies;
    private final Clock                          clock;
    private final ExecutorService                connectionExecutor;

    public ConnectionManager(SessionRegistry registry,
                             TaskOrchestrator orchestrator,
                             SessionRequestHandler requests,
                             FrameCodec codec,
                             ActivityLog activityLog,
                             GatewayProperties properties,
                             Clock clock,
                             @Qualifier("connectionExecutor") ExecutorService connectionExecutor) {
        this.registry           = registry;
        this.orchestrator       = orchestrator;
        this.requests           = requests;
        this.codec              = codec;
        this.activityLog        = activityLog;
        this.policies           = properties.connection();
        this.clock              = clock;
        this.connectionExecutor = connectionExecutor;
    }

    // ── Entry points from the transport layer ────────────────────────────────

    public ClientSession accept(SessionEndpoint endpoint, ConnectionTransport transport) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        String owner = endpoint.name().toLowerCase(Locale.ROOT) + ":" + id;
        ClientSession session = new ClientSession(id, endpoint, transport, orchestrator.openScope(owner), clock.instant());

        registry.register(session);
        session.transition(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
        log.info("[Conn:{}] Accepted on {} ({} live)", id, endpoint.path(), registry.size());

        try {
            connectionExecutor.execute(() -> runLoop(session));
        } catch (RejectedExecutionException e) {
            log.error("[Conn:{}] No receive loop available: {}", id, e.getMessage());
            close(session, CloseCodes.INTERNAL_ERROR, "Internal server error");
        }
        return session;
    }

    public void onMessage(String connectionId, String text) {
        registry.find(connectionId).ifPresentOrElse(
                session -> session.deliver(new SessionSignal.InboundText(text)),
                () -> log.debug("[Conn:{}] Frame for unknown connection dropped", connectionId));
    }

    public void onDisconnect(String connectionId, String reason) {
        registry.find(connectionId).ifPresent(session -> {
            log.info("[Conn:{}] Peer disconnected: {}", connectionId, reason);
            session.deliver(new SessionSignal.Disconnected(reason));
            close(session, CloseCodes.NORMAL, reason);
        });
    }

    /** Cancels outstanding work and closes the transport; idempotent. */
    public void close(ClientSession session, int code, String reason) {
        if (!session.transition(ConnectionState.ACTIVE, ConnectionState.CLOSING)
                && !session.transition(ConnectionState.CONNECTING, ConnectionState.CLOSING)) {
            return;
        }
        log.info("[Conn:{}] Closing {} ({} {})", session.id(), session.endpoint().path(), code, reason);
        try {
            session.operations().close();
            session.transport().close(code, reason);
        } finally {
            registry.remove(session);
            session.markClosed();
            session.userId().ifPresent(user -> activityLog.record(user, "WebSocket disconnected"));
        }
    }

    @PreDestroy
    public void shutdown() {
        for (ClientSession session : registry.snapshot()) {
            close(session, CloseCodes.GOING_AWAY, "Server shutting down");
        }
    }

    // ── Receive loop ─────────────────────────────────────────────────────────

    void runLoop(ClientSession session) {
        GatewayProperties.EndpointPolicy policy = policies.policyFor(session.endpoint());
        Instant receiveWindowStart = clock.instant();
        try {
            while (session.isActive()) {
                Duration waited = Duration.between(receiveWindowStart, clock.instant());
                SessionSignal signal = session.next(policy.receiveTimeout().minus(waited));

                if (signal == null) {
                    receiveWindowStart = clock.instant();
                    onReceiveTimeout(session, policy);
                } else if (signal instanceof SessionSignal.InboundText inbound) {
                    receiveWindowStart = clock.instant();
                    session.touch(receiveWindowStart);
                    onFrame(session, inbound.text());
                } else if (signal instanceof SessionSignal.OperationUpdate update) {
                    onOperationEvent(session, update.event());
                    if (update.event() instanceof OperationEvent.Completed) {
                        // the client gets a full receive window after each result
                        receiveWindowStart = clock.instant();
                    }
                } else if (signal instanceof SessionSignal.Disconnected disconnected) {
                    close(session, CloseCodes.NORMAL, disconnected.reason());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close(session, CloseCodes.GOING_AWAY, "Server shutting down");
        } catch (RuntimeException e) {
            log.error("[Conn:{}] Unexpected failure in receive loop", session.id(), e);
            close(session, CloseCodes.INTERNAL_ERROR, "Internal server error");
        }
        log.debug("[Conn:{}] Receive loop finished in state {}", session.id(), session.state());
    }

    private void onReceiveTimeout(ClientSession session, GatewayProperties.EndpointPolicy policy) {
        if (session.operations().hasOutstanding()) {
            log.debug("[Conn:{}] Receive timeout with operation in flight, waiting on", session.id());
            return;
        }
        if (policy.abortOnReceiveTimeout()) {
            log.info("[Conn:{}] No frame within {}s, aborting", session.id(), policy.receiveTimeout().toSeconds());
            send(session, new OutboundFrame.ErrorFrame("Receive timed out"));
            close(session, CloseCodes.NORMAL, "Receive timeout");
            return;
        }
        Duration idle = Duration.between(session.lastActivity(), clock.instant());
        if (idle.compareTo(policy.idleLimit()) > 0) {
            log.info("[Conn:{}] Idle for {}s, closing", session.id(), idle.toSeconds());
            close(session, CloseCodes.NORMAL, "Session timeout");
        }
    }

    private void onFrame(ClientSession session, String text) {
        InboundFrame frame;
        try {
            frame = codec.decode(session.endpoint(), text);
        } catch (FrameDecodeException e) {
            log.debug("[Conn:{}] Rejected frame: {}", session.id(), e.getMessage());
            send(session, new OutboundFrame.ErrorFrame(e.getMessage()));
            return;
        }

        if (frame instanceof InboundFrame.Ping) {
            send(session, OutboundFrame.Pong.INSTANCE);
            return;
        }
        try {
            requests.start(session, frame, out -> send(session, out));
        } catch (GatewayException e) {
            if (e.kind() == ErrorKind.INTERNAL) {
                throw e;
            }
            log.debug("[Conn:{}] Request refused ({}): {}", session.id(), e.kind(), e.getMessage());
            send(session, new OutboundFrame.ErrorFrame(e.getMessage()));
        }
    }

    private void onOperationEvent(ClientSession session, OperationEvent event) {
        requests.render(event).ifPresent(frame -> send(session, frame));
        if (event instanceof OperationEvent.Completed completed) {
            session.touch(clock.instant());
            log.debug("[Conn:{}] {} {} delivered", session.id(), event.kind(), completed.outcome().status());
        }
    }

    /** @return false when the frame could not be sent; the session is closed then. */
    boolean send(ClientSession session, OutboundFrame frame) {
        if (!session.isActive()) {
            return false;
        }
        try {
            session.transport().send(codec.encode(frame));
            return true;
        } catch (IOException e) {
            log.warn("[Conn:{}] Send of {} failed, closing: {}",
                    session.id(), frame.getClass().getSimpleName(), e.getMessage());
            close(session, CloseCodes.GOING_AWAY, "Send failed");
            return false;
        }
    }
}
