package com.openforge.scanmate.websocket;

import com.openforge.scanmate.connection.ClientSession;
import com.openforge.scanmate.connection.ConnectionManager;
import com.openforge.scanmate.connection.SessionEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Bridges Spring's WebSocket callbacks for one endpoint into the
 * {@link ConnectionManager}.  The handler never blocks: frames are queued
 * for the session's receive loop.
 */
@Slf4j
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID = "scanmate.connectionId";

    private final ConnectionManager connectionManager;
    private final SessionEndpoint   endpoint;

    public GatewayWebSocketHandler(ConnectionManager connectionManager, SessionEndpoint endpoint) {
        this.connectionManager = connectionManager;
        this.endpoint          = endpoint;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientSession client = connectionManager.accept(endpoint, new WebSocketTransport(session));
        session.getAttributes().put(CONNECTION_ID, client.id());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        if (connectionId != null) {
            connectionManager.onMessage(connectionId, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WS:{}] Transport error on {}: {}", session.getId(), endpoint.path(), exception.getMessage());
        String connectionId = connectionId(session);
        if (connectionId != null) {
            connectionManager.onDisconnect(connectionId, "Transport error");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        if (connectionId != null) {
            String reason = status.getReason() != null ? status.getReason() : "code " + status.getCode();
            connectionManager.onDisconnect(connectionId, reason);
        }
    }

    private static String connectionId(WebSocketSession session) {
        return (String) session.getAttributes().get(CONNECTION_ID);
    }
}
