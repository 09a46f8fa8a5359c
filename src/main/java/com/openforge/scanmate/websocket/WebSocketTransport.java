package com.openforge.scanmate.websocket;

import com.openforge.scanmate.connection.ConnectionTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ConnectionTransport} over a Spring {@link WebSocketSession}.
 *
 * Sends go through a ConcurrentWebSocketSessionDecorator, so a slow client
 * overflowing the buffer or blocking past the send limit fails that send
 * instead of stalling the caller.
 */
@Slf4j
class WebSocketTransport implements ConnectionTransport {

    private static final int SEND_TIME_LIMIT_MS   = 10_000;
    private static final int BUFFER_SIZE_LIMIT_B  = 512 * 1024;

    private final WebSocketSession session;

    WebSocketTransport(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT_B);
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session %s is closed".formatted(session.getId()));
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (IllegalStateException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("[WS:{}] Close failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
