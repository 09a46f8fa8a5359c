package com.openforge.scanmate.websocket;

import com.openforge.scanmate.connection.ConnectionManager;
import com.openforge.scanmate.connection.SessionEndpoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Raw (non-STOMP) WebSocket endpoints.
 *
 * Client connection flow:
 *   1. Connect to ws://host/chatbot or ws://host/scan
 *   2. Send JSON frames: {type:"ping"}, {user, message} or {user?, url}
 *   3. Receive JSON frames: {type:"pong"}, {typing}, {processing, status},
 *      {status}, {response[, url]}, {error}
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConnectionManager connectionManager;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        for (SessionEndpoint endpoint : SessionEndpoint.values()) {
            registry.addHandler(new GatewayWebSocketHandler(connectionManager, endpoint), endpoint.path())
                    // Browser-extension clients connect from arbitrary origins
                    .setAllowedOriginPatterns("*");
        }
    }
}
