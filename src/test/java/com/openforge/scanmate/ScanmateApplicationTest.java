package com.openforge.scanmate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.connection.SessionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ScanmateApplicationTest {

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    SessionRegistry registry;

    @Test
    void health_isPublic() throws Exception {
        ResponseEntity<String> response = rest.getForEntity("/health", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = objectMapper.readTree(response.getBody());
        assertEquals("healthy", body.get("status").asText());
        assertTrue(body.has("uptime_seconds"));
    }

    @Test
    @DisplayName("The chat socket answers ping and rejects malformed frames without closing")
    void chatSocket_pingAndMalformedFrame() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        WebSocketSession socket = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                        received.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/chatbot")
                .get(5, TimeUnit.SECONDS);
        try {
            socket.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
            String pong = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(pong);
            assertEquals("pong", objectMapper.readTree(pong).get("type").asText());

            socket.sendMessage(new TextMessage("definitely not json"));
            String error = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(error);
            assertEquals("Invalid JSON format", objectMapper.readTree(error).get("error").asText());
            assertTrue(socket.isOpen());
            assertEquals(1, registry.size());
        } finally {
            socket.close(CloseStatus.NORMAL);
        }
    }
}
