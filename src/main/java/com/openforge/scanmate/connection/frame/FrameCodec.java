package com.openforge.scanmate.connection.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.connection.SessionEndpoint;
import com.openforge.scanmate.scan.ScanTargets;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON ⇄ frame conversion.  Inbound frames are interpreted per endpoint,
 * since the same fields mean different things on /chatbot and /scan.
 */
@Component
@RequiredArgsConstructor
public class FrameCodec {

    static final String GUEST = "guest";

    private final ObjectMapper objectMapper;

    public InboundFrame decode(SessionEndpoint endpoint, String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FrameDecodeException("Invalid JSON format");
        }
        if (node == null || !node.isObject()) {
            throw new FrameDecodeException("Invalid JSON format");
        }
        if ("ping".equals(textOf(node, "type"))) {
            return new InboundFrame.Ping();
        }
        return switch (endpoint) {
            case CHAT -> decodeChat(node);
            case SCAN -> decodeScan(node);
        };
    }

    public String encode(OutboundFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new GatewayException(ErrorKind.INTERNAL,
                    "Failed to encode " + frame.getClass().getSimpleName(), e);
        }
    }

    private InboundFrame decodeChat(JsonNode node) {
        String user    = textOf(node, "user");
        String message = textOf(node, "message");
        if (user.isEmpty() || message.isEmpty()) {
            throw new FrameDecodeException("Missing 'user' or 'message'");
        }
        return new InboundFrame.ChatRequest(user, message);
    }

    private InboundFrame decodeScan(JsonNode node) {
        String user = textOf(node, "user");
        String url  = textOf(node, "url");
        if (url.isEmpty()) {
            String message = textOf(node, "message");
            if (ScanTargets.looksLikeUrl(message)) {
                url = message;
            }
        }
        if (url.isEmpty()) {
            throw new FrameDecodeException("Missing URL to scan");
        }
        return new InboundFrame.ScanRequest(user.isEmpty() ? GUEST : user, url);
    }

    /** Trimmed text of a string field, empty when absent or not a string. */
    private static String textOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText().strip() : "";
    }
}
