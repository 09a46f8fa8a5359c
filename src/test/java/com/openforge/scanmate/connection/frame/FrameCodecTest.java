package com.openforge.scanmate.connection.frame;

import com.openforge.scanmate.config.JacksonConfig;
import com.openforge.scanmate.connection.SessionEndpoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FrameCodecTest {

    private final FrameCodec codec = new FrameCodec(new JacksonConfig().objectMapper());

    @ParameterizedTest
    @EnumSource(SessionEndpoint.class)
    void decode_pingOnEveryEndpoint(SessionEndpoint endpoint) {
        assertInstanceOf(InboundFrame.Ping.class, codec.decode(endpoint, "{\"type\":\"ping\"}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "[1,2]", "\"text\"", ""})
    void decode_rejectsNonObjects(String text) {
        FrameDecodeException e = assertThrows(FrameDecodeException.class,
                () -> codec.decode(SessionEndpoint.CHAT, text));
        assertEquals("Invalid JSON format", e.getMessage());
    }

    @Test
    void decode_chatRequiresUserAndMessage() {
        assertEquals(new InboundFrame.ChatRequest("dave", "hi"),
                codec.decode(SessionEndpoint.CHAT, "{\"user\":\" dave \",\"message\":\"hi\"}"));
        FrameDecodeException e = assertThrows(FrameDecodeException.class,
                () -> codec.decode(SessionEndpoint.CHAT, "{\"user\":\"dave\",\"message\":\"  \"}"));
        assertEquals("Missing 'user' or 'message'", e.getMessage());
    }

    @Test
    void decode_scanFallsBackToUrlLikeMessageAndGuestUser() {
        assertEquals(new InboundFrame.ScanRequest("erin", "http://a.example"),
                codec.decode(SessionEndpoint.SCAN, "{\"user\":\"erin\",\"url\":\"http://a.example\"}"));
        assertEquals(new InboundFrame.ScanRequest("guest", "bit.ly/xyz"),
                codec.decode(SessionEndpoint.SCAN, "{\"message\":\"bit.ly/xyz\"}"));
        FrameDecodeException e = assertThrows(FrameDecodeException.class,
                () -> codec.decode(SessionEndpoint.SCAN, "{\"message\":\"hello\"}"));
        assertEquals("Missing URL to scan", e.getMessage());
    }

    @Test
    void encode_producesClientShapes() {
        assertEquals("{\"type\":\"pong\"}", codec.encode(OutboundFrame.Pong.INSTANCE));
        assertEquals("{\"typing\":true}", codec.encode(OutboundFrame.Typing.INSTANCE));
        assertEquals("{\"processing\":true,\"status\":\"Starting scan...\"}",
                codec.encode(OutboundFrame.Processing.started()));
        assertEquals("{\"response\":\"r\",\"url\":\"http://u\"}",
                codec.encode(new OutboundFrame.ScanReply("r", "http://u")));
        assertEquals("{\"error\":\"boom\"}", codec.encode(new OutboundFrame.ErrorFrame("boom")));
    }
}
