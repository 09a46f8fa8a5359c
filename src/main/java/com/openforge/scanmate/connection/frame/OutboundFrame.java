package com.openforge.scanmate.connection.frame;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Every frame the gateway sends.  Each record serializes to exactly the
 * JSON object clients expect, e.g. {@code {"type":"pong"}} or
 * {@code {"response":"...","url":"..."}}.
 */
public sealed interface OutboundFrame permits OutboundFrame.Pong,
                                              OutboundFrame.Typing,
                                              OutboundFrame.Processing,
                                              OutboundFrame.Progress,
                                              OutboundFrame.ChatReply,
                                              OutboundFrame.ScanReply,
                                              OutboundFrame.ErrorFrame {

    record Pong(String type) implements OutboundFrame {
        public static final Pong INSTANCE = new Pong("pong");
    }

    /** Chat acknowledgement: the reply is being generated. */
    record Typing(boolean typing) implements OutboundFrame {
        public static final Typing INSTANCE = new Typing(true);
    }

    /** Scan acknowledgement. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Processing(boolean processing, String status) implements OutboundFrame {
        public static Processing started() {
            return new Processing(true, "Starting scan...");
        }
    }

    record Progress(String status) implements OutboundFrame {}

    record ChatReply(String response) implements OutboundFrame {}

    record ScanReply(String response, String url) implements OutboundFrame {}

    record ErrorFrame(String error) implements OutboundFrame {}
}
