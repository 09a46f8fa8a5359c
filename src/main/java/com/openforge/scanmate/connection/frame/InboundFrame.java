package com.openforge.scanmate.connection.frame;

/**
 * Every frame a client may send, after decoding.
 *
 *   Ping        - {type:"ping"} on either endpoint
 *   ChatRequest - {user, message} on /chatbot
 *   ScanRequest - {user?, url} or {user?, message} on /scan
 */
public sealed interface InboundFrame
        permits InboundFrame.Ping, InboundFrame.ChatRequest, InboundFrame.ScanRequest {

    record Ping() implements InboundFrame {}

    record ChatRequest(String user, String message) implements InboundFrame {}

    /** {@code url} is the raw text to scan; scheme fixing happens later. */
    record ScanRequest(String user, String url) implements InboundFrame {}
}
