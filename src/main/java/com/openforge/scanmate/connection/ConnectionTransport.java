package com.openforge.scanmate.connection;

import java.io.IOException;

/**
 * The raw duplex channel under a session, independent of the server
 * framework carrying it.
 */
public interface ConnectionTransport {

    /** Sends one text frame; implementations are safe for concurrent callers. */
    void send(String text) throws IOException;

    /** Closes with a WebSocket close code; closing a closed transport does nothing. */
    void close(int code, String reason);

    boolean isOpen();
}
