package com.openforge.scanmate.connection;

/**
 * Lifecycle of one duplex connection.  Transitions only move forward:
 * CONNECTING → ACTIVE → CLOSING → CLOSED.
 */
public enum ConnectionState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}
