package com.openforge.scanmate.connection;

/** WebSocket close codes the gateway uses (RFC 6455 §7.4.1). */
public final class CloseCodes {

    public static final int NORMAL         = 1000;
    public static final int GOING_AWAY     = 1001;
    public static final int INTERNAL_ERROR = 1011;

    private CloseCodes() {
    }
}
