package com.openforge.scanmate.connection;

/** The two duplex surfaces a client can open. */
public enum SessionEndpoint {

    CHAT("/chatbot"),
    SCAN("/scan");

    private final String path;

    SessionEndpoint(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
