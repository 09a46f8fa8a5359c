package com.openforge.scanmate.task;

/**
 * Unchecked failure tagged with an {@link ErrorKind}.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
