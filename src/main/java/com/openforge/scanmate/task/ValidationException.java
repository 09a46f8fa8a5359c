package com.openforge.scanmate.task;

/** Caller supplied a missing or malformed user, message, URL or index. */
public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
