package com.openforge.scanmate.task;

import java.util.Objects;

/**
 * Terminal result of an operation or of a single stage inside one.
 *
 * Variants:
 *   OK        - payload present
 *   TIMED_OUT - a deadline or stage budget expired
 *   CANCELLED - cancellation signal observed before a result existed
 *   FAILED    - errorKind tells which part of the taxonomy applies
 *
 * Outcomes are propagated by return value; nothing crosses the orchestrator
 * boundary by throwing.  {@code message} is user-facing text for every
 * non-OK variant.
 */
public record OperationOutcome<T>(
        Status    status,
        T         payload,
        ErrorKind errorKind,
        String    message
) {

    public enum Status {
        OK,
        TIMED_OUT,
        CANCELLED,
        FAILED
    }

    public OperationOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.OK && errorKind != null) {
            throw new IllegalArgumentException("OK outcome cannot carry an error kind");
        }
    }

    // ── Factories ────────────────────────────────────────────────────────────

    public static <T> OperationOutcome<T> ok(T payload) {
        return new OperationOutcome<>(Status.OK, payload, null, null);
    }

    public static <T> OperationOutcome<T> timedOut(String message) {
        return new OperationOutcome<>(Status.TIMED_OUT, null, ErrorKind.TIMEOUT, message);
    }

    public static <T> OperationOutcome<T> cancelled(String message) {
        return new OperationOutcome<>(Status.CANCELLED, null, ErrorKind.CANCELLED, message);
    }

    public static <T> OperationOutcome<T> failed(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case TIMEOUT   -> timedOut(message);
            case CANCELLED -> cancelled(message);
            default        -> new OperationOutcome<>(Status.FAILED, null, kind, message);
        };
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Re-types a non-OK outcome so it can be returned from a caller with a
     * different payload type.
     */
    public <R> OperationOutcome<R> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Only non-OK outcomes can be propagated");
        }
        return new OperationOutcome<>(status, null, errorKind, message);
    }

    /** Same variant, different user-facing text. */
    public OperationOutcome<T> withMessage(String newMessage) {
        if (isOk()) {
            return this;
        }
        return new OperationOutcome<>(status, null, errorKind, newMessage);
    }
}
