package com.openforge.scanmate.task;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps any throwable raised by an adapter call onto the {@link ErrorKind} taxonomy.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static ErrorKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof GatewayException gatewayException) {
            return gatewayException.kind();
        }
        if (cause instanceof CallNotPermittedException) {
            return ErrorKind.UPSTREAM_UNAVAILABLE;
        }
        // HttpTimeoutException is an IOException, so it must be checked first
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorKind.UPSTREAM_UNAVAILABLE;
        }
        if (cause instanceof InterruptedException || cause instanceof CancellationException) {
            return ErrorKind.CANCELLED;
        }
        return ErrorKind.INTERNAL;
    }

    /** Short human-readable description: the message, or the type name when there is none. */
    public static String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
