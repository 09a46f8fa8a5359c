package com.openforge.scanmate.task;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * The view an {@link Operation} has of its own handle: cancellation signal,
 * remaining time budget, and a bounded way to wait on adapter calls.
 */
public interface OperationContext {

    boolean isCancelled();

    Optional<CancelReason> cancelReason();

    /** Time left until the operation's absolute deadline, never negative. */
    Duration remaining();

    /**
     * Runs {@code call} on the operation executor and waits until it returns,
     * {@code timeout} elapses, the operation deadline passes, or cancellation
     * is signalled, whichever is first.  Failures are classified into an
     * outcome; this method never throws.
     *
     * A call that is still running when the wait ends is interrupted and its
     * late result is ignored.
     */
    <R> OperationOutcome<R> await(String stage, Callable<R> call, Duration timeout);

    /** Outcome matching the current cancellation reason (TIMED_OUT for DEADLINE, CANCELLED otherwise). */
    <R> OperationOutcome<R> interruption();
}
