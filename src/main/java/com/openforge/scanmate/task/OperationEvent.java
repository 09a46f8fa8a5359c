package com.openforge.scanmate.task;

/**
 * What an in-flight operation reports to its owner.
 *
 * For one handle: zero or more {@link Progress} events in increasing
 * {@code sequence} order, then exactly one {@link Completed}.  Nothing
 * follows the Completed event.
 */
public sealed interface OperationEvent permits OperationEvent.Progress, OperationEvent.Completed {

    String handleId();

    OperationKind kind();

    record Progress(String handleId, OperationKind kind, int sequence, String stage)
            implements OperationEvent {}

    record Completed(String handleId, OperationKind kind, OperationOutcome<?> outcome)
            implements OperationEvent {}
}
