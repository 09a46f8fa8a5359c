package com.openforge.scanmate.task;

/**
 * A unit of long-running work driven by the {@link TaskOrchestrator}.
 *
 * Implementations check {@link OperationContext#isCancelled()} at stage
 * boundaries and run every blocking adapter call through
 * {@link OperationContext#await}.  When cancellation arrives after partial
 * results exist, an implementation may still return {@code OK} with a
 * best-effort payload.
 */
@FunctionalInterface
public interface Operation<T> {

    OperationOutcome<T> execute(OperationContext context) throws Exception;
}
