package com.openforge.scanmate.task;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The set of operations owned by one session.
 *
 * Contract:
 *   start(kind, operation, budget, stages, listener) → handle   (rejects a second outstanding op of the same kind)
 *   awaitResult(handle)                              → outcome  (always returns; bounded by deadline + grace)
 *   cancel(handle)                                              (advisory to the work, authoritative here)
 *
 * Closing the scope cancels everything still outstanding and refuses new work,
 * so no operation outlives its session.
 */
@Slf4j
public final class OperationScope implements AutoCloseable {

    private final TaskOrchestrator orchestrator;
    private final String           owner;

    private final Map<OperationKind, OperationHandle<?>> outstanding = new EnumMap<>(OperationKind.class);
    private boolean closed;

    OperationScope(TaskOrchestrator orchestrator, String owner) {
        this.orchestrator = orchestrator;
        this.owner        = owner;
    }

    public String owner() {
        return owner;
    }

    // ── Start ────────────────────────────────────────────────────────────────

    /**
     * Starts {@code operation} with an absolute deadline of now + {@code budget}.
     *
     * @param progressStages stage names emitted as progress events: the first
     *                       immediately, the rest one per progress interval
     * @param listener       receives progress and the single Completed event
     * @throws OperationBusyException if an operation of this kind is outstanding
     */
    public <T> OperationHandle<T> start(OperationKind kind,
                                        Operation<T> operation,
                                        Duration budget,
                                        List<String> progressStages,
                                        Consumer<OperationEvent> listener) {
        OperationHandle<T> handle;
        synchronized (this) {
            if (closed) {
                throw new GatewayException(ErrorKind.CANCELLED, "Session is closing");
            }
            if (outstanding.containsKey(kind)) {
                throw new OperationBusyException(kind);
            }
            handle = orchestrator.launch(owner, kind, operation, budget, progressStages, listener);
            outstanding.put(kind, handle);
        }
        handle.result().whenComplete((outcome, failure) -> release(kind, handle));
        return handle;
    }

    public <T> OperationHandle<T> start(OperationKind kind, Operation<T> operation, Duration budget) {
        return start(kind, operation, budget, List.of(), event -> {});
    }

    // ── Await / cancel ───────────────────────────────────────────────────────

    public <T> OperationOutcome<T> awaitResult(OperationHandle<T> handle) {
        return orchestrator.awaitResult(handle);
    }

    public void cancel(OperationHandle<?> handle) {
        orchestrator.cancel(handle, CancelReason.REQUESTED);
    }

    public synchronized Optional<OperationHandle<?>> outstanding(OperationKind kind) {
        return Optional.ofNullable(outstanding.get(kind));
    }

    public synchronized boolean hasOutstanding() {
        return !outstanding.isEmpty();
    }

    /** Cancels every outstanding operation with the given reason. */
    public void cancelAll(CancelReason reason) {
        List<OperationHandle<?>> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(outstanding.values());
        }
        for (OperationHandle<?> handle : snapshot) {
            log.info("[Scope:{}] Cancelling {} ({})", owner, handle, reason);
            orchestrator.cancel(handle, reason);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        cancelAll(CancelReason.DISCONNECTED);
    }

    private synchronized void release(OperationKind kind, OperationHandle<?> handle) {
        outstanding.remove(kind, handle);
    }
}
