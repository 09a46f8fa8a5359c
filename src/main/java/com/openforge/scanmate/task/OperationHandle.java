package com.openforge.scanmate.task;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * One outstanding operation.  Owned by the {@link TaskOrchestrator}; other
 * layers only look it up and read its identity and state.
 *
 * Event ordering: progress emission and resolution are serialized on the
 * handle's monitor, and {@code resolved} is flipped before the Completed
 * event is published, so no progress event can follow the terminal one.
 */
@Slf4j
public final class OperationHandle<T> {

    private final String        id;
    private final String        owner;
    private final OperationKind kind;
    private final Instant       deadline;
    private final Consumer<OperationEvent> listener;

    private final CompletableFuture<OperationOutcome<T>> result       = new CompletableFuture<>();
    private final CompletableFuture<CancelReason>        cancellation = new CompletableFuture<>();

    private boolean             resolved;        // guarded by this
    private int                 progressCount;   // guarded by this
    private ScheduledFuture<?>  progressTask;    // guarded by this
    private volatile Future<?>  worker;

    OperationHandle(String owner, OperationKind kind, Instant deadline, Consumer<OperationEvent> listener) {
        this.id       = UUID.randomUUID().toString().substring(0, 8);
        this.owner    = owner;
        this.kind     = kind;
        this.deadline = deadline;
        this.listener = listener;
    }

    // ── Read-only view ───────────────────────────────────────────────────────

    public String id() {
        return id;
    }

    public String owner() {
        return owner;
    }

    public OperationKind kind() {
        return kind;
    }

    public Instant deadline() {
        return deadline;
    }

    public synchronized boolean isResolved() {
        return resolved;
    }

    public boolean isCancelled() {
        return cancellation.isDone();
    }

    // ── Orchestrator-only mutators ───────────────────────────────────────────

    CompletableFuture<OperationOutcome<T>> result() {
        return result;
    }

    CompletableFuture<CancelReason> cancellation() {
        return cancellation;
    }

    void worker(Future<?> worker) {
        this.worker = worker;
    }

    synchronized void progressTask(ScheduledFuture<?> task) {
        if (resolved || cancellation.isDone()) {
            task.cancel(false);
            return;
        }
        this.progressTask = task;
    }

    /** @return false once the handle is resolved or cancelled; nothing is emitted then. */
    synchronized boolean emitProgress(String stage) {
        if (resolved || cancellation.isDone()) {
            return false;
        }
        publish(new OperationEvent.Progress(id, kind, ++progressCount, stage));
        return true;
    }

    synchronized void stopProgress() {
        if (progressTask != null) {
            progressTask.cancel(false);
            progressTask = null;
        }
    }

    boolean signalCancel(CancelReason reason) {
        boolean first = cancellation.complete(reason);
        if (first) {
            stopProgress();
        }
        return first;
    }

    /**
     * Delivers the terminal outcome exactly once.
     *
     * @return false if the handle was already resolved (late arrival)
     */
    boolean resolve(OperationOutcome<T> outcome) {
        synchronized (this) {
            if (resolved) {
                return false;
            }
            resolved = true;
            stopProgress();
        }
        result.complete(outcome);
        publish(new OperationEvent.Completed(id, kind, outcome));
        return true;
    }

    void abandonWorker() {
        Future<?> current = worker;
        if (current != null) {
            current.cancel(true);
        }
    }

    private void publish(OperationEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            // A broken listener must not take the operation down with it
            log.warn("[Operation:{}] Listener rejected {} event: {}",
                    id, event.getClass().getSimpleName(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "%s[%s owner=%s]".formatted(kind, id, owner);
    }
}
