package com.openforge.scanmate.task;

import com.openforge.scanmate.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs long operations (chat completions, scan pipelines) as cancellable,
 * deadline-bound units.
 *
 * Lifecycle of one handle:
 *
 *   launch ──► worker runs Operation.execute(context)
 *     │            └─ adapter calls go through context.await(...)
 *     ├─ progress: first stage now, then one per progress interval, until resolved or cancelled
 *     ├─ watchdog: at the deadline → cancel(DEADLINE)
 *     └─ cancel(reason):
 *          1. signal the cancellation future (work sees it at the next stage boundary / await)
 *          2. after the grace period, if still unresolved → resolve TIMED_OUT / CANCELLED
 *             and interrupt the worker; anything it returns later is ignored
 *
 * A worker that returns OK after cancellation (a best-effort partial result)
 * within the grace period wins; every other late outcome is replaced by the
 * interruption outcome for the cancel reason.
 */
@Slf4j
@Component
public class TaskOrchestrator {

    private final ExecutorService          operationExecutor;
    private final ScheduledExecutorService operationScheduler;
    private final Clock                    clock;
    private final Duration                 progressInterval;
    private final Duration                 cancellationGrace;

    public TaskOrchestrator(@Qualifier("operationExecutor") ExecutorService operationExecutor,
                            @Qualifier("operationScheduler") ScheduledExecutorService operationScheduler,
                            Clock clock,
                            GatewayProperties properties) {
        this.operationExecutor  = operationExecutor;
        this.operationScheduler = operationScheduler;
        this.clock              = clock;
        this.progressInterval   = properties.orchestrator().progressInterval();
        this.cancellationGrace  = properties.orchestrator().cancellationGrace();
    }

    /** Opens the operation scope of one session. */
    public OperationScope openScope(String owner) {
        return new OperationScope(this, owner);
    }

    // ── Launch ───────────────────────────────────────────────────────────────

    <T> OperationHandle<T> launch(String owner,
                                  OperationKind kind,
                                  Operation<T> operation,
                                  Duration budget,
                                  List<String> progressStages,
                                  Consumer<OperationEvent> listener) {
        Instant deadline = clock.instant().plus(budget);
        OperationHandle<T> handle = new OperationHandle<>(owner, kind, deadline, listener);
        log.debug("[Orchestrator] Launching {} budget={}ms", handle, budget.toMillis());

        scheduleProgress(handle, progressStages);

        OperationContext context = new HandleContext(handle);
        handle.worker(operationExecutor.submit(() -> runWork(handle, operation, context)));

        ScheduledFuture<?> watchdog = operationScheduler.schedule(
                () -> cancel(handle, CancelReason.DEADLINE), budget.toMillis(), TimeUnit.MILLISECONDS);
        handle.result().whenComplete((outcome, failure) -> watchdog.cancel(false));
        return handle;
    }

    private void scheduleProgress(OperationHandle<?> handle, List<String> stages) {
        if (stages.isEmpty()) {
            return;
        }
        handle.emitProgress(stages.get(0));
        if (stages.size() == 1) {
            return;
        }
        Iterator<String> remaining = List.copyOf(stages.subList(1, stages.size())).iterator();
        long intervalMs = progressInterval.toMillis();
        handle.progressTask(operationScheduler.scheduleAtFixedRate(() -> {
            if (!remaining.hasNext() || !handle.emitProgress(remaining.next()) || !remaining.hasNext()) {
                handle.stopProgress();
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS));
    }

    private <T> void runWork(OperationHandle<T> handle, Operation<T> operation, OperationContext context) {
        OperationOutcome<T> outcome;
        try {
            outcome = operation.execute(context);
            if (outcome == null) {
                outcome = OperationOutcome.failed(ErrorKind.INTERNAL, "Operation returned no outcome");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = context.interruption();
        } catch (Exception e) {
            ErrorKind kind = FailureClassifier.classify(e);
            if (kind == ErrorKind.INTERNAL) {
                log.error("[Orchestrator] {} failed unexpectedly", handle, e);
            } else {
                log.warn("[Orchestrator] {} failed ({}): {}", handle, kind, FailureClassifier.describe(e));
            }
            outcome = OperationOutcome.failed(kind, FailureClassifier.describe(e));
        }

        if (!outcome.isOk() && handle.isCancelled()) {
            outcome = context.interruption();
        }

        if (handle.resolve(outcome)) {
            log.info("[Orchestrator] {} resolved {}", handle, outcome.status());
        } else {
            log.debug("[Orchestrator] {} late {} ignored", handle, outcome.status());
        }
    }

    // ── Await / cancel ───────────────────────────────────────────────────────

    <T> OperationOutcome<T> awaitResult(OperationHandle<T> handle) {
        // Resolution is guaranteed by deadline + grace; the extra second only
        // protects callers against a lost scheduler task.
        Duration remaining = Duration.between(clock.instant(), handle.deadline());
        long waitMs = Math.max(0, remaining.toMillis()) + cancellationGrace.toMillis() + 1_000;
        try {
            return handle.result().get(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(handle, CancelReason.REQUESTED);
            return OperationOutcome.cancelled("Interrupted while waiting for the result");
        } catch (TimeoutException e) {
            handle.signalCancel(CancelReason.DEADLINE);
            handle.resolve(interruptionFor(CancelReason.DEADLINE));
            handle.abandonWorker();
            return handle.result().getNow(interruptionFor(CancelReason.DEADLINE));
        } catch (ExecutionException e) {
            return OperationOutcome.failed(ErrorKind.INTERNAL, FailureClassifier.describe(e));
        }
    }

    void cancel(OperationHandle<?> handle, CancelReason reason) {
        if (handle.isResolved() || !handle.signalCancel(reason)) {
            return;
        }
        log.info("[Orchestrator] {} cancellation signalled ({})", handle, reason);
        operationScheduler.schedule(() -> expire(handle, reason),
                cancellationGrace.toMillis(), TimeUnit.MILLISECONDS);
    }

    private <T> void expire(OperationHandle<T> handle, CancelReason reason) {
        if (handle.resolve(interruptionFor(reason))) {
            log.warn("[Orchestrator] {} abandoned after {}ms grace ({})",
                    handle, cancellationGrace.toMillis(), reason);
        }
        handle.abandonWorker();
    }

    static <R> OperationOutcome<R> interruptionFor(CancelReason reason) {
        return reason == CancelReason.DEADLINE
                ? OperationOutcome.timedOut("Operation exceeded its deadline")
                : OperationOutcome.cancelled("Operation cancelled");
    }

    // ── Context handed to the work ───────────────────────────────────────────

    private final class HandleContext implements OperationContext {

        private final OperationHandle<?> handle;

        HandleContext(OperationHandle<?> handle) {
            this.handle = handle;
        }

        @Override
        public boolean isCancelled() {
            return handle.isCancelled();
        }

        @Override
        public Optional<CancelReason> cancelReason() {
            return Optional.ofNullable(handle.cancellation().getNow(null));
        }

        @Override
        public Duration remaining() {
            Duration left = Duration.between(clock.instant(), handle.deadline());
            return left.isNegative() ? Duration.ZERO : left;
        }

        @Override
        public <R> OperationOutcome<R> interruption() {
            return interruptionFor(cancelReason().orElse(CancelReason.REQUESTED));
        }

        @Override
        public <R> OperationOutcome<R> await(String stage, Callable<R> call, Duration timeout) {
            if (isCancelled()) {
                return interruption();
            }
            Duration left  = remaining();
            Duration bound = timeout.compareTo(left) < 0 ? timeout : left;
            if (bound.isZero() || bound.isNegative()) {
                return OperationOutcome.timedOut("%s exceeded the operation deadline".formatted(stage));
            }

            CompletableFuture<R> callResult = new CompletableFuture<>();
            Future<?> task = operationExecutor.submit(() -> {
                try {
                    callResult.complete(call.call());
                } catch (Throwable t) {
                    callResult.completeExceptionally(t);
                }
            });

            try {
                CompletableFuture.anyOf(callResult, handle.cancellation())
                        .get(bound.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                task.cancel(true);
                log.debug("[Orchestrator] {} stage '{}' timed out after {}ms", handle, stage, bound.toMillis());
                return OperationOutcome.timedOut("%s timed out after %d seconds"
                        .formatted(stage, Math.max(1, bound.toSeconds())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                task.cancel(true);
                return interruption();
            } catch (ExecutionException e) {
                // callResult failed; inspected below
            }

            if (callResult.isDone()) {
                try {
                    return OperationOutcome.ok(callResult.join());
                } catch (CompletionException | CancellationException e) {
                    Throwable cause = FailureClassifier.unwrap(e);
                    ErrorKind kind = FailureClassifier.classify(cause);
                    log.debug("[Orchestrator] {} stage '{}' failed ({}): {}",
                            handle, stage, kind, FailureClassifier.describe(cause));
                    return OperationOutcome.failed(kind, "%s failed: %s"
                            .formatted(stage, FailureClassifier.describe(cause)));
                }
            }

            task.cancel(true);
            return interruption();
        }
    }
}
