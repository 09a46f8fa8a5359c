package com.openforge.scanmate.web;

import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.Operation;
import com.openforge.scanmate.task.OperationKind;
import com.openforge.scanmate.task.OperationOutcome;
import com.openforge.scanmate.task.OperationScope;
import com.openforge.scanmate.task.TaskOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;

/**
 * Runs an operation for a plain HTTP request: same deadline and cancellation
 * rules as the socket endpoints, but the request thread waits for the outcome.
 */
@Component
@RequiredArgsConstructor
public class OperationRunner {

    private final TaskOrchestrator orchestrator;

    public <T> OperationOutcome<T> run(String user, OperationKind kind, Operation<T> operation, Duration budget) {
        try (OperationScope scope = orchestrator.openScope("http:" + user)) {
            return scope.awaitResult(scope.start(kind, operation, budget));
        }
    }

    /** {status:"success", data} for OK, otherwise the error envelope with a status matching the kind. */
    public static <T> ResponseEntity<ApiResponse> respond(OperationOutcome<T> outcome, Function<T, Object> data) {
        if (outcome.isOk()) {
            return ResponseEntity.ok(ApiResponse.success(data.apply(outcome.payload())));
        }
        return ResponseEntity.status(statusFor(outcome.errorKind()))
                .body(ApiResponse.error(outcome.message()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case VALIDATION           -> HttpStatus.BAD_REQUEST;
            case UPSTREAM_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT              -> HttpStatus.GATEWAY_TIMEOUT;
            case CANCELLED            -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL             -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
