package com.stagehand.orchestrator.api;

import com.stagehand.orchestrator.api.dto.ErrorResponse;
import com.stagehand.orchestrator.service.GateViolationException;
import com.stagehand.orchestrator.service.IllegalStageTransitionException;
import com.stagehand.orchestrator.service.NotFoundException;
import com.stagehand.orchestrator.store.StoreException;
import com.stagehand.orchestrator.tracker.IssueTrackerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps service exceptions to HTTP statuses.
 *
 *   NotFoundException                 404
 *   IllegalStageTransitionException   409
 *   IllegalStateException             409
 *   GateViolationException            422
 *   IllegalArgumentException          400
 *   IssueTrackerException             401 for a bad key, otherwise 502
 *   StoreException                    503 when the store stayed busy, otherwise 500
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalStageTransitionException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> conflict(RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(GateViolationException.class)
    public ResponseEntity<ErrorResponse> gateViolation(GateViolationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IssueTrackerException.class)
    public ResponseEntity<ErrorResponse> tracker(IssueTrackerException e) {
        if (e.status() == 401) return respond(HttpStatus.UNAUTHORIZED, e.getMessage());
        log.warn("Issue tracker call failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> store(StoreException e) {
        if (e.isBusy()) return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        log.error("Store failure: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), status.getReasonPhrase(), message));
    }
}
