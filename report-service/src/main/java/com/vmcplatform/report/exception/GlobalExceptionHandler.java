package com.vmcplatform.report.exception;

import com.vmcplatform.common.exception.ConsistencyException;
import com.vmcplatform.common.exception.InputGuardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

/**
 * A report run either completes or fails as a whole; no partial report is ever returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InputGuardException.class)
    public ResponseEntity<ApiError> handleInputGuard(InputGuardException ex) {
        log.warn("Rejected report request. operation={} reason={}", ex.getOperation(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), ex.getOperation(), ex.getMessage());
    }

    /** Rater sets that do not match the configured rater count abort the whole run. */
    @ExceptionHandler(ConsistencyException.class)
    public ResponseEntity<ApiError> handleConsistency(ConsistencyException ex) {
        log.error("Report aborted on inconsistent codings. operation={} reason={}", ex.getOperation(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), ex.getOperation(), ex.getMessage());
    }

    @ExceptionHandler({DataAccessResourceFailureException.class, TransientDataAccessException.class})
    public ResponseEntity<ApiError> handleStoreUnavailable(Exception ex) {
        log.error("Store unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "StoreUnavailable", null,
                     "Database temporarily unavailable. Please retry.");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request rejected. status={} reason={}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode())
            .body(new ApiError("RequestRejected", null, ex.getReason(), Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", null, "An unexpected error occurred");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String operation, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, operation, message, Instant.now()));
    }
}
