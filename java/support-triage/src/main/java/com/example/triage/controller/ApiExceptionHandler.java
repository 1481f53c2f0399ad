package com.example.triage.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.triage.error.ApprovalNotPendingException;
import com.example.triage.error.ExecutionNotFoundException;
import com.example.triage.error.IllegalTransitionException;
import com.example.triage.error.SessionNotFoundException;
import com.example.triage.error.TriageException;
import com.example.triage.error.UnknownToolException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ApiError(String error, String message) {}

    @ExceptionHandler({SessionNotFoundException.class, ExecutionNotFoundException.class})
    public ResponseEntity<ApiError> notFound(TriageException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", e.getMessage()));
    }

    @ExceptionHandler({ApprovalNotPendingException.class, IllegalTransitionException.class})
    public ResponseEntity<ApiError> conflict(TriageException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError("conflict", e.getMessage()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> concurrentUpdate(OptimisticLockingFailureException e) {
        log.warn("Concurrent update rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ApiError("conflict", "Session was modified concurrently, retry the request"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(UnknownToolException.class)
    public ResponseEntity<ApiError> unknownTool(UnknownToolException e) {
        return ResponseEntity.badRequest().body(new ApiError("unknown_tool", e.getMessage()));
    }

    @ExceptionHandler(TriageException.class)
    public ResponseEntity<ApiError> internal(TriageException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError("internal", e.getMessage()));
    }
}
