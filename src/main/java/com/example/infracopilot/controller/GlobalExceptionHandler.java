package com.example.infracopilot.controller;

import com.example.infracopilot.agent.InvalidRequestException;
import com.example.infracopilot.agent.NarrativeServiceException;
import com.example.infracopilot.session.SessionNotFoundException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.concurrent.CompletionException;

/**
 * Maps request-level failures to {ok: false, code, message}. Degraded health
 * never reaches here; it is reported inside a 200 response.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @Value
    @Builder
    public static class ErrorResponse {
        @Builder.Default
        boolean ok = false;
        String code;
        String message;
        Instant timestamp;
    }

    @ExceptionHandler(NarrativeServiceException.class)
    public ResponseEntity<ErrorResponse> handleNarrativeFailure(NarrativeServiceException e) {
        log.error("Narrative service unavailable: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "NARRATIVE_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request body");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", e.getMessage());
    }

    /** Agent turns complete asynchronously; map what they failed with. */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handleCompletion(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof NarrativeServiceException narrative) {
            return handleNarrativeFailure(narrative);
        }
        if (cause instanceof InvalidRequestException invalid) {
            return handleInvalidRequest(invalid);
        }
        return handleGenericException(cause instanceof Exception ex ? ex : e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
