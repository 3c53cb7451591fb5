package com.z254.concord.conductor.api;

import com.z254.concord.conductor.exception.ConductorException;
import com.z254.concord.conductor.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.stream.Collectors;

/**
 * Turns conductor errors into plain-text responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConductorException.class)
    public ResponseEntity<String> handleConductorException(ConductorException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("{} error: {}", e.getKind(), e.getMessage(), e);
        } else {
            log.debug("{} error: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(e.getKind() + ": " + e.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<String> handleBindException(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .contentType(MediaType.TEXT_PLAIN)
                .body(ErrorKind.VALIDATION + ": " + message);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case TRANSPORT -> HttpStatus.BAD_GATEWAY;
            case ORPHANED_COMPLETION -> HttpStatus.GONE;
            case PERSISTENCE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
