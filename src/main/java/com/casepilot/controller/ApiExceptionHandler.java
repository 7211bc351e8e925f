package com.casepilot.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.casepilot.core.error.InvalidInputException;
import com.casepilot.core.issue.IssueNotFoundException;
import com.casepilot.core.replay.ReplaySessionNotFoundException;
import com.casepilot.core.trace.RunTraceNotFoundException;

import java.util.Map;

/**
 * Maps domain exceptions to HTTP status codes. Investigation failures are not errors
 * here: they come back as FAILED traces with status 200.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> badRequest(InvalidInputException e) {
        log.warn("[API] Bad request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({
            IssueNotFoundException.class,
            RunTraceNotFoundException.class,
            ReplaySessionNotFoundException.class
    })
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
