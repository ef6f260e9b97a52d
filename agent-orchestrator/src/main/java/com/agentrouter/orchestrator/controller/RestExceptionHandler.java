package com.agentrouter.orchestrator.controller;

import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.exception.InvalidQueryException;
import com.agentrouter.orchestrator.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Maps the routing error taxonomy onto HTTP: invalid input → 400, unknown session → 404,
 * agent index unusable with no fallback → 503.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    private final Clock clock;

    public RestExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler({InvalidQueryException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        log.info("Request rejected. reason={}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "invalid_request", e);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(SessionNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(AgentIndexException.class)
    public ResponseEntity<ErrorResponse> indexUnavailable(AgentIndexException e) {
        log.error("Agent index unavailable for request. reason={}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "agent_index_unavailable", e);
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, String error, RuntimeException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, e.getMessage(), clock.instant()));
    }
}
