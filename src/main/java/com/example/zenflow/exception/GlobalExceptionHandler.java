package com.example.zenflow.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps progress errors to RFC 7807 problem details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String BASE_ERROR_URI = "https://zenflow.example.com/errors";

    @ExceptionHandler(InvalidDurationException.class)
    public ResponseEntity<ProblemDetail> handleInvalidDuration(InvalidDurationException ex, ServerHttpRequest request) {
        logger.warn("Rejected session: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid Duration", ex.getMessage(), request, "invalid-duration");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, ServerHttpRequest request) {
        logger.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "bad-request");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex, ServerHttpRequest request) {
        logger.error("Event store unavailable", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Event Store Unavailable",
                "Session history store is unavailable", request, "event-store-unavailable");
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail,
                                                  ServerHttpRequest request, String errorType) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setType(URI.create(BASE_ERROR_URI + "/" + errorType));
        problemDetail.setInstance(URI.create(request.getPath().value()));
        problemDetail.setProperty("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(problemDetail);
    }
}
