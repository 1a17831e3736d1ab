package com.taskforge.dispatch.api;

import com.taskforge.core.audit.AuditLogParseException;
import com.taskforge.core.concurrent.CapacityExceededException;
import com.taskforge.core.router.RateLimitExceededException;
import com.taskforge.core.scheduler.InvalidCronExpressionException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps core exceptions to JSON error bodies for the REST controllers.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidCronExpressionException.class, AuditLogParseException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler({CapacityExceededException.class, RateLimitExceededException.class})
    public ResponseEntity<Map<String, Object>> handleCapacity(RuntimeException ex, HttpServletRequest request) {
        log.info("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex, request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex, request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, Exception ex,
                                                               HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", ex.getMessage());
        out.put("status", status.value());
        out.put("path", request.getRequestURI());
        out.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(out);
    }
}
