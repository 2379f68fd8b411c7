package com.vanityhub.server.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps client input errors raised inside controllers to 400 responses in
 * the pipeline's {@code {error, details}} shape.
 *
 * Other exceptions are not handled here. They propagate
 * to {@code SecurityMiddleware}, which answers with an opaque 500 and audits it.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidAuditQueryException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidAuditQuery(InvalidAuditQueryException ex,
                                                                       WebRequest request) {
        log.warn("[Validation] Invalid audit query on {}: {}", request.getDescription(false), ex.getMessage());
        return badRequest("Invalid query", List.of(ex.getParameter() + ": " + ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                  WebRequest request) {
        String expected = ex.getRequiredType() == null ? "value" : ex.getRequiredType().getSimpleName();
        log.warn("[Validation] Bad parameter '{}' on {}: {}", ex.getName(), request.getDescription(false), ex.getValue());
        return badRequest("Invalid query",
                List.of(ex.getName() + ": Expected " + expected + ", received '" + ex.getValue() + "'"));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String error, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
