package com.byterox.sentinel.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the SENTINEL exception taxonomy onto HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.debug("Validation failed: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBinding(WebExchangeBindException ex) {
        List<String> errors = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Invalid request", errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request body", null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null);
    }

    @ExceptionHandler(TemplateException.class)
    public ResponseEntity<Map<String, Object>> handleTemplate(TemplateException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "template_error", ex.getMessage(), null);
    }

    @ExceptionHandler({ScanProviderException.class, TransportException.class})
    public ResponseEntity<Map<String, Object>> handleUpstream(SentinelException ex) {
        log.warn("Upstream failure surfaced to caller: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "upstream_error", ex.getMessage(), null);
    }

    @ExceptionHandler(ActionException.class)
    public ResponseEntity<Map<String, Object>> handleAction(ActionException ex) {
        return body(HttpStatus.BAD_GATEWAY, "action_error", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error", null);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error,
                                                     String message, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
