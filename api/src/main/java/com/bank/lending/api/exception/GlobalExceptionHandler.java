package com.bank.lending.api.exception;

import com.bank.lending.domain.exception.CorrectionNotAppliedException;
import com.bank.lending.domain.exception.FieldNotVerifiableException;
import com.bank.lending.domain.exception.IllegalTransitionException;
import com.bank.lending.domain.exception.IncompleteDataException;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps business exceptions to HTTP responses
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.debug("Validation failed: {}", ex.getErrors());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(FieldNotVerifiableException.class)
    public ResponseEntity<Map<String, Object>> handleFieldNotVerifiable(FieldNotVerifiableException ex) {
        log.debug("Unknown field requested: {}", ex.getFieldName());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), Map.of("field_name", ex.getMessage()));
    }

    @ExceptionHandler(IncompleteDataException.class)
    public ResponseEntity<Map<String, Object>> handleIncomplete(IncompleteDataException ex) {
        log.info("Application incomplete: {}", ex.getErrors().keySet());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalTransition(IllegalTransitionException ex) {
        log.warn("Rejected transition {} -> {}: {}", ex.getFrom(), ex.getTo(), ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", ex.getMessage());
        body.put("from", ex.getFrom() != null ? ex.getFrom().name() : null);
        body.put("to", ex.getTo() != null ? ex.getTo().name() : null);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(CorrectionNotAppliedException.class)
    public ResponseEntity<Map<String, Object>> handleNotApplied(CorrectionNotAppliedException ex) {
        log.warn("Correction of {} could not be applied: {}", ex.getField(), ex.getMessage());
        return body(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Cuerpo de la solicitud inválido", null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        return body(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getReason(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error processing request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Error interno del servidor", null);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, Map<String, ?> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        if (errors != null) {
            body.put("errors", errors);
        }
        return ResponseEntity.status(status).body(body);
    }
}
