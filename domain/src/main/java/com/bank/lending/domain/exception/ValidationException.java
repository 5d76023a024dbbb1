package com.bank.lending.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Malformed request; carries one message per offending field
 */
public class ValidationException extends LendingException {

    private final Map<String, String> errors;

    public ValidationException(Map<String, String> errors) {
        super("Error de validación");
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(Map.of(field, message));
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
