package com.bank.lending.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Submission attempted with unmet requirements. Every failing requirement is reported.
 */
public class IncompleteDataException extends LendingException {

    private final Map<String, String> errors;

    public IncompleteDataException(Map<String, String> errors) {
        super("Application is incomplete");
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
