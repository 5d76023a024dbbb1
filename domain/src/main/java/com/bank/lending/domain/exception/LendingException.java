package com.bank.lending.domain.exception;

/**
 * Base type for business failures surfaced to callers
 */
public abstract class LendingException extends RuntimeException {

    protected LendingException(String message) {
        super(message);
    }
}
