package com.bank.lending.domain.exception;

/**
 * Referenced applicant, application, verification or document does not exist
 */
public class NotFoundException extends LendingException {

    public NotFoundException(String message) {
        super(message);
    }
}
