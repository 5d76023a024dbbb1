package com.bank.lending.domain.exception;

import com.bank.lending.domain.enums.ApplicationStatus;

/**
 * Requested status change is not allowed from the current status
 */
public class IllegalTransitionException extends LendingException {

    private final ApplicationStatus from;
    private final ApplicationStatus to;

    public IllegalTransitionException(ApplicationStatus from, ApplicationStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public ApplicationStatus getFrom() {
        return from;
    }

    public ApplicationStatus getTo() {
        return to;
    }
}
