package com.bank.lending.application.model;

import lombok.Value;

import java.util.List;

/**
 * Result of a reconciliation pass over an applicant's pending applications
 */
@Value
public class ReconciliationOutcome {

    public enum Status {
        ADVANCED,
        BLOCKED_BY_FIELDS,
        BLOCKED_BY_DOCUMENTS,
        NOTHING_PENDING
    }

    Status status;
    List<Long> advancedApplicationIds;
    String reason;

    public static ReconciliationOutcome advanced(List<Long> applicationIds, String reason) {
        return new ReconciliationOutcome(Status.ADVANCED, List.copyOf(applicationIds), reason);
    }

    public static ReconciliationOutcome blocked(Status status) {
        return new ReconciliationOutcome(status, List.of(), null);
    }

    public static ReconciliationOutcome nothingPending() {
        return new ReconciliationOutcome(Status.NOTHING_PENDING, List.of(), null);
    }

    public boolean isAdvanced() {
        return status == Status.ADVANCED && !advancedApplicationIds.isEmpty();
    }
}
