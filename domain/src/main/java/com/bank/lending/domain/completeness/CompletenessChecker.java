package com.bank.lending.domain.completeness;

/**
 * Supplies completeness facts for the submission gate.
 * Required documents are owned by product configuration.
 */
public interface CompletenessChecker {

    CompletenessReport check(Long applicantId, String productCode);
}
