package com.bank.lending.domain.enums;

/**
 * Review status of an uploaded document
 */
public enum DocumentStatus {
    PENDING,
    APPROVED,
    REJECTED
}
