package com.bank.lending.domain.enums;

/**
 * Actions written to the audit sink
 */
public enum AuditAction {
    DATA_CORRECTED,
    DATA_VERIFIED,
    DATA_REJECTED,
    DOCUMENT_UPLOADED,
    DOCUMENT_REVIEWED,
    APPLICATION_STATUS_CHANGED
}
