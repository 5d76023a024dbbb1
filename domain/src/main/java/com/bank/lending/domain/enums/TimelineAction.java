package com.bank.lending.domain.enums;

/**
 * Actions recorded on the application timeline
 */
public enum TimelineAction {
    STATUS_CHANGED,
    DATA_CORRECTED,
    DATA_VERIFIED,
    DOC_UPLOADED,
    DOC_REVIEWED,
    REFERENCE_ADDED
}
