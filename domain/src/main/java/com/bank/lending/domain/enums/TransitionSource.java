package com.bank.lending.domain.enums;

/**
 * Who is asking for a status change
 */
public enum TransitionSource {
    APPLICANT,   // End user acting on their own application
    STAFF,       // Reviewer / back-office user
    RECONCILER,  // Correction cycle completion, never a direct user action
    SYSTEM       // Downstream sync jobs
}
