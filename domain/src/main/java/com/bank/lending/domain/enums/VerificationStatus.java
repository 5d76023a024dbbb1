package com.bank.lending.domain.enums;

/**
 * Review outcome of a single verifiable field
 */
public enum VerificationStatus {
    PENDING("Pendiente"),
    VERIFIED("Verificado"),
    REJECTED("Rechazado"),
    CORRECTED("Corregido");

    private final String label;

    VerificationStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
