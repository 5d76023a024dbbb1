package com.bank.lending.domain.exception;

import com.bank.lending.domain.enums.VerifiableField;

/**
 * Correction had no record to land on (no primary address, no current employment)
 */
public class CorrectionNotAppliedException extends LendingException {

    private final VerifiableField field;

    public CorrectionNotAppliedException(VerifiableField field) {
        super(String.format("No se encontró un registro para corregir: %s", field.getLabel()));
        this.field = field;
    }

    public VerifiableField getField() {
        return field;
    }
}
