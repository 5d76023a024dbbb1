package com.bank.lending.domain.exception;

/**
 * Field name is not one of the verifiable fields
 */
public class FieldNotVerifiableException extends LendingException {

    private final String fieldName;

    public FieldNotVerifiableException(String fieldName) {
        super(String.format("Field '%s' is not verifiable", fieldName));
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
