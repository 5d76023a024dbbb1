package com.bank.lending.domain.enums;

/**
 * Where the live value of a verifiable field is kept
 */
public enum FieldStorage {
    APPLICANT_COLUMN,
    NAME_COLUMNS,
    ADDRESS_ROW,
    EMPLOYMENT_ROW
}
