package com.bank.lending.application.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Applicant's corrected value for a rejected field.
 * {@code newValue} is a string for scalar fields and an object for name, address and employment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorrectionRequest {

    private String fieldName;
    private Object newValue;
}
