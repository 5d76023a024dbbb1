package com.bank.lending.domain.completeness;

import com.bank.lending.domain.enums.DocumentType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Applicant-level completeness flags and the product's required documents
 */
@Value
@Builder
public class CompletenessReport {
    boolean personalDataComplete;
    boolean addressComplete;
    boolean employmentComplete;
    boolean signatureCaptured;
    List<DocumentType> requiredDocuments;
}
