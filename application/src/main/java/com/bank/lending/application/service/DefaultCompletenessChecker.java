package com.bank.lending.application.service;

import com.bank.lending.application.config.LendingProperties;
import com.bank.lending.domain.completeness.CompletenessChecker;
import com.bank.lending.domain.completeness.CompletenessReport;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.infrastructure.persistence.entity.AddressEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.repository.AddressRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.EmploymentRecordRepository;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Completeness facts read from the applicant profile, address, employment and signature
 */
@Component
public class DefaultCompletenessChecker implements CompletenessChecker {

    private final ApplicantRepository applicantRepository;
    private final AddressRepository addressRepository;
    private final EmploymentRecordRepository employmentRecordRepository;
    private final LendingProperties properties;

    public DefaultCompletenessChecker(
            ApplicantRepository applicantRepository,
            AddressRepository addressRepository,
            EmploymentRecordRepository employmentRecordRepository,
            LendingProperties properties) {
        this.applicantRepository = applicantRepository;
        this.addressRepository = addressRepository;
        this.employmentRecordRepository = employmentRecordRepository;
        this.properties = properties;
    }

    @Override
    public CompletenessReport check(Long applicantId, String productCode) {
        ApplicantEntity applicant = applicantRepository.findById(applicantId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));

        boolean addressComplete = addressRepository.findPrimaryHomeAddress(applicantId)
                .map(this::isAddressComplete)
                .orElse(false);
        boolean employmentComplete = employmentRecordRepository
                .findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(applicantId)
                .map(employment -> employment.getEmploymentType() != null)
                .orElse(false);

        return CompletenessReport.builder()
                .personalDataComplete(isPersonalDataComplete(applicant))
                .addressComplete(addressComplete)
                .employmentComplete(employmentComplete)
                .signatureCaptured(applicant.getSignatureCapturedAt() != null)
                .requiredDocuments(List.copyOf(properties.requiredDocumentsFor(productCode)))
                .build();
    }

    private boolean isPersonalDataComplete(ApplicantEntity applicant) {
        return hasText(applicant.getFirstName())
                && hasText(applicant.getLastName1())
                && applicant.getBirthDate() != null
                && hasText(applicant.getGender())
                && hasText(applicant.getCurp());
    }

    private boolean isAddressComplete(AddressEntity address) {
        return hasText(address.getStreet()) && hasText(address.getPostalCode());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
