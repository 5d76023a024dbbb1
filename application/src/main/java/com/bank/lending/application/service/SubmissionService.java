package com.bank.lending.application.service;

import com.bank.lending.application.config.LendingProperties;
import com.bank.lending.domain.completeness.CompletenessChecker;
import com.bank.lending.domain.completeness.CompletenessReport;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.DocumentType;
import com.bank.lending.domain.enums.TransitionSource;
import com.bank.lending.domain.exception.IllegalTransitionException;
import com.bank.lending.domain.exception.IncompleteDataException;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.DocumentRepository;
import com.bank.lending.infrastructure.persistence.repository.ReferenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applicant submission and cancellation of an application
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    static final String SUBMITTED_REASON = "Application submitted by applicant";
    static final String CANCELLED_REASON = "Cancelled by applicant";

    private static final Set<ApplicationStatus> SUBMITTABLE = EnumSet.of(ApplicationStatus.DRAFT, ApplicationStatus.DOCS_PENDING);

    private final ApplicantRepository applicantRepository;
    private final ApplicationRepository applicationRepository;
    private final DocumentRepository documentRepository;
    private final ReferenceRepository referenceRepository;
    private final CompletenessChecker completenessChecker;
    private final ApplicationStatusService statusService;
    private final LendingProperties properties;
    private final MetricsService metricsService;

    public SubmissionService(
            ApplicantRepository applicantRepository,
            ApplicationRepository applicationRepository,
            DocumentRepository documentRepository,
            ReferenceRepository referenceRepository,
            CompletenessChecker completenessChecker,
            ApplicationStatusService statusService,
            LendingProperties properties,
            MetricsService metricsService) {
        this.applicantRepository = applicantRepository;
        this.applicationRepository = applicationRepository;
        this.documentRepository = documentRepository;
        this.referenceRepository = referenceRepository;
        this.completenessChecker = completenessChecker;
        this.statusService = statusService;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    /**
     * Submit a DRAFT or DOCS_PENDING application once every requirement is met
     *
     * @throws IllegalTransitionException if the application is in any other status
     * @throws IncompleteDataException listing every unmet requirement
     */
    @Transactional
    public ApplicationEntity submit(Long applicationId, Long userId, Actor actor) {
        ApplicantEntity applicant = applicantRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        ApplicationEntity application = applicationRepository.findByIdAndApplicantId(applicationId, applicant.getId())
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));

        if (!SUBMITTABLE.contains(application.getStatus())) {
            throw new IllegalTransitionException(application.getStatus(), ApplicationStatus.SUBMITTED,
                    String.format("Only DRAFT or DOCS_PENDING applications can be submitted (current: %s)",
                            application.getStatus()));
        }

        Map<String, String> errors = checkCompleteness(applicant, application);
        if (!errors.isEmpty()) {
            metricsService.incrementIncompleteSubmissions();
            log.warn("Application {} not submitted, missing: {}", applicationId, errors.keySet());
            throw new IncompleteDataException(errors);
        }

        statusService.apply(application, ApplicationStatus.SUBMITTED, SUBMITTED_REASON, actor, TransitionSource.APPLICANT);
        return application;
    }

    /**
     * Cancel an application on the applicant's request
     */
    @Transactional
    public ApplicationEntity cancel(Long applicationId, Long userId, String reason, Actor actor) {
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        ApplicationEntity application = applicationRepository.findByIdAndApplicantId(applicationId, applicant.getId())
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));

        String effectiveReason = reason != null && !reason.isBlank() ? reason : CANCELLED_REASON;
        statusService.apply(application, ApplicationStatus.CANCELLED, effectiveReason, actor, TransitionSource.APPLICANT);
        return application;
    }

    /**
     * Every unmet submission requirement, keyed by requirement
     */
    public Map<String, String> checkCompleteness(ApplicantEntity applicant, ApplicationEntity application) {
        Map<String, String> errors = new LinkedHashMap<>();
        CompletenessReport report = completenessChecker.check(applicant.getId(), application.getProductCode());

        if (!report.isPersonalDataComplete()) {
            errors.put("personal_data", "Personal data is required (name, birth date, gender, CURP)");
        }
        if (!report.isAddressComplete()) {
            errors.put("address", "Address is required");
        }
        if (!report.isEmploymentComplete()) {
            errors.put("employment", "Employment info is required");
        }
        if (!report.isSignatureCaptured()) {
            errors.put("signature", "Signature is required");
        }
        if (application.getPurpose() == null || application.getPurpose().isBlank()) {
            errors.put("purpose", "Loan purpose is required");
        }

        List<String> missingDocuments = missingDocuments(application, report.getRequiredDocuments());
        if (!missingDocuments.isEmpty()) {
            errors.put("documents", "Missing required documents: " + String.join(", ", missingDocuments));
        }

        long references = referenceRepository.countByApplicationId(application.getId());
        int minimum = properties.getReferences().getMinToSubmit();
        if (references < minimum) {
            errors.put("references", String.format("At least %d references required, only %d provided",
                    minimum, references));
        }
        return errors;
    }

    /**
     * Required types with no non-rejected upload, compared through their canonical type
     */
    private List<String> missingDocuments(ApplicationEntity application, List<DocumentType> required) {
        if (required == null || required.isEmpty()) {
            return List.of();
        }
        Set<DocumentType> uploaded = documentRepository.findByApplicationIdOrderByIdAsc(application.getId()).stream()
                .filter(document -> document.getStatus() != DocumentStatus.REJECTED)
                .map(document -> document.getType().canonical())
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DocumentType.class)));

        return required.stream()
                .filter(type -> !uploaded.contains(type.canonical()))
                .map(DocumentType::name)
                .distinct()
                .collect(Collectors.toList());
    }
}
