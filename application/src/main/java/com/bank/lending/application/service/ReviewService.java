package com.bank.lending.application.service;

import com.bank.lending.application.statemachine.ApplicationStateMachine;
import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.TimelineAction;
import com.bank.lending.domain.enums.TransitionSource;
import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.entity.DataVerificationEntity;
import com.bank.lending.infrastructure.persistence.entity.DocumentEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Staff review: field verification, document review and manual status changes.
 * Rejections open a correction cycle; approvals of replacement documents may close it.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ApplicantRepository applicantRepository;
    private final ApplicationRepository applicationRepository;
    private final DocumentRepository documentRepository;
    private final FieldVerificationStore verificationStore;
    private final ApplicationStateMachine stateMachine;
    private final ApplicationStatusService statusService;
    private final CorrectionCycleReconciler reconciler;
    private final AuditSink auditSink;
    private final Clock clock;

    public ReviewService(
            ApplicantRepository applicantRepository,
            ApplicationRepository applicationRepository,
            DocumentRepository documentRepository,
            FieldVerificationStore verificationStore,
            ApplicationStateMachine stateMachine,
            ApplicationStatusService statusService,
            CorrectionCycleReconciler reconciler,
            AuditSink auditSink,
            Clock clock) {
        this.applicantRepository = applicantRepository;
        this.applicationRepository = applicationRepository;
        this.documentRepository = documentRepository;
        this.verificationStore = verificationStore;
        this.stateMachine = stateMachine;
        this.statusService = statusService;
        this.reconciler = reconciler;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    @Transactional
    public DataVerificationEntity verifyField(Long applicationId, String fieldName, Actor reviewer) {
        VerifiableField field = VerifiableField.fromCode(fieldName);
        ApplicationEntity application = loadApplication(applicationId);
        ApplicantEntity applicant = lockApplicant(application.getApplicantId());

        DataVerificationEntity verification = verificationStore.verify(applicant, field, reviewer);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field.getCode());
        payload.put("field_label", field.getLabel());
        payload.put("verified", true);
        appendTimeline(application, TimelineAction.DATA_VERIFIED, payload, reviewer);

        auditSink.emit(AuditAction.DATA_VERIFIED, applicant.getTenantId(),
                verificationAudit(applicant, verification, field, reviewer, null));
        return verification;
    }

    /**
     * Reject a field and move the application to CORRECTIONS_PENDING when that move is legal
     */
    @Transactional
    public DataVerificationEntity rejectField(Long applicationId, String fieldName, String reason, Actor reviewer) {
        if (reason == null || reason.isBlank()) {
            throw ValidationException.of("rejection_reason", "El motivo de rechazo es obligatorio");
        }
        VerifiableField field = VerifiableField.fromCode(fieldName);
        ApplicationEntity application = loadApplication(applicationId);
        ApplicantEntity applicant = lockApplicant(application.getApplicantId());

        DataVerificationEntity verification = verificationStore.reject(applicant, field, reason, reviewer);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field.getCode());
        payload.put("field_label", field.getLabel());
        payload.put("verified", false);
        payload.put("rejection_reason", reason);
        appendTimeline(application, TimelineAction.DATA_VERIFIED, payload, reviewer);

        openCorrectionCycle(application, "Dato rechazado: " + field.getLabel(), reviewer);

        auditSink.emit(AuditAction.DATA_REJECTED, applicant.getTenantId(),
                verificationAudit(applicant, verification, field, reviewer, reason));
        return verification;
    }

    /**
     * Approve or reject an uploaded document.
     * Approving supersedes earlier rejected uploads of the same type and may close the correction cycle.
     */
    @Transactional
    public DocumentEntity reviewDocument(Long documentId, boolean approve, String reason, Actor reviewer) {
        if (!approve && (reason == null || reason.isBlank())) {
            throw ValidationException.of("rejection_reason", "El motivo de rechazo es obligatorio");
        }
        DocumentEntity document = documentRepository.findById(documentId)
                .orElseThrow(() -> new NotFoundException("Documento no encontrado"));
        ApplicationEntity application = loadApplication(document.getApplicationId());
        ApplicantEntity applicant = lockApplicant(application.getApplicantId());

        OffsetDateTime now = OffsetDateTime.now(clock);
        document.setStatus(approve ? DocumentStatus.APPROVED : DocumentStatus.REJECTED);
        document.setRejectionReason(approve ? null : reason);
        document.setReviewedAt(now);
        document.setReviewedBy(reviewer != null ? reviewer.getId() : null);
        documentRepository.save(document);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("document", document.getType().name());
        payload.put("status", document.getStatus().name());
        payload.put("rejection_reason", document.getRejectionReason());
        appendTimeline(application, TimelineAction.DOC_REVIEWED, payload, reviewer);

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("user_id", reviewer != null ? reviewer.getId() : null);
        audit.put("applicant_id", applicant.getId());
        audit.put("entity_type", "Document");
        audit.put("entity_id", document.getId());
        audit.put("new_values", payload);
        auditSink.emit(AuditAction.DOCUMENT_REVIEWED, applicant.getTenantId(), audit);

        if (approve) {
            supersedeRejected(document);
            if (application.getStatus() == ApplicationStatus.CORRECTIONS_PENDING) {
                reconciler.reconcile(applicant, reviewer);
            }
        } else {
            openCorrectionCycle(application, "Documento rechazado: " + document.getType().getDescription(), reviewer);
        }
        return document;
    }

    /**
     * Manual status change by staff
     */
    @Transactional
    public ApplicationEntity changeStatus(Long applicationId, ApplicationStatus target, String reason, Actor reviewer) {
        ApplicationEntity application = loadApplication(applicationId);
        statusService.apply(application, target, reason, reviewer, TransitionSource.STAFF);
        return application;
    }

    private void openCorrectionCycle(ApplicationEntity application, String reason, Actor reviewer) {
        ApplicationStatus current = application.getStatus();
        if (current == ApplicationStatus.CORRECTIONS_PENDING) {
            return;
        }
        if (stateMachine.canTransition(current, ApplicationStatus.CORRECTIONS_PENDING, TransitionSource.STAFF)) {
            statusService.apply(application, ApplicationStatus.CORRECTIONS_PENDING, reason, reviewer, TransitionSource.STAFF);
        } else {
            log.warn("Application {} in {} cannot move to CORRECTIONS_PENDING, status unchanged",
                    application.getId(), current);
        }
    }

    private void supersedeRejected(DocumentEntity approved) {
        List<DocumentEntity> superseded = documentRepository.findByApplicationIdOrderByIdAsc(approved.getApplicationId())
                .stream()
                .filter(candidate -> !candidate.getId().equals(approved.getId()))
                .filter(candidate -> candidate.getStatus() == DocumentStatus.REJECTED)
                .filter(candidate -> candidate.getType().isEquivalentTo(approved.getType()))
                .collect(Collectors.toList());
        if (!superseded.isEmpty()) {
            documentRepository.deleteAll(superseded);
            log.info("Removed {} rejected {} upload(s) of application {} superseded by document {}",
                    superseded.size(), approved.getType(), approved.getApplicationId(), approved.getId());
        }
    }

    private void appendTimeline(ApplicationEntity application, TimelineAction action,
                                Map<String, Object> payload, Actor actor) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        application.appendTimeline(TimelineEntry.of(action.name(), payload, actor, now));
        application.setUpdatedAt(now);
        applicationRepository.save(application);
    }

    private Map<String, Object> verificationAudit(ApplicantEntity applicant, DataVerificationEntity verification,
                                                  VerifiableField field, Actor reviewer, String reason) {
        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("status", verification.getStatus().name());
        newValues.put("rejection_reason", reason);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", reviewer != null ? reviewer.getId() : null);
        payload.put("applicant_id", applicant.getId());
        payload.put("entity_type", "DataVerification");
        payload.put("entity_id", verification.getId());
        payload.put("new_values", newValues);
        payload.put("metadata", Map.of("field_name", field.getCode(), "field_label", field.getLabel()));
        return payload;
    }

    private ApplicationEntity loadApplication(Long applicationId) {
        return applicationRepository.findById(applicationId)
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));
    }

    private ApplicantEntity lockApplicant(Long applicantId) {
        return applicantRepository.findByIdForUpdate(applicantId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
    }
}
