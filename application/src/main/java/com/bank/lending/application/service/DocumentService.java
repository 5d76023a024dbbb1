package com.bank.lending.application.service;

import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.DocumentType;
import com.bank.lending.domain.enums.TimelineAction;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
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
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registers uploaded documents against an application.
 * File storage is handled elsewhere; this records the document and its timeline entry.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private static final Set<ApplicationStatus> UPLOADABLE = EnumSet.of(
            ApplicationStatus.DRAFT,
            ApplicationStatus.SUBMITTED,
            ApplicationStatus.IN_REVIEW,
            ApplicationStatus.DOCS_PENDING,
            ApplicationStatus.CORRECTIONS_PENDING);

    private final ApplicantRepository applicantRepository;
    private final ApplicationRepository applicationRepository;
    private final DocumentRepository documentRepository;
    private final CorrectionCycleReconciler reconciler;
    private final AuditSink auditSink;
    private final Clock clock;

    public DocumentService(
            ApplicantRepository applicantRepository,
            ApplicationRepository applicationRepository,
            DocumentRepository documentRepository,
            CorrectionCycleReconciler reconciler,
            AuditSink auditSink,
            Clock clock) {
        this.applicantRepository = applicantRepository;
        this.applicationRepository = applicationRepository;
        this.documentRepository = documentRepository;
        this.reconciler = reconciler;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    /**
     * Record a new PENDING upload. A pending upload of the same type is replaced; rejected uploads stay
     * until a replacement is approved. Reconciles the applicant when the application awaits corrections.
     */
    @Transactional
    public DocumentEntity registerUpload(Long applicationId, Long userId, String typeCode, String fileName, Actor actor) {
        DocumentType type = DocumentType.tryFrom(typeCode)
                .orElseThrow(() -> ValidationException.of("type", "Tipo de documento no válido"));
        if (fileName == null || fileName.isBlank()) {
            throw ValidationException.of("file_name", "El nombre del archivo es obligatorio");
        }

        ApplicantEntity applicant = applicantRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        ApplicationEntity application = applicationRepository.findByIdAndApplicantId(applicationId, applicant.getId())
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));

        if (type != DocumentType.SELFIE && !UPLOADABLE.contains(application.getStatus())) {
            throw ValidationException.of("application", "Cannot upload documents in current status");
        }

        List<DocumentEntity> sameType = documentRepository.findByApplicationIdOrderByIdAsc(applicationId).stream()
                .filter(existing -> existing.getType().isEquivalentTo(type))
                .collect(Collectors.toList());
        if (sameType.stream().anyMatch(existing -> existing.getStatus() == DocumentStatus.APPROVED)) {
            throw ValidationException.of("type", "No se puede reemplazar un documento verificado");
        }
        List<DocumentEntity> replaced = sameType.stream()
                .filter(existing -> existing.getStatus() == DocumentStatus.PENDING)
                .collect(Collectors.toList());
        if (!replaced.isEmpty()) {
            documentRepository.deleteAll(replaced);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        DocumentEntity document = documentRepository.save(DocumentEntity.builder()
                .applicationId(applicationId)
                .type(type)
                .status(DocumentStatus.PENDING)
                .fileName(fileName)
                .uploadedAt(now)
                .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("document", type.name());
        payload.put("file_name", fileName);
        payload.put("replaced", !replaced.isEmpty());
        application.appendTimeline(TimelineEntry.of(TimelineAction.DOC_UPLOADED.name(), payload, actor, now));
        application.setUpdatedAt(now);
        applicationRepository.save(application);

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("user_id", actor != null ? actor.getId() : null);
        audit.put("applicant_id", applicant.getId());
        audit.put("entity_type", "Document");
        audit.put("entity_id", document.getId());
        audit.put("new_values", payload);
        auditSink.emit(AuditAction.DOCUMENT_UPLOADED, applicant.getTenantId(), audit);

        log.info("Document {} ({}) registered for application {}", document.getId(), type, applicationId);

        if (application.getStatus() == ApplicationStatus.CORRECTIONS_PENDING) {
            reconciler.reconcile(applicant, actor);
        }
        return document;
    }

    @Transactional(readOnly = true)
    public List<DocumentEntity> listDocuments(Long applicationId, Long userId) {
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        applicationRepository.findByIdAndApplicantId(applicationId, applicant.getId())
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));
        return documentRepository.findByApplicationIdOrderByIdAsc(applicationId);
    }
}
