package com.bank.lending.application.service;

import com.bank.lending.application.model.ReconciliationOutcome;
import com.bank.lending.application.statemachine.ApplicationStateMachine.TransitionResult;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.DocumentType;
import com.bank.lending.domain.enums.TimelineAction;
import com.bank.lending.domain.enums.TransitionSource;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.StatusHistoryEntry;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides when an applicant's correction cycle is complete and moves every application waiting on
 * corrections back to review.
 *
 * Gate: no REJECTED field and no REJECTED document anywhere in the applicant's applications.
 * The reason recorded on the transition names what changed since the cycle started.
 *
 * Must run inside the caller's transaction, with the applicant row locked.
 */
@Service
public class CorrectionCycleReconciler {

    private static final Logger log = LoggerFactory.getLogger(CorrectionCycleReconciler.class);

    static final String FALLBACK_REASON = "Correcciones completadas";

    private final FieldVerificationStore verificationStore;
    private final DocumentRepository documentRepository;
    private final ApplicationRepository applicationRepository;
    private final ApplicationStatusService statusService;
    private final MetricsService metricsService;

    public CorrectionCycleReconciler(
            FieldVerificationStore verificationStore,
            DocumentRepository documentRepository,
            ApplicationRepository applicationRepository,
            ApplicationStatusService statusService,
            MetricsService metricsService) {
        this.verificationStore = verificationStore;
        this.documentRepository = documentRepository;
        this.applicationRepository = applicationRepository;
        this.statusService = statusService;
        this.metricsService = metricsService;
    }

    public ReconciliationOutcome reconcile(ApplicantEntity applicant, Actor actor) {
        Long applicantId = applicant.getId();

        if (verificationStore.hasRejected(applicantId)) {
            log.debug("Applicant {} still has rejected fields, correction cycle stays open", applicantId);
            metricsService.incrementReconciliationBlocked();
            return ReconciliationOutcome.blocked(ReconciliationOutcome.Status.BLOCKED_BY_FIELDS);
        }
        if (documentRepository.existsByApplicantIdAndStatus(applicantId, DocumentStatus.REJECTED)) {
            log.debug("Applicant {} still has rejected documents, correction cycle stays open", applicantId);
            metricsService.incrementReconciliationBlocked();
            return ReconciliationOutcome.blocked(ReconciliationOutcome.Status.BLOCKED_BY_DOCUMENTS);
        }

        List<ApplicationEntity> pending = applicationRepository
                .findByApplicantIdAndStatusOrderByIdAsc(applicantId, ApplicationStatus.CORRECTIONS_PENDING);
        if (pending.isEmpty()) {
            return ReconciliationOutcome.nothingPending();
        }

        ApplicationEntity first = pending.get(0);
        Optional<OffsetDateTime> cycleStart = correctionCycleStart(first);
        if (cycleStart.isEmpty()) {
            log.warn("Application {} has no CORRECTIONS_PENDING entry in its status history", first.getId());
        }

        List<String> correctedFields = cycleStart
                .map(start -> correctedFieldLabels(applicantId, start))
                .orElseGet(List::of);
        List<String> uploadedDocuments = cycleStart
                .map(start -> uploadedDocumentLabels(first, start))
                .orElseGet(List::of);
        String reason = buildReason(correctedFields, uploadedDocuments);

        List<Long> advanced = new ArrayList<>();
        for (ApplicationEntity application : pending) {
            TransitionResult result = statusService.apply(
                    application, ApplicationStatus.IN_REVIEW, reason, actor, TransitionSource.RECONCILER);
            if (result.isStateChanged()) {
                advanced.add(application.getId());
            }
        }

        metricsService.recordReconciliationAdvanced(advanced.size());
        log.info("Correction cycle of applicant {} complete, applications {} back to review: {}",
                applicantId, advanced, reason);
        return ReconciliationOutcome.advanced(advanced, reason);
    }

    /**
     * Timestamp of the latest move into CORRECTIONS_PENDING
     */
    Optional<OffsetDateTime> correctionCycleStart(ApplicationEntity application) {
        return application.statusHistory().stream()
                .filter(entry -> entry.getTo() == ApplicationStatus.CORRECTIONS_PENDING)
                .map(StatusHistoryEntry::getTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }

    private List<String> correctedFieldLabels(Long applicantId, OffsetDateTime start) {
        Set<String> labels = new LinkedHashSet<>();
        verificationStore.findCorrectedSince(applicantId, start)
                .forEach(verification -> labels.add(verificationStore.sectionLabel(verification.getFieldName())));
        return new ArrayList<>(labels);
    }

    private List<String> uploadedDocumentLabels(ApplicationEntity application, OffsetDateTime start) {
        Set<String> labels = new LinkedHashSet<>();
        application.timeline().stream()
                .filter(entry -> TimelineAction.DOC_UPLOADED.name().equals(entry.getAction()))
                .filter(entry -> entry.getTimestamp() != null && !entry.getTimestamp().isBefore(start))
                .map(entry -> entry.payloadString("document"))
                .filter(Objects::nonNull)
                .forEach(code -> labels.add(DocumentType.labelOf(code)));
        return new ArrayList<>(labels);
    }

    static String buildReason(List<String> correctedFields, List<String> uploadedDocuments) {
        List<String> parts = new ArrayList<>();
        if (!correctedFields.isEmpty()) {
            parts.add("Datos corregidos: " + String.join(", ", correctedFields));
        }
        if (!uploadedDocuments.isEmpty()) {
            parts.add("Documentos actualizados: " + String.join(", ", uploadedDocuments));
        }
        if (parts.isEmpty()) {
            return FALLBACK_REASON;
        }
        return String.join(". ", parts);
    }
}
