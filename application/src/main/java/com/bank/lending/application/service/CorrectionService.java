package com.bank.lending.application.service;

import com.bank.lending.application.model.CorrectionHistoryItem;
import com.bank.lending.application.model.CorrectionOverview;
import com.bank.lending.application.model.CorrectionRequest;
import com.bank.lending.application.model.CorrectionResult;
import com.bank.lending.application.model.FieldVerificationView;
import com.bank.lending.application.model.PendingApplicationView;
import com.bank.lending.application.model.ReconciliationOutcome;
import com.bank.lending.application.model.RejectedDocumentView;
import com.bank.lending.application.model.RejectedFieldView;
import com.bank.lending.application.model.RequestMetadata;
import com.bank.lending.application.model.RoutedCorrection;
import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.TimelineAction;
import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.event.DataCorrectionSubmittedEvent;
import com.bank.lending.domain.exception.CorrectionNotAppliedException;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.entity.DataVerificationEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.DocumentRepository;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Applicant-facing correction flow
 *
 * A correction lands the new value in its storage, marks the verification row CORRECTED, writes a
 * timeline entry on every application of the applicant, reconciles the correction cycle and stages the
 * audit record. All of it commits or rolls back together; the live-update event goes out after commit.
 */
@Service
public class CorrectionService {

    private static final Logger log = LoggerFactory.getLogger(CorrectionService.class);

    private final ApplicantRepository applicantRepository;
    private final ApplicationRepository applicationRepository;
    private final DocumentRepository documentRepository;
    private final FieldVerificationStore verificationStore;
    private final FieldUpdateRouter fieldUpdateRouter;
    private final DiffFormatter diffFormatter;
    private final CorrectionCycleReconciler reconciler;
    private final AuditSink auditSink;
    private final RealtimePublisher realtimePublisher;
    private final MetricsService metricsService;
    private final Clock clock;

    public CorrectionService(
            ApplicantRepository applicantRepository,
            ApplicationRepository applicationRepository,
            DocumentRepository documentRepository,
            FieldVerificationStore verificationStore,
            FieldUpdateRouter fieldUpdateRouter,
            DiffFormatter diffFormatter,
            CorrectionCycleReconciler reconciler,
            AuditSink auditSink,
            RealtimePublisher realtimePublisher,
            MetricsService metricsService,
            Clock clock) {
        this.applicantRepository = applicantRepository;
        this.applicationRepository = applicationRepository;
        this.documentRepository = documentRepository;
        this.verificationStore = verificationStore;
        this.fieldUpdateRouter = fieldUpdateRouter;
        this.diffFormatter = diffFormatter;
        this.reconciler = reconciler;
        this.auditSink = auditSink;
        this.realtimePublisher = realtimePublisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Submit the corrected value of a rejected field.
     * Replaying a correction that was already applied finds no pending rejection and changes nothing.
     *
     * @throws ValidationException for a missing field name or value, or a value that does not fit the field
     * @throws com.bank.lending.domain.exception.FieldNotVerifiableException for an unknown field
     * @throws NotFoundException when the user has no applicant profile or the field has no pending rejection
     * @throws CorrectionNotAppliedException when the field has no record to write to
     */
    @Transactional
    @Retryable(
            retryFor = {PessimisticLockingFailureException.class, ObjectOptimisticLockingFailureException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2)
    )
    public CorrectionResult submitCorrection(Long userId, Actor actor, CorrectionRequest request, RequestMetadata metadata) {
        validate(request);
        VerifiableField field = VerifiableField.fromCode(request.getFieldName());
        RequestMetadata client = metadata != null ? metadata : RequestMetadata.empty();

        Timer.Sample sample = metricsService.startCorrectionProcessing();
        try {
            // 1. Lock the applicant; serializes concurrent corrections and reconciliation
            ApplicantEntity applicant = applicantRepository.findByUserIdForUpdate(userId)
                    .orElseThrow(() -> new NotFoundException("No applicant profile found"));

            DataVerificationEntity verification = verificationStore.findPendingRejection(applicant.getId(), field)
                    .orElseThrow(() -> {
                        metricsService.incrementCorrectionReplays();
                        log.info("No pending rejection for {} of applicant {}", field, applicant.getId());
                        return new NotFoundException("No hay corrección pendiente para este campo");
                    });

            // 2. Write the new value where the field lives
            Object newValue = request.getNewValue();
            RoutedCorrection routed = fieldUpdateRouter.applyCorrection(
                    applicant, field, newValue, verification.getFieldValue());
            if (!routed.isApplied()) {
                throw new CorrectionNotAppliedException(field);
            }
            Object oldValue = routed.getOldValue();

            // 3. Verification row: history entry + CORRECTED
            DataVerificationEntity corrected = verificationStore.correct(verification.getId(), oldValue, newValue, actor);
            String fieldLabel = verificationStore.sectionLabel(field);

            // 4. Timeline on every application of the applicant
            appendCorrectionTimeline(applicant, field, fieldLabel, oldValue, newValue, actor, client);

            // 5. Close the cycle if nothing else is outstanding
            ReconciliationOutcome outcome = reconciler.reconcile(applicant, actor);

            // 6. Audit, staged in the outbox of this transaction
            auditSink.emit(AuditAction.DATA_CORRECTED, applicant.getTenantId(),
                    auditPayload(applicant, corrected, field, fieldLabel, oldValue, newValue, actor));

            // 7. Live update once committed
            DataCorrectionSubmittedEvent event = DataCorrectionSubmittedEvent.builder()
                    .verificationId(corrected.getId())
                    .applicantId(applicant.getId())
                    .tenantId(applicant.getTenantId())
                    .applicantName(applicant.getFullName())
                    .fieldName(field.getCode())
                    .fieldLabel(fieldLabel)
                    .oldValue(oldValue)
                    .newValue(newValue)
                    .correctedBy(actor != null ? actor.getName() : null)
                    .correctionCount(corrected.correctionHistory().size())
                    .correctedAt(corrected.getCorrectedAt())
                    .build();
            realtimePublisher.publishAfterCommit(DataCorrectionSubmittedEvent.EVENT_NAME, event.channels(), event);

            metricsService.recordCorrectionSubmitted(field);
            log.info("Correction of {} accepted for applicant {} (reconciliation: {})",
                    field, applicant.getId(), outcome.getStatus());

            return CorrectionResult.builder()
                    .verificationId(corrected.getId())
                    .fieldName(field.getCode())
                    .fieldLabel(fieldLabel)
                    .status(corrected.getStatus().name())
                    .correctionCount(corrected.correctionHistory().size())
                    .correctedAt(corrected.getCorrectedAt())
                    .applicationsAdvanced(outcome.getAdvancedApplicationIds())
                    .reconciliationReason(outcome.getReason())
                    .build();
        } finally {
            metricsService.recordCorrectionProcessing(sample);
        }
    }

    /**
     * Correction dashboard of the user's applicant profile; empty when the user has no profile
     */
    @Transactional(readOnly = true)
    public CorrectionOverview overview(Long userId) {
        Optional<ApplicantEntity> found = applicantRepository.findByUserId(userId);
        if (found.isEmpty()) {
            return CorrectionOverview.empty();
        }
        ApplicantEntity applicant = found.get();

        List<RejectedFieldView> rejectedFields = verificationStore.listRejected(applicant.getId()).stream()
                .map(verification -> RejectedFieldView.builder()
                        .id(verification.getId())
                        .fieldName(verification.getFieldName().getCode())
                        .fieldLabel(verification.getFieldName().getLabel())
                        .currentValue(fieldUpdateRouter.decodeStoredValue(verification.getFieldValue()))
                        .rejectionReason(verification.getRejectionReason())
                        .rejectedAt(verification.getRejectedAt())
                        .build())
                .collect(Collectors.toList());

        List<RejectedDocumentView> rejectedDocuments = documentRepository
                .findByApplicantIdAndStatus(applicant.getId(), DocumentStatus.REJECTED).stream()
                .map(document -> RejectedDocumentView.builder()
                        .id(document.getId())
                        .applicationId(document.getApplicationId())
                        .type(document.getType().name())
                        .typeLabel(document.getType().getDescription())
                        .fileName(document.getFileName())
                        .rejectionReason(document.getRejectionReason())
                        .rejectedAt(document.getReviewedAt())
                        .build())
                .collect(Collectors.toList());

        List<CorrectionHistoryItem> history = verificationStore.listCorrectionHistory(applicant.getId());

        List<PendingApplicationView> pendingApplications = applicationRepository
                .findByApplicantIdAndStatusOrderByIdAsc(applicant.getId(), ApplicationStatus.CORRECTIONS_PENDING).stream()
                .map(application -> PendingApplicationView.builder()
                        .id(application.getId())
                        .folio(application.getFolio())
                        .status(application.getStatus().name())
                        .statusLabel(application.getStatus().getLabel())
                        .updatedAt(application.getUpdatedAt())
                        .build())
                .collect(Collectors.toList());

        return CorrectionOverview.builder()
                .rejectedFields(rejectedFields)
                .rejectedDocuments(rejectedDocuments)
                .correctionHistory(history)
                .applicantData(applicantData(applicant))
                .pendingApplications(pendingApplications)
                .hasCorrectionsPending(!rejectedFields.isEmpty() || !rejectedDocuments.isEmpty())
                .build();
    }

    /**
     * Verification detail of one field
     */
    @Transactional(readOnly = true)
    public FieldVerificationView fieldDetail(Long userId, String fieldName) {
        VerifiableField field = VerifiableField.fromCode(fieldName);
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        DataVerificationEntity verification = verificationStore.find(applicant.getId(), field)
                .orElseThrow(() -> new NotFoundException("Verificación de campo no encontrada"));

        return FieldVerificationView.builder()
                .id(verification.getId())
                .fieldName(field.getCode())
                .fieldLabel(field.getLabel())
                .currentValue(fieldUpdateRouter.decodeStoredValue(verification.getFieldValue()))
                .status(verification.getStatus().name())
                .statusLabel(verification.getStatus().getLabel())
                .rejectionReason(verification.getRejectionReason())
                .rejectedAt(verification.getRejectedAt())
                .correctedAt(verification.getCorrectedAt())
                .rejected(verification.isRejected())
                .correctionCount(verification.correctionHistory().size())
                .build();
    }

    private void validate(CorrectionRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request == null || request.getFieldName() == null || request.getFieldName().isBlank()) {
            errors.put("field_name", "El campo field_name es obligatorio");
        }
        if (request == null || request.getNewValue() == null) {
            errors.put("new_value", "El campo new_value es obligatorio");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private Map<String, Object> auditPayload(ApplicantEntity applicant, DataVerificationEntity verification,
                                             VerifiableField field, String fieldLabel,
                                             Object oldValue, Object newValue, Actor actor) {
        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("value", oldValue);
        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("value", newValue);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", actor != null ? actor.getId() : null);
        payload.put("applicant_id", applicant.getId());
        payload.put("entity_type", "DataVerification");
        payload.put("entity_id", verification.getId());
        payload.put("old_values", oldValues);
        payload.put("new_values", newValues);
        payload.put("metadata", Map.of("field_name", field.getCode(), "field_label", fieldLabel));
        return payload;
    }

    private void appendCorrectionTimeline(ApplicantEntity applicant, VerifiableField field, String fieldLabel,
                                          Object oldValue, Object newValue, Actor actor,
                                          RequestMetadata client) {
        Object merged = mergedValue(oldValue, newValue);
        Map<String, String> changes = diffFormatter.diff(oldValue, merged, field.getCompositeKind());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field.getCode());
        payload.put("field_label", fieldLabel);
        payload.put("changes", changes.isEmpty() ? null : changes);
        payload.put("summary", diffFormatter.formatChangesForTimeline(oldValue, merged, field.getCompositeKind()));
        payload.put("old_value", diffFormatter.formatSummary(oldValue));
        payload.put("new_value", diffFormatter.formatSummary(merged));
        payload.put("ip_address", client.getIpAddress());
        payload.put("user_agent", client.getUserAgent());
        payload.put("location", client.getLocation());

        OffsetDateTime now = OffsetDateTime.now(clock);
        TimelineEntry entry = TimelineEntry.of(TimelineAction.DATA_CORRECTED.name(), payload, actor, now);
        for (ApplicationEntity application : applicationRepository.findByApplicantIdOrderByIdAsc(applicant.getId())) {
            application.appendTimeline(entry);
            application.setUpdatedAt(now);
            applicationRepository.save(application);
        }
    }

    /**
     * Composite corrections only carry the sub-keys they change; overlay them on the replaced snapshot
     */
    private Object mergedValue(Object oldValue, Object newValue) {
        if (!(oldValue instanceof Map) || !(newValue instanceof Map)) {
            return newValue;
        }
        Map<Object, Object> merged = new LinkedHashMap<>((Map<?, ?>) oldValue);
        merged.putAll((Map<?, ?>) newValue);
        return merged;
    }

    private Map<String, Object> applicantData(ApplicantEntity applicant) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("first_name", applicant.getFirstName());
        data.put("last_name_1", applicant.getLastName1());
        data.put("last_name_2", applicant.getLastName2());
        data.put("curp", applicant.getCurp());
        data.put("rfc", applicant.getRfc());
        data.put("ine_clave", applicant.getIneClave());
        data.put("birth_date", applicant.getBirthDate() != null ? applicant.getBirthDate().toString() : null);
        data.put("phone", applicant.getPhone());
        data.put("email", applicant.getEmail());
        data.put("address", fieldUpdateRouter.captureOldValue(applicant, VerifiableField.ADDRESS, null));
        data.put("employment", fieldUpdateRouter.captureOldValue(applicant, VerifiableField.EMPLOYMENT, null));
        return data;
    }
}
