package com.bank.lending.application.service;

import com.bank.lending.application.config.LendingProperties;
import com.bank.lending.application.model.CorrectionHistoryItem;
import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.enums.VerificationStatus;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.CorrectionEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.DataVerificationEntity;
import com.bank.lending.infrastructure.persistence.repository.DataVerificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-field verification state of an applicant: one row per (applicant, field).
 * A rejected row becomes CORRECTED when the applicant supplies a new value, and every correction is
 * appended to the row's correction history.
 */
@Service
public class FieldVerificationStore {

    private static final Logger log = LoggerFactory.getLogger(FieldVerificationStore.class);

    private final DataVerificationRepository verificationRepository;
    private final FieldUpdateRouter fieldUpdateRouter;
    private final LendingProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FieldVerificationStore(
            DataVerificationRepository verificationRepository,
            FieldUpdateRouter fieldUpdateRouter,
            LendingProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.verificationRepository = verificationRepository;
        this.fieldUpdateRouter = fieldUpdateRouter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Reject a field by its wire code
     *
     * @throws com.bank.lending.domain.exception.FieldNotVerifiableException for an unknown field
     */
    public DataVerificationEntity reject(ApplicantEntity applicant, String fieldName, String reason, Actor reviewer) {
        return reject(applicant, VerifiableField.fromCode(fieldName), reason, reviewer);
    }

    /**
     * Mark the field REJECTED, creating its row if needed, and capture the live value being rejected
     */
    public DataVerificationEntity reject(ApplicantEntity applicant, VerifiableField field, String reason, Actor reviewer) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        DataVerificationEntity verification = findOrCreate(applicant, field, now);

        verification.setStatus(VerificationStatus.REJECTED);
        verification.setRejectionReason(reason);
        verification.setRejectedAt(now);
        verification.setVerifiedAt(null);
        verification.setVerifiedBy(reviewer != null ? reviewer.getId() : null);
        verification.setFieldValue(serialize(fieldUpdateRouter.currentValue(applicant, field)));
        verification.setUpdatedAt(now);

        DataVerificationEntity saved = verificationRepository.save(verification);
        log.info("Field {} of applicant {} rejected: {}", field, applicant.getId(), reason);
        return saved;
    }

    /**
     * Mark the field VERIFIED. The correction history is kept.
     */
    public DataVerificationEntity verify(ApplicantEntity applicant, VerifiableField field, Actor reviewer) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        DataVerificationEntity verification = findOrCreate(applicant, field, now);

        verification.setStatus(VerificationStatus.VERIFIED);
        verification.setVerifiedAt(now);
        verification.setVerifiedBy(reviewer != null ? reviewer.getId() : null);
        verification.setRejectionReason(null);
        verification.setRejectedAt(null);
        verification.setFieldValue(serialize(fieldUpdateRouter.currentValue(applicant, field)));
        verification.setUpdatedAt(now);

        DataVerificationEntity saved = verificationRepository.save(verification);
        log.info("Field {} of applicant {} verified", field, applicant.getId());
        return saved;
    }

    /**
     * Record a correction on a REJECTED row: append a history entry and move the row to CORRECTED
     *
     * @throws IllegalStateException if the row is not REJECTED
     */
    public DataVerificationEntity correct(Long verificationId, Object oldValue, Object newValue, Actor correctedBy) {
        DataVerificationEntity verification = verificationRepository.findById(verificationId)
                .orElseThrow(() -> new NotFoundException("Verificación de campo no encontrada"));

        if (!verification.isRejected()) {
            throw new IllegalStateException(String.format(
                    "Verification %d is %s, only REJECTED fields can be corrected",
                    verificationId, verification.getStatus()));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        verification.appendCorrection(CorrectionEntry.builder()
                .oldValue(oldValue)
                .newValue(newValue)
                .rejectionReason(verification.getRejectionReason())
                .correctedBy(correctedBy)
                .correctedAt(now)
                .build());
        verification.setStatus(VerificationStatus.CORRECTED);
        verification.setCorrectedAt(now);
        verification.setFieldValue(serialize(newValue));
        verification.setUpdatedAt(now);

        DataVerificationEntity saved = verificationRepository.save(verification);
        log.info("Field {} of applicant {} corrected (correction #{})",
                saved.getFieldName(), saved.getApplicantId(), saved.correctionHistory().size());
        return saved;
    }

    public List<DataVerificationEntity> listRejected(Long applicantId) {
        return verificationRepository.findByApplicantIdAndStatusOrderByIdAsc(applicantId, VerificationStatus.REJECTED);
    }

    public boolean hasRejected(Long applicantId) {
        return !listRejected(applicantId).isEmpty();
    }

    public Optional<DataVerificationEntity> findPendingRejection(Long applicantId, VerifiableField field) {
        return verificationRepository.findByApplicantIdAndFieldNameAndStatus(applicantId, field, VerificationStatus.REJECTED);
    }

    public Optional<DataVerificationEntity> find(Long applicantId, VerifiableField field) {
        return verificationRepository.findByApplicantIdAndFieldName(applicantId, field);
    }

    public List<DataVerificationEntity> findCorrectedSince(Long applicantId, OffsetDateTime since) {
        return verificationRepository.findCorrectedSince(applicantId, since);
    }

    /**
     * Every correction of the applicant, newest first
     */
    public List<CorrectionHistoryItem> listCorrectionHistory(Long applicantId) {
        return verificationRepository.findByApplicantIdOrderByIdAsc(applicantId).stream()
                .flatMap(verification -> verification.correctionHistory().stream()
                        .map(entry -> CorrectionHistoryItem.builder()
                                .verificationId(verification.getId())
                                .fieldName(verification.getFieldName().getCode())
                                .fieldLabel(sectionLabel(verification.getFieldName()))
                                .oldValue(entry.getOldValue())
                                .newValue(entry.getNewValue())
                                .rejectionReason(entry.getRejectionReason())
                                .correctedBy(entry.getCorrectedBy())
                                .correctedAt(entry.getCorrectedAt())
                                .build()))
                .sorted(Comparator.comparing(CorrectionHistoryItem::getCorrectedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
    }

    public String sectionLabel(VerifiableField field) {
        return properties.sectionLabel(field);
    }

    /**
     * Stored form of a value: composites as JSON, scalars verbatim
     */
    String serialize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Collection) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize field value", e);
            }
        }
        return value.toString();
    }

    private DataVerificationEntity findOrCreate(ApplicantEntity applicant, VerifiableField field, OffsetDateTime now) {
        return verificationRepository.findByApplicantIdAndFieldName(applicant.getId(), field)
                .orElseGet(() -> DataVerificationEntity.builder()
                        .tenantId(applicant.getTenantId())
                        .applicantId(applicant.getId())
                        .fieldName(field)
                        .status(VerificationStatus.PENDING)
                        .createdAt(now)
                        .build());
    }
}
