package com.bank.lending.application.service;

import com.bank.lending.application.config.LendingProperties;
import com.bank.lending.application.model.ReferenceRequest;
import com.bank.lending.domain.enums.TimelineAction;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.entity.ReferenceEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.ReferenceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Personal references attached to an application
 */
@Service
public class ReferenceService {

    private final ApplicantRepository applicantRepository;
    private final ApplicationRepository applicationRepository;
    private final ReferenceRepository referenceRepository;
    private final LendingProperties properties;
    private final Clock clock;

    public ReferenceService(
            ApplicantRepository applicantRepository,
            ApplicationRepository applicationRepository,
            ReferenceRepository referenceRepository,
            LendingProperties properties,
            Clock clock) {
        this.applicantRepository = applicantRepository;
        this.applicationRepository = applicationRepository;
        this.referenceRepository = referenceRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws ValidationException when required data is missing, the application is not editable,
     *                             or the maximum number of references is reached
     */
    @Transactional
    public ReferenceEntity addReference(Long applicationId, Long userId, ReferenceRequest request, Actor actor) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request == null || request.getFullName() == null || request.getFullName().isBlank()) {
            errors.put("full_name", "El nombre de la referencia es obligatorio");
        }
        if (request == null || request.getPhone() == null || request.getPhone().isBlank()) {
            errors.put("phone", "El teléfono de la referencia es obligatorio");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        ApplicationEntity application = loadOwnedApplication(applicationId, userId);
        if (!application.getStatus().isEditable()) {
            throw ValidationException.of("application",
                    String.format("References cannot be changed while the application is %s", application.getStatus()));
        }

        int maximum = properties.getReferences().getMax();
        if (referenceRepository.countByApplicationId(applicationId) >= maximum) {
            throw ValidationException.of("references", String.format("Maximum of %d references allowed", maximum));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ReferenceEntity reference = referenceRepository.save(ReferenceEntity.builder()
                .applicationId(applicationId)
                .fullName(request.getFullName().trim())
                .phone(request.getPhone().trim())
                .relationship(request.getRelationship())
                .createdAt(now)
                .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reference_id", reference.getId());
        payload.put("full_name", reference.getFullName());
        application.appendTimeline(TimelineEntry.of(TimelineAction.REFERENCE_ADDED.name(), payload, actor, now));
        application.setUpdatedAt(now);
        applicationRepository.save(application);
        return reference;
    }

    @Transactional
    public void removeReference(Long applicationId, Long referenceId, Long userId) {
        ApplicationEntity application = loadOwnedApplication(applicationId, userId);
        if (!application.getStatus().isEditable()) {
            throw ValidationException.of("application",
                    String.format("References cannot be changed while the application is %s", application.getStatus()));
        }
        ReferenceEntity reference = referenceRepository.findById(referenceId)
                .filter(candidate -> candidate.getApplicationId().equals(applicationId))
                .orElseThrow(() -> new NotFoundException("Referencia no encontrada"));
        referenceRepository.delete(reference);
    }

    @Transactional(readOnly = true)
    public List<ReferenceEntity> listReferences(Long applicationId, Long userId) {
        loadOwnedApplication(applicationId, userId);
        return referenceRepository.findByApplicationIdOrderByIdAsc(applicationId);
    }

    private ApplicationEntity loadOwnedApplication(Long applicationId, Long userId) {
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        return applicationRepository.findByIdAndApplicantId(applicationId, applicant.getId())
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));
    }
}
