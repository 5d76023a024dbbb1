package com.bank.lending.application.service;

import com.bank.lending.application.model.NewApplicationRequest;
import com.bank.lending.application.statemachine.ApplicationStateMachine;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Creation and lookup of an applicant's applications
 */
@Service
public class ApplicationService {

    private static final Logger log = LoggerFactory.getLogger(ApplicationService.class);

    private static final DateTimeFormatter FOLIO_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final ApplicantRepository applicantRepository;
    private final ApplicationRepository applicationRepository;
    private final ApplicationStateMachine stateMachine;
    private final Clock clock;

    public ApplicationService(
            ApplicantRepository applicantRepository,
            ApplicationRepository applicationRepository,
            ApplicationStateMachine stateMachine,
            Clock clock) {
        this.applicantRepository = applicantRepository;
        this.applicationRepository = applicationRepository;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    /**
     * Open a DRAFT application for the user's applicant profile
     */
    @Transactional
    public ApplicationEntity createDraft(Long userId, NewApplicationRequest request, Actor actor) {
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));

        ApplicationEntity application = ApplicationEntity.builder()
                .tenantId(applicant.getTenantId())
                .applicantId(applicant.getId())
                .folio(nextFolio())
                .productCode(request != null ? request.getProductCode() : null)
                .purpose(request != null ? request.getPurpose() : null)
                .requestedAmount(request != null ? request.getRequestedAmount() : null)
                .termMonths(request != null ? request.getTermMonths() : null)
                .build();
        stateMachine.open(application, actor);

        ApplicationEntity saved = applicationRepository.save(application);
        log.info("Application {} ({}) opened for applicant {}", saved.getId(), saved.getFolio(), applicant.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public ApplicationEntity getApplication(Long applicationId, Long userId) {
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        return applicationRepository.findByIdAndApplicantId(applicationId, applicant.getId())
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));
    }

    @Transactional(readOnly = true)
    public List<ApplicationEntity> listApplications(Long userId) {
        ApplicantEntity applicant = applicantRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No applicant profile found"));
        return applicationRepository.findByApplicantIdOrderByIdAsc(applicant.getId());
    }

    private String nextFolio() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase(Locale.ROOT);
        return "SOL-" + LocalDate.now(clock).format(FOLIO_DATE) + "-" + suffix;
    }
}
