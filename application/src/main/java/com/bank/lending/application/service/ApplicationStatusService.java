package com.bank.lending.application.service;

import com.bank.lending.application.statemachine.ApplicationStateMachine;
import com.bank.lending.application.statemachine.ApplicationStateMachine.TransitionResult;
import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.enums.TransitionSource;
import com.bank.lending.domain.event.ApplicationStatusChangedEvent;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists status changes decided by {@link ApplicationStateMachine} and announces them
 */
@Service
public class ApplicationStatusService {

    private final ApplicationRepository applicationRepository;
    private final ApplicationStateMachine stateMachine;
    private final AuditSink auditSink;
    private final RealtimePublisher realtimePublisher;
    private final MetricsService metricsService;

    public ApplicationStatusService(
            ApplicationRepository applicationRepository,
            ApplicationStateMachine stateMachine,
            AuditSink auditSink,
            RealtimePublisher realtimePublisher,
            MetricsService metricsService) {
        this.applicationRepository = applicationRepository;
        this.stateMachine = stateMachine;
        this.auditSink = auditSink;
        this.realtimePublisher = realtimePublisher;
        this.metricsService = metricsService;
    }

    /**
     * Load the application and change its status
     */
    @Transactional
    public ApplicationEntity changeStatus(Long applicationId, ApplicationStatus target, String reason,
                                          Actor actor, TransitionSource source) {
        ApplicationEntity application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> new NotFoundException("Solicitud no encontrada"));
        apply(application, target, reason, actor, source);
        return application;
    }

    /**
     * Change the status of an already loaded application within the caller's transaction.
     * A same-state request changes nothing and emits nothing.
     *
     * @throws com.bank.lending.domain.exception.IllegalTransitionException if the change is not allowed
     */
    public TransitionResult apply(ApplicationEntity application, ApplicationStatus target, String reason,
                                  Actor actor, TransitionSource source) {
        ApplicationStatus from = application.getStatus();
        TransitionResult result = stateMachine.changeStatus(application, target, reason, actor, source);
        if (!result.isStateChanged()) {
            return result;
        }

        applicationRepository.save(application);
        metricsService.recordTransition(target);

        Actor by = actor != null ? actor : Actor.system();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", by.getId());
        payload.put("applicant_id", application.getApplicantId());
        payload.put("entity_type", "Application");
        payload.put("entity_id", application.getId());
        payload.put("old_values", Map.of("status", from.name()));
        payload.put("new_values", Map.of("status", target.name()));
        payload.put("metadata", reason != null ? Map.of("reason", reason, "source", source.name())
                : Map.of("source", source.name()));
        auditSink.emit(AuditAction.APPLICATION_STATUS_CHANGED, application.getTenantId(), payload);

        ApplicationStatusChangedEvent event = ApplicationStatusChangedEvent.builder()
                .applicationId(application.getId())
                .applicantId(application.getApplicantId())
                .tenantId(application.getTenantId())
                .folio(application.getFolio())
                .from(from)
                .to(target)
                .reason(reason)
                .changedAt(application.getUpdatedAt())
                .build();
        realtimePublisher.publishAfterCommit(ApplicationStatusChangedEvent.EVENT_NAME, event.channels(), event);
        return result;
    }
}
