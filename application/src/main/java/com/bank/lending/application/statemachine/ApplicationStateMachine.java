package com.bank.lending.application.statemachine;

import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.TimelineAction;
import com.bank.lending.domain.enums.TransitionSource;
import com.bank.lending.domain.exception.IllegalTransitionException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.StatusHistoryEntry;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.bank.lending.domain.enums.ApplicationStatus.*;

/**
 * State machine for the loan application lifecycle
 *
 * DRAFT -> SUBMITTED -> IN_REVIEW -> (DOCS_PENDING | CORRECTIONS_PENDING | COUNTER_OFFERED)
 *       -> APPROVED -> DISBURSED -> SYNCED, with REJECTED and CANCELLED as exits.
 *
 * Every legal transition is keyed on the source that requests it. CORRECTIONS_PENDING can only be
 * left towards IN_REVIEW by the correction reconciler.
 *
 * {@link #changeStatus} is the only way an application status is mutated: it updates the status,
 * the status history and the timeline together.
 */
@Component
public class ApplicationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStateMachine.class);

    private static final Set<TransitionSource> ANY = Collections.unmodifiableSet(EnumSet.allOf(TransitionSource.class));
    private static final Set<TransitionSource> APPLICANT_ONLY = Collections.unmodifiableSet(EnumSet.of(TransitionSource.APPLICANT));
    private static final Set<TransitionSource> STAFF_ONLY = Collections.unmodifiableSet(EnumSet.of(TransitionSource.STAFF));
    private static final Set<TransitionSource> RECONCILER_ONLY = Collections.unmodifiableSet(EnumSet.of(TransitionSource.RECONCILER));
    private static final Set<TransitionSource> STAFF_OR_SYSTEM =
            Collections.unmodifiableSet(EnumSet.of(TransitionSource.STAFF, TransitionSource.SYSTEM));

    private static final Map<ApplicationStatus, Map<ApplicationStatus, Set<TransitionSource>>> TRANSITIONS =
            buildTransitions();

    /**
     * Result of a state transition attempt
     */
    public static class TransitionResult {
        private final ApplicationStatus newState;
        private final boolean valid;
        private final String errorMessage;
        private final boolean stateChanged;

        private TransitionResult(ApplicationStatus newState, boolean valid, String errorMessage, boolean stateChanged) {
            this.newState = newState;
            this.valid = valid;
            this.errorMessage = errorMessage;
            this.stateChanged = stateChanged;
        }

        public static TransitionResult success(ApplicationStatus newState, boolean stateChanged) {
            return new TransitionResult(newState, true, null, stateChanged);
        }

        public static TransitionResult noop(ApplicationStatus state) {
            return new TransitionResult(state, true, null, false);
        }

        public static TransitionResult failure(String errorMessage) {
            return new TransitionResult(null, false, errorMessage, false);
        }

        public ApplicationStatus getNewState() {
            return newState;
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isStateChanged() {
            return stateChanged;
        }
    }

    private final Clock clock;

    public ApplicationStateMachine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Check whether {@code source} may move an application from {@code current} to {@code requested}.
     * Pure: nothing is mutated.
     *
     * @return success with stateChanged=true, noop for a same-state request, or failure with a message
     */
    public TransitionResult transition(ApplicationStatus current, ApplicationStatus requested, TransitionSource source) {
        log.debug("State transition: {} -> {} requested by {}", current, requested, source);

        if (current == null || requested == null) {
            return TransitionResult.failure("Current and requested status are required");
        }
        if (current == requested) {
            return TransitionResult.noop(current);
        }
        if (current.isTerminal()) {
            return TransitionResult.failure(
                String.format("La solicitud está en un estado terminal (%s)", current));
        }

        Set<TransitionSource> sources = TRANSITIONS.get(current).get(requested);
        if (sources == null) {
            return TransitionResult.failure(
                String.format("No se puede cambiar el estado de '%s' a '%s'.", current, requested));
        }
        if (!sources.contains(source)) {
            if (current == CORRECTIONS_PENDING && requested == IN_REVIEW) {
                return TransitionResult.failure(
                    "Una solicitud en CORRECTIONS_PENDING solo regresa a IN_REVIEW cuando todas las correcciones están completas");
            }
            return TransitionResult.failure(
                String.format("El cambio de '%s' a '%s' no está permitido para %s", current, requested, source));
        }
        return TransitionResult.success(requested, true);
    }

    public boolean canTransition(ApplicationStatus current, ApplicationStatus requested, TransitionSource source) {
        TransitionResult result = transition(current, requested, source);
        return result.isValid() && result.isStateChanged();
    }

    /**
     * Statuses reachable from {@code current} for the given source
     */
    public Set<ApplicationStatus> allowedTargets(ApplicationStatus current, TransitionSource source) {
        Set<ApplicationStatus> targets = EnumSet.noneOf(ApplicationStatus.class);
        TRANSITIONS.getOrDefault(current, Map.of()).forEach((target, sources) -> {
            if (sources.contains(source)) {
                targets.add(target);
            }
        });
        return targets;
    }

    /**
     * Put a new application in DRAFT and record the opening history entry
     */
    public void open(ApplicationEntity application, Actor actor) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        application.setStatus(DRAFT);
        application.appendStatusHistory(StatusHistoryEntry.builder()
                .from(null)
                .to(DRAFT)
                .reason("Application created")
                .actorId(actor.getId())
                .actorName(actor.getName())
                .timestamp(now)
                .build());
        application.setCreatedAt(now);
        application.setUpdatedAt(now);
    }

    /**
     * Apply a status change to the application in memory.
     * Status, status history and timeline change together; the caller persists them in its transaction.
     *
     * @return the transition result; not changed for a same-state request
     * @throws IllegalTransitionException if the transition is not allowed for the source
     */
    public TransitionResult changeStatus(ApplicationEntity application, ApplicationStatus newStatus,
                                         String reason, Actor actor, TransitionSource source) {
        ApplicationStatus current = application.getStatus();
        TransitionResult result = transition(current, newStatus, source);

        if (!result.isValid()) {
            log.warn("Rejected transition {} -> {} for application {} ({}): {}",
                    current, newStatus, application.getId(), source, result.getErrorMessage());
            throw new IllegalTransitionException(current, newStatus, result.getErrorMessage());
        }
        if (!result.isStateChanged()) {
            log.warn("Application {} is already in {}, ignoring status change", application.getId(), current);
            return result;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Actor by = actor != null ? actor : Actor.system();

        application.setStatus(newStatus);
        applySideEffects(application, newStatus, reason, now);

        application.appendStatusHistory(StatusHistoryEntry.builder()
                .from(current)
                .to(newStatus)
                .reason(reason)
                .actorId(by.getId())
                .actorName(by.getName())
                .timestamp(now)
                .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", current.name());
        payload.put("to", newStatus.name());
        payload.put("reason", reason);
        application.appendTimeline(TimelineEntry.of(TimelineAction.STATUS_CHANGED.name(), payload, by, now));

        application.setUpdatedAt(now);

        log.info("Application {} moved {} -> {} by {} ({})", application.getId(), current, newStatus, by.getName(), source);
        return result;
    }

    private void applySideEffects(ApplicationEntity application, ApplicationStatus newStatus,
                                  String reason, OffsetDateTime now) {
        switch (newStatus) {
            case SUBMITTED -> application.setSubmittedAt(now);
            case APPROVED -> application.setApprovedAt(now);
            case REJECTED -> application.setRejectionReason(reason);
            case DISBURSED -> application.setDisbursedAt(now);
            default -> {
                // no extra fields
            }
        }
    }

    private static Map<ApplicationStatus, Map<ApplicationStatus, Set<TransitionSource>>> buildTransitions() {
        Map<ApplicationStatus, Map<ApplicationStatus, Set<TransitionSource>>> table = new EnumMap<>(ApplicationStatus.class);
        for (ApplicationStatus status : ApplicationStatus.values()) {
            table.put(status, new EnumMap<>(ApplicationStatus.class));
        }

        allow(table, DRAFT, SUBMITTED, APPLICANT_ONLY);
        allow(table, DOCS_PENDING, SUBMITTED, APPLICANT_ONLY);

        for (ApplicationStatus from : EnumSet.of(DRAFT, SUBMITTED, IN_REVIEW, DOCS_PENDING, COUNTER_OFFERED)) {
            allow(table, from, CANCELLED, ANY);
        }
        allow(table, CORRECTIONS_PENDING, CANCELLED, STAFF_ONLY);
        allow(table, APPROVED, CANCELLED, STAFF_ONLY);

        allow(table, SUBMITTED, IN_REVIEW, STAFF_ONLY);
        allow(table, SUBMITTED, DOCS_PENDING, STAFF_ONLY);
        allow(table, SUBMITTED, CORRECTIONS_PENDING, STAFF_ONLY);

        allow(table, IN_REVIEW, DOCS_PENDING, STAFF_ONLY);
        allow(table, IN_REVIEW, CORRECTIONS_PENDING, STAFF_ONLY);
        allow(table, IN_REVIEW, COUNTER_OFFERED, STAFF_ONLY);
        allow(table, IN_REVIEW, APPROVED, STAFF_ONLY);
        allow(table, IN_REVIEW, REJECTED, STAFF_ONLY);

        allow(table, DOCS_PENDING, IN_REVIEW, STAFF_ONLY);
        allow(table, DOCS_PENDING, CORRECTIONS_PENDING, STAFF_ONLY);

        allow(table, CORRECTIONS_PENDING, IN_REVIEW, RECONCILER_ONLY);

        allow(table, COUNTER_OFFERED, IN_REVIEW, STAFF_ONLY);
        allow(table, COUNTER_OFFERED, APPROVED, STAFF_ONLY);
        allow(table, COUNTER_OFFERED, REJECTED, STAFF_ONLY);

        allow(table, APPROVED, DISBURSED, STAFF_ONLY);
        allow(table, DISBURSED, SYNCED, STAFF_OR_SYSTEM);

        return Collections.unmodifiableMap(table);
    }

    private static void allow(Map<ApplicationStatus, Map<ApplicationStatus, Set<TransitionSource>>> table,
                              ApplicationStatus from, ApplicationStatus to, Set<TransitionSource> sources) {
        table.get(from).put(to, sources);
    }
}
