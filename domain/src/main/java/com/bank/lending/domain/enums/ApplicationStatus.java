package com.bank.lending.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Coarse lifecycle status of a loan application
 */
public enum ApplicationStatus {
    DRAFT("Borrador"),
    SUBMITTED("Enviada"),
    IN_REVIEW("En revisión"),
    DOCS_PENDING("Documentos pendientes"),
    CORRECTIONS_PENDING("Correcciones pendientes"),
    COUNTER_OFFERED("Contraoferta"),
    APPROVED("Aprobada"),
    REJECTED("Rechazada"),
    CANCELLED("Cancelada"),
    DISBURSED("Desembolsada"),
    SYNCED("Sincronizada");

    private static final Set<ApplicationStatus> TERMINAL = EnumSet.of(REJECTED, CANCELLED, SYNCED);
    private static final Set<ApplicationStatus> EDITABLE = EnumSet.of(DRAFT, DOCS_PENDING, CORRECTIONS_PENDING);
    private static final Set<ApplicationStatus> ACTIVE =
            EnumSet.of(SUBMITTED, IN_REVIEW, DOCS_PENDING, CORRECTIONS_PENDING, COUNTER_OFFERED);

    private final String label;

    ApplicationStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * No transition leaves a terminal status
     */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Applicant may still change data attached to the application
     */
    public boolean isEditable() {
        return EDITABLE.contains(this);
    }

    /**
     * In-flight processing statuses
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
