package com.bank.lending.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Employment situation declared by the applicant
 */
public enum EmploymentType {
    EMPLOYEE("Empleado"),
    SELF_EMPLOYED("Trabajador Independiente"),
    BUSINESS_OWNER("Empresario"),
    RETIRED("Pensionado"),
    STUDENT("Estudiante"),
    HOMEMAKER("Hogar"),
    UNEMPLOYED("Desempleado"),
    OTHER("Otro");

    private final String label;

    EmploymentType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<EmploymentType> tryFrom(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }

    /**
     * Decode a raw code, defaulting to EMPLOYEE when it is not recognized
     */
    public static EmploymentType fromCode(String code) {
        return tryFrom(code).orElse(EMPLOYEE);
    }
}
