package com.bank.lending.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Document types accepted for an application.
 * RFC is a legacy alias of RFC_CONSTANCIA; compare types through {@link #canonical()}.
 */
public enum DocumentType {
    INE_FRONT("Identificación oficial (frente)"),
    INE_BACK("Identificación oficial (reverso)"),
    CURP("CURP"),
    SELFIE("Foto de perfil (Selfie)"),
    SIGNATURE("Firma"),
    PROOF_ADDRESS("Comprobante de domicilio"),
    PROOF_INCOME("Comprobante de ingresos"),
    BANK_STATEMENT("Estado de cuenta bancario"),
    RFC_CONSTANCIA("Constancia de situación fiscal"),
    RFC("Constancia de situación fiscal"),
    TAX_RETURN("Declaración de impuestos"),
    PAYSLIP_1("Recibo de nómina 1"),
    PAYSLIP_2("Recibo de nómina 2"),
    PAYSLIP_3("Recibo de nómina 3"),
    VEHICLE_INVOICE("Factura del vehículo"),
    BIRTH_CERTIFICATE("Acta de nacimiento"),
    MARRIAGE_CERTIFICATE("Acta de matrimonio"),
    BUSINESS_LICENSE("Licencia comercial"),
    CONSTITUTIVE_ACT("Acta constitutiva"),
    POWER_OF_ATTORNEY("Poder notarial");

    private final String description;

    DocumentType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Type used when matching uploaded documents against requirements
     */
    public DocumentType canonical() {
        return this == RFC ? RFC_CONSTANCIA : this;
    }

    public boolean isEquivalentTo(DocumentType other) {
        return other != null && canonical() == other.canonical();
    }

    public static Optional<DocumentType> tryFrom(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }

    /**
     * Human label for a raw type code, falling back to the code itself
     */
    public static String labelOf(String code) {
        return tryFrom(code).map(DocumentType::getDescription).orElse(code);
    }
}
