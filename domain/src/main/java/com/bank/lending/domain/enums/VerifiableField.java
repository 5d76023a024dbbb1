package com.bank.lending.domain.enums;

import com.bank.lending.domain.exception.FieldNotVerifiableException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Personal-data fields a reviewer can verify or reject.
 * Each field carries its wire code, storage location, composite kind and label.
 */
public enum VerifiableField {
    FIRST_NAME("first_name", FieldStorage.NAME_COLUMNS, CompositeKind.NAME, "Nombre"),
    LAST_NAME_1("last_name_1", FieldStorage.NAME_COLUMNS, CompositeKind.NAME, "Apellido Paterno"),
    LAST_NAME_2("last_name_2", FieldStorage.NAME_COLUMNS, CompositeKind.NAME, "Apellido Materno"),
    CURP("curp", FieldStorage.APPLICANT_COLUMN, null, "CURP"),
    RFC("rfc", FieldStorage.APPLICANT_COLUMN, null, "RFC"),
    INE("ine_clave", FieldStorage.APPLICANT_COLUMN, null, "Clave de Elector (INE)"),
    BIRTH_DATE("birth_date", FieldStorage.APPLICANT_COLUMN, null, "Fecha de Nacimiento"),
    PHONE("phone", FieldStorage.APPLICANT_COLUMN, null, "Teléfono"),
    EMAIL("email", FieldStorage.APPLICANT_COLUMN, null, "Correo Electrónico"),
    ADDRESS("address", FieldStorage.ADDRESS_ROW, CompositeKind.ADDRESS, "Dirección"),
    EMPLOYMENT("employment", FieldStorage.EMPLOYMENT_ROW, CompositeKind.EMPLOYMENT, "Información Laboral");

    public static final Set<VerifiableField> NAME_FIELDS = EnumSet.of(FIRST_NAME, LAST_NAME_1, LAST_NAME_2);

    private final String code;
    private final FieldStorage storage;
    private final CompositeKind compositeKind;
    private final String label;

    VerifiableField(String code, FieldStorage storage, CompositeKind compositeKind, String label) {
        this.code = code;
        this.storage = storage;
        this.compositeKind = compositeKind;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public FieldStorage getStorage() {
        return storage;
    }

    /**
     * Composite kind, or null for scalar fields
     */
    public CompositeKind getCompositeKind() {
        return compositeKind;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNameField() {
        return storage == FieldStorage.NAME_COLUMNS;
    }

    public boolean isComposite() {
        return compositeKind != null;
    }

    /**
     * Resolve a wire code ("curp", "ine_clave") or constant name ("INE"), case-insensitively
     *
     * @throws FieldNotVerifiableException if the value names no verifiable field
     */
    public static VerifiableField fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new FieldNotVerifiableException(value);
        }
        String candidate = value.trim();
        return Arrays.stream(values())
                .filter(field -> field.code.equalsIgnoreCase(candidate) || field.name().equalsIgnoreCase(candidate))
                .findFirst()
                .orElseThrow(() -> new FieldNotVerifiableException(value));
    }
}
