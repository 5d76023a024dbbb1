package com.bank.lending.domain.enums;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured field groups and the display labels of their sub-keys, in display order
 */
public enum CompositeKind {
    NAME(orderedLabels(
            "first_name", "Nombre",
            "last_name_1", "Apellido Paterno",
            "last_name_2", "Apellido Materno")),
    ADDRESS(orderedLabels(
            "street", "Calle",
            "ext_number", "Número Exterior",
            "int_number", "Número Interior",
            "neighborhood", "Colonia",
            "postal_code", "Código Postal",
            "municipality", "Municipio",
            "state", "Estado")),
    EMPLOYMENT(orderedLabels(
            "type", "Tipo de Empleo",
            "company_name", "Empresa",
            "position", "Puesto",
            "monthly_income", "Ingreso Mensual",
            "seniority_months", "Antigüedad (meses)"));

    private final Map<String, String> keyLabels;

    CompositeKind(Map<String, String> keyLabels) {
        this.keyLabels = keyLabels;
    }

    public Map<String, String> getKeyLabels() {
        return keyLabels;
    }

    private static Map<String, String> orderedLabels(String... pairs) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            labels.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(labels);
    }
}
