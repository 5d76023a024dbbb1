package com.bank.lending.application.service;

import com.bank.lending.domain.enums.CompositeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiffFormatterTest {

    private DiffFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new DiffFormatter();
    }

    @Test
    void testNameDiffOnlyListsChangedKeys() {
        Map<String, Object> before = name("Juan", "Perez", "Lopez");
        Map<String, Object> after = name("Juan", "Pérez", "Lopez");

        Map<String, String> changes = formatter.diff(before, after, CompositeKind.NAME);

        assertEquals(Map.of("Apellido Paterno", "Perez → Pérez"), changes);
    }

    @Test
    void testEmploymentDiffNormalizesTypeAndNumbers() {
        // Given
        Map<String, Object> before = new HashMap<>();
        before.put("type", "employee");
        before.put("monthly_income", "15000");
        before.put("seniority_months", 18);
        Map<String, Object> after = new HashMap<>();
        after.put("type", "EMPLOYEE");
        after.put("monthly_income", new BigDecimal("15000.00"));
        after.put("seniority_months", 24);

        // When
        Map<String, String> changes = formatter.diff(before, after, CompositeKind.EMPLOYMENT);

        // Then
        assertEquals(1, changes.size());
        assertEquals("1 año(s) y 6 mes(es) → 2 año(s)", changes.get("Antigüedad (meses)"));
    }

    @Test
    void testIncomeIsFormattedAsRoundedMoney() {
        Map<String, String> changes = formatter.diff(
                Map.of("monthly_income", "15000"), Map.of("monthly_income", "18500.5"), CompositeKind.EMPLOYMENT);

        assertEquals("$15,000 → $18,501", changes.get("Ingreso Mensual"));
    }

    @Test
    void testUnparseableNumberCountsAsZero() {
        Map<String, String> changes = formatter.diff(
                Map.of("monthly_income", "n/a"), Map.of("monthly_income", "0"), CompositeKind.EMPLOYMENT);

        assertTrue(changes.isEmpty());
    }

    @Test
    void testBlankAndMissingAreEqual() {
        Map<String, Object> before = new HashMap<>();
        before.put("int_number", "");
        before.put("street", null);
        Map<String, Object> after = new HashMap<>();
        after.put("street", "Reforma");

        Map<String, String> changes = formatter.diff(before, after, CompositeKind.ADDRESS);

        assertEquals(Map.of("Calle", "(vacío) → Reforma"), changes);
    }

    @Test
    void testDiffFollowsDisplayOrder() {
        Map<String, String> changes = formatter.diff(
                Map.of("state", "Jalisco", "street", "Juárez"),
                Map.of("state", "CDMX", "street", "Madero"),
                CompositeKind.ADDRESS);

        assertEquals(List.of("Calle", "Estado"), List.copyOf(changes.keySet()));
    }

    @Test
    void testScalarValuesHaveNoDiff() {
        assertTrue(formatter.diff("ABC", "DEF", null).isEmpty());
        assertTrue(formatter.diff("ABC", Map.of("street", "x"), CompositeKind.ADDRESS).isEmpty());
    }

    @Test
    void testSummaryOfScalars() {
        assertEquals("(vacío)", formatter.formatSummary(null));
        assertEquals("(vacío)", formatter.formatSummary(""));
        assertEquals("PEGJ900517HDFRNN09", formatter.formatSummary("PEGJ900517HDFRNN09"));
        assertEquals("17/05/1990", formatter.formatSummary("1990-05-17"));
        assertEquals("1990-13-45", formatter.formatSummary("1990-13-45"));
    }

    @Test
    void testSummaryOfName() {
        Map<String, Object> partial = new HashMap<>();
        partial.put("first_name", "Ana");
        partial.put("last_name_1", "Ruiz");

        assertEquals("Ana Ruiz", formatter.formatSummary(partial));
    }

    @Test
    void testSummaryOfAddress() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("street", "Reforma");
        address.put("ext_number", "100");
        address.put("int_number", "5");
        address.put("neighborhood", "Centro");
        address.put("postal_code", "06000");
        address.put("municipality", "Cuauhtémoc");
        address.put("state", "CDMX");

        assertEquals("Reforma 100 Int. 5, Col. Centro, C.P. 06000, Cuauhtémoc, CDMX",
                formatter.formatSummary(address));
    }

    @Test
    void testSummaryOfAddressWithoutMunicipality() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("street", "Reforma");
        address.put("ext_number", "100");
        address.put("state", "CDMX");

        assertEquals("Reforma 100, CDMX", formatter.formatSummary(address));
    }

    @Test
    void testSummaryOfEmploymentSkipsZeroIncome() {
        Map<String, Object> employment = new LinkedHashMap<>();
        employment.put("type", "self_employed");
        employment.put("company_name", "Taller");
        employment.put("position", "Dueño");
        employment.put("monthly_income", "0");

        assertEquals("Trabajador Independiente - Taller - Dueño", formatter.formatSummary(employment));

        employment.put("monthly_income", 32000);
        assertEquals("Trabajador Independiente - Taller - Dueño - $32,000", formatter.formatSummary(employment));
    }

    @Test
    void testSummaryNeverThrows() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("boom");
            }
        };

        assertEquals("(vacío)", formatter.formatSummary(broken));
    }

    @Test
    void testHugeExponentIncomeRendersAsZero() {
        // Given
        Map<String, Object> employment = new LinkedHashMap<>();
        employment.put("company_name", "ACME");
        employment.put("monthly_income", "1e999999999");

        // When
        String summary = formatter.formatSummary(employment);
        Map<String, String> changes = formatter.diff(
                Map.of("monthly_income", "1e999999999"), Map.of("monthly_income", "0"), CompositeKind.EMPLOYMENT);

        // Then
        assertEquals("ACME", summary);
        assertTrue(changes.isEmpty());
        assertEquals("$0", formatter.formatSingleValue("1e-999999999", "monthly_income"));
    }

    @Test
    void testOutOfRangeSeniorityRendersAsZeroMonths() {
        assertEquals("0 mes(es)", formatter.formatSingleValue("1e999999999", "seniority_months"));
    }

    @Test
    void testTimelineTextForScalarAndComposite() {
        assertEquals("AAA → BBB", formatter.formatChangesForTimeline("AAA", "BBB", null));
        assertEquals("Apellido Paterno: Perez → Pérez", formatter.formatChangesForTimeline(
                name("Juan", "Perez", null), name("Juan", "Pérez", null), CompositeKind.NAME));
    }

    @Test
    void testSeniorityFormatting() {
        assertEquals("11 mes(es)", formatter.formatSingleValue(11, "seniority_months"));
        assertEquals("1 año(s)", formatter.formatSingleValue(12, "seniority_months"));
        assertEquals("3 año(s) y 1 mes(es)", formatter.formatSingleValue("37", "seniority_months"));
    }

    private static Map<String, Object> name(String first, String last1, String last2) {
        Map<String, Object> name = new HashMap<>();
        name.put("first_name", first);
        name.put("last_name_1", last1);
        name.put("last_name_2", last2);
        return name;
    }
}
