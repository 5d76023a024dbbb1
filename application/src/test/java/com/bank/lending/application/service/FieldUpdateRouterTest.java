package com.bank.lending.application.service;

import com.bank.lending.application.model.RoutedCorrection;
import com.bank.lending.domain.enums.EmploymentType;
import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.infrastructure.persistence.entity.AddressEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.EmploymentRecordEntity;
import com.bank.lending.infrastructure.persistence.repository.AddressRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.EmploymentRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FieldUpdateRouterTest {

    @Mock
    private ApplicantRepository applicantRepository;

    @Mock
    private AddressRepository addressRepository;

    @Mock
    private EmploymentRecordRepository employmentRecordRepository;

    private FieldUpdateRouter router;
    private ApplicantEntity applicant;

    @BeforeEach
    void setUp() {
        router = new FieldUpdateRouter(applicantRepository, addressRepository, employmentRecordRepository,
                new ObjectMapper(), Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
        applicant = ApplicantEntity.builder()
                .id(10L)
                .tenantId(1L)
                .userId(100L)
                .firstName("Juan")
                .lastName1("Perez")
                .lastName2("Lopez")
                .curp("PEGJ900517HDFRNN01")
                .build();
    }

    @Test
    void testScalarCorrectionUsesStoredValueAsOldValue() {
        // When
        RoutedCorrection result = router.applyCorrection(
                applicant, VerifiableField.CURP, "PEGJ900517HDFRNN09", "PEGJ900517HDFRNN00");

        // Then
        assertTrue(result.isApplied());
        assertEquals("PEGJ900517HDFRNN00", result.getOldValue());
        assertEquals("PEGJ900517HDFRNN09", applicant.getCurp());
        verify(applicantRepository).save(applicant);
    }

    @Test
    void testScalarCorrectionFallsBackToLiveColumn() {
        RoutedCorrection result = router.applyCorrection(applicant, VerifiableField.CURP, " NEWCURP ", null);

        assertEquals("PEGJ900517HDFRNN01", result.getOldValue());
        assertEquals("NEWCURP", applicant.getCurp());
    }

    @Test
    void testPartialNameCompositeOnlyChangesPresentKeys() {
        // Given
        Map<String, Object> newValue = new HashMap<>();
        newValue.put("last_name_1", "Pérez");

        // When
        RoutedCorrection result = router.applyCorrection(applicant, VerifiableField.LAST_NAME_1, newValue, null);

        // Then
        assertEquals(Map.of("first_name", "Juan", "last_name_1", "Perez", "last_name_2", "Lopez"), result.getOldValue());
        assertEquals("Juan", applicant.getFirstName());
        assertEquals("Pérez", applicant.getLastName1());
        assertEquals("Lopez", applicant.getLastName2());
    }

    @Test
    void testFullNameCompositeChangesAllColumns() {
        RoutedCorrection result = router.applyCorrection(applicant, VerifiableField.FIRST_NAME,
                Map.of("first_name", "Juana", "last_name_1", "Pérez", "last_name_2", "López"), null);

        assertTrue(result.isApplied());
        assertEquals("Juana", applicant.getFirstName());
        assertEquals("Pérez", applicant.getLastName1());
        assertEquals("López", applicant.getLastName2());
    }

    @Test
    void testEmptyNameCompositeIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () ->
                router.applyCorrection(applicant, VerifiableField.FIRST_NAME, Map.of("nickname", "JJ"), null));

        assertTrue(ex.getErrors().containsKey("new_value"));
        verify(applicantRepository, never()).save(any());
    }

    @Test
    void testBirthDateMustBeIsoDate() {
        assertThrows(ValidationException.class, () ->
                router.applyCorrection(applicant, VerifiableField.BIRTH_DATE, "17/05/1990", null));

        router.applyCorrection(applicant, VerifiableField.BIRTH_DATE, "1990-05-17", null);
        assertEquals(LocalDate.of(1990, 5, 17), applicant.getBirthDate());
    }

    @Test
    void testAddressCorrectionUpdatesPrimaryHomeRow() {
        // Given
        AddressEntity address = AddressEntity.builder()
                .id(5L).applicantId(10L).street("Juárez").extNumber("10").postalCode("44100").state("Jalisco")
                .build();
        when(addressRepository.findPrimaryHomeAddress(10L)).thenReturn(Optional.of(address));

        Map<String, Object> newValue = new HashMap<>();
        newValue.put("street", "Madero");
        newValue.put("int_number", null);

        // When
        RoutedCorrection result = router.applyCorrection(applicant, VerifiableField.ADDRESS, newValue, null);

        // Then
        assertTrue(result.isApplied());
        Map<?, ?> old = (Map<?, ?>) result.getOldValue();
        assertEquals(7, old.size());
        assertEquals("Juárez", old.get("street"));
        assertEquals("Madero", address.getStreet());
        assertNull(address.getIntNumber());
        assertEquals("44100", address.getPostalCode());
        verify(addressRepository).save(address);
    }

    @Test
    void testAddressCorrectionWithoutRowIsNotApplied() {
        when(addressRepository.findPrimaryHomeAddress(10L)).thenReturn(Optional.empty());

        RoutedCorrection result = router.applyCorrection(
                applicant, VerifiableField.ADDRESS, Map.of("street", "Madero"), null);

        assertFalse(result.isApplied());
        assertEquals(Map.of(), result.getOldValue());
        verify(applicantRepository, never()).save(any());
    }

    @Test
    void testAddressRequiresObject() {
        assertThrows(ValidationException.class, () ->
                router.applyCorrection(applicant, VerifiableField.ADDRESS, "Madero 10", null));
    }

    @Test
    void testEmploymentCorrectionMergesPresentKeys() {
        // Given
        EmploymentRecordEntity employment = EmploymentRecordEntity.builder()
                .id(3L).applicantId(10L).employmentType(EmploymentType.EMPLOYEE)
                .companyName("ACME").position("Analista").monthlyIncome(new BigDecimal("15000")).seniorityMonths(18)
                .build();
        when(employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(10L))
                .thenReturn(Optional.of(employment));

        Map<String, Object> newValue = new HashMap<>();
        newValue.put("type", "self_employed");
        newValue.put("monthly_income", "22000.50");

        // When
        RoutedCorrection result = router.applyCorrection(applicant, VerifiableField.EMPLOYMENT, newValue, null);

        // Then
        Map<?, ?> old = (Map<?, ?>) result.getOldValue();
        assertEquals("EMPLOYEE", old.get("type"));
        assertEquals(EmploymentType.SELF_EMPLOYED, employment.getEmploymentType());
        assertEquals(new BigDecimal("22000.50"), employment.getMonthlyIncome());
        assertEquals("ACME", employment.getCompanyName());
        assertEquals(18, employment.getSeniorityMonths());
    }

    @Test
    void testEmploymentRejectsNonNumericIncome() {
        EmploymentRecordEntity employment = EmploymentRecordEntity.builder().id(3L).applicantId(10L).build();
        when(employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(10L))
                .thenReturn(Optional.of(employment));

        ValidationException ex = assertThrows(ValidationException.class, () -> router.applyCorrection(
                applicant, VerifiableField.EMPLOYMENT, Map.of("monthly_income", "mucho"), null));

        assertTrue(ex.getErrors().containsKey("new_value.monthly_income"));
    }

    @Test
    void testEmploymentRejectsIncomeBeyondColumnBounds() {
        // Given
        EmploymentRecordEntity employment = EmploymentRecordEntity.builder().id(3L).applicantId(10L).build();
        when(employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(10L))
                .thenReturn(Optional.of(employment));

        // When / Then
        for (String income : new String[]{"1e999999999", "1000000000000", "100.505", "-1"}) {
            ValidationException ex = assertThrows(ValidationException.class, () -> router.applyCorrection(
                    applicant, VerifiableField.EMPLOYMENT, Map.of("monthly_income", income), null), income);
            assertTrue(ex.getErrors().containsKey("new_value.monthly_income"), income);
        }
        assertNull(employment.getMonthlyIncome());
        verify(employmentRecordRepository, never()).save(any());
    }

    @Test
    void testEmploymentIncomeAtColumnLimitIsAccepted() {
        // Given
        EmploymentRecordEntity employment = EmploymentRecordEntity.builder().id(3L).applicantId(10L).build();
        when(employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(10L))
                .thenReturn(Optional.of(employment));

        // When
        router.applyCorrection(applicant, VerifiableField.EMPLOYMENT,
                Map.of("monthly_income", "999999999999.99", "seniority_months", "24.0"), null);

        // Then
        assertEquals(new BigDecimal("999999999999.99"), employment.getMonthlyIncome());
        assertEquals(24, employment.getSeniorityMonths());
    }

    @Test
    void testEmploymentRejectsFractionalOrOversizedSeniority() {
        // Given
        EmploymentRecordEntity employment = EmploymentRecordEntity.builder()
                .id(3L).applicantId(10L).seniorityMonths(6).build();
        when(employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(10L))
                .thenReturn(Optional.of(employment));

        // When / Then
        for (String months : new String[]{"12.7", "1e12", "1e999999999", "-3"}) {
            ValidationException ex = assertThrows(ValidationException.class, () -> router.applyCorrection(
                    applicant, VerifiableField.EMPLOYMENT, Map.of("seniority_months", months), null), months);
            assertTrue(ex.getErrors().containsKey("new_value.seniority_months"), months);
        }
        assertEquals(6, employment.getSeniorityMonths());
    }

    @Test
    void testCurrentValueOfNameFieldIsItsOwnColumn() {
        assertEquals("Perez", router.currentValue(applicant, VerifiableField.LAST_NAME_1));
    }

    @Test
    void testDecodeStoredValue() {
        assertEquals(Map.of("street", "Madero"), router.decodeStoredValue("{\"street\":\"Madero\"}"));
        assertEquals("{not json", router.decodeStoredValue("{not json"));
        assertEquals("ABC", router.decodeStoredValue("ABC"));
        assertNull(router.decodeStoredValue(null));
    }
}
