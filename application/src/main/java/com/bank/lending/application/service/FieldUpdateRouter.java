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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a corrected value to wherever the field lives and captures the value it replaces.
 *
 * Storage per field:
 * - name sub-fields: the three applicant name columns (partial or full composite)
 * - scalars: one applicant column
 * - address: the primary HOME address row
 * - employment: the current employment row (merge of present keys)
 */
@Component
public class FieldUpdateRouter {

    private static final Logger log = LoggerFactory.getLogger(FieldUpdateRouter.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final int MONEY_PRECISION = 14;
    private static final int MONEY_SCALE = 2;
    private static final int MAX_MONTHS_DIGITS = 4;

    private final ApplicantRepository applicantRepository;
    private final AddressRepository addressRepository;
    private final EmploymentRecordRepository employmentRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FieldUpdateRouter(
            ApplicantRepository applicantRepository,
            AddressRepository addressRepository,
            EmploymentRecordRepository employmentRecordRepository,
            ObjectMapper objectMapper,
            Clock clock) {
        this.applicantRepository = applicantRepository;
        this.addressRepository = addressRepository;
        this.employmentRecordRepository = employmentRecordRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Route {@code newValue} to the field's storage.
     *
     * @param storedValue the verification row's captured field value, used as old value for scalars
     * @return the replaced value, and whether a record was written
     * @throws ValidationException if the value does not fit the field
     */
    public RoutedCorrection applyCorrection(ApplicantEntity applicant, VerifiableField field,
                                            Object newValue, String storedValue) {
        Object oldValue = captureOldValue(applicant, field, storedValue);

        boolean applied = switch (field.getStorage()) {
            case NAME_COLUMNS -> applyName(applicant, field, newValue);
            case APPLICANT_COLUMN -> applyScalar(applicant, field, newValue);
            case ADDRESS_ROW -> applyAddress(applicant, newValue);
            case EMPLOYMENT_ROW -> applyEmployment(applicant, newValue);
        };

        if (!applied) {
            log.warn("No target record for {} of applicant {}, correction not applied", field, applicant.getId());
            return RoutedCorrection.notApplied(oldValue);
        }

        applicant.setUpdatedAt(OffsetDateTime.now(clock));
        applicantRepository.save(applicant);
        log.debug("Applied correction of {} for applicant {}", field, applicant.getId());
        return RoutedCorrection.applied(oldValue);
    }

    /**
     * Value a correction replaces.
     * Composites are read live; scalars prefer the value captured at rejection time.
     */
    public Object captureOldValue(ApplicantEntity applicant, VerifiableField field, String storedValue) {
        switch (field.getStorage()) {
            case NAME_COLUMNS:
                return nameSnapshot(applicant);
            case ADDRESS_ROW:
                return addressRepository.findPrimaryHomeAddress(applicant.getId())
                        .map(this::addressSnapshot)
                        .orElseGet(LinkedHashMap::new);
            case EMPLOYMENT_ROW:
                return employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(applicant.getId())
                        .map(this::employmentSnapshot)
                        .orElseGet(LinkedHashMap::new);
            default:
                if (storedValue != null) {
                    return decodeStoredValue(storedValue);
                }
                return scalarValue(applicant, field);
        }
    }

    /**
     * Live value captured when a reviewer rejects or verifies a field.
     * Name sub-fields capture their own column only.
     */
    public Object currentValue(ApplicantEntity applicant, VerifiableField field) {
        switch (field.getStorage()) {
            case NAME_COLUMNS:
            case APPLICANT_COLUMN:
                return scalarValue(applicant, field);
            default:
                return captureOldValue(applicant, field, null);
        }
    }

    /**
     * Decode a stored snapshot: JSON objects come back as maps, anything else verbatim
     */
    public Object decodeStoredValue(String storedValue) {
        if (storedValue == null || !storedValue.startsWith("{")) {
            return storedValue;
        }
        try {
            return objectMapper.readValue(storedValue, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Stored value is not valid JSON, using it verbatim: {}", e.getOriginalMessage());
            return storedValue;
        }
    }

    private boolean applyName(ApplicantEntity applicant, VerifiableField field, Object newValue) {
        if (newValue instanceof Map) {
            Map<?, ?> parts = (Map<?, ?>) newValue;
            boolean any = false;
            if (parts.get("first_name") != null) {
                applicant.setFirstName(parts.get("first_name").toString());
                any = true;
            }
            if (parts.get("last_name_1") != null) {
                applicant.setLastName1(parts.get("last_name_1").toString());
                any = true;
            }
            if (parts.get("last_name_2") != null) {
                applicant.setLastName2(parts.get("last_name_2").toString());
                any = true;
            }
            if (!any) {
                throw ValidationException.of("new_value", "Debe incluir al menos un componente del nombre");
            }
            return true;
        }

        String value = requireScalar(newValue);
        switch (field) {
            case FIRST_NAME -> applicant.setFirstName(value);
            case LAST_NAME_1 -> applicant.setLastName1(value);
            case LAST_NAME_2 -> applicant.setLastName2(value);
            default -> throw new IllegalArgumentException("Not a name field: " + field);
        }
        return true;
    }

    private boolean applyScalar(ApplicantEntity applicant, VerifiableField field, Object newValue) {
        String value = requireScalar(newValue);
        switch (field) {
            case CURP -> applicant.setCurp(value);
            case RFC -> applicant.setRfc(value);
            case INE -> applicant.setIneClave(value);
            case PHONE -> applicant.setPhone(value);
            case EMAIL -> applicant.setEmail(value);
            case BIRTH_DATE -> applicant.setBirthDate(parseBirthDate(value));
            default -> throw new IllegalArgumentException("Not a scalar field: " + field);
        }
        return true;
    }

    private boolean applyAddress(ApplicantEntity applicant, Object newValue) {
        Map<?, ?> values = requireComposite(newValue, "Se espera un objeto con los datos de la dirección");
        Optional<AddressEntity> found = addressRepository.findPrimaryHomeAddress(applicant.getId());
        if (found.isEmpty()) {
            return false;
        }

        AddressEntity address = found.get();
        if (values.containsKey("street")) {
            address.setStreet(text(values.get("street")));
        }
        if (values.containsKey("ext_number")) {
            address.setExtNumber(text(values.get("ext_number")));
        }
        if (values.containsKey("int_number")) {
            address.setIntNumber(text(values.get("int_number")));
        }
        if (values.containsKey("neighborhood")) {
            address.setNeighborhood(text(values.get("neighborhood")));
        }
        if (values.containsKey("postal_code")) {
            address.setPostalCode(text(values.get("postal_code")));
        }
        if (values.containsKey("municipality")) {
            address.setMunicipality(text(values.get("municipality")));
        }
        if (values.containsKey("state")) {
            address.setState(text(values.get("state")));
        }
        address.setUpdatedAt(OffsetDateTime.now(clock));
        addressRepository.save(address);
        return true;
    }

    private boolean applyEmployment(ApplicantEntity applicant, Object newValue) {
        Map<?, ?> values = requireComposite(newValue, "Se espera un objeto con los datos laborales");
        Optional<EmploymentRecordEntity> found =
                employmentRecordRepository.findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(applicant.getId());
        if (found.isEmpty()) {
            return false;
        }

        EmploymentRecordEntity employment = found.get();
        if (values.get("type") != null) {
            employment.setEmploymentType(EmploymentType.fromCode(values.get("type").toString()));
        }
        if (values.get("company_name") != null) {
            employment.setCompanyName(values.get("company_name").toString());
        }
        if (values.get("position") != null) {
            employment.setPosition(values.get("position").toString());
        }
        if (values.get("monthly_income") != null) {
            employment.setMonthlyIncome(toMoney(values.get("monthly_income"), "monthly_income"));
        }
        if (values.get("seniority_months") != null) {
            employment.setSeniorityMonths(toMonths(values.get("seniority_months"), "seniority_months"));
        }
        employment.setUpdatedAt(OffsetDateTime.now(clock));
        employmentRecordRepository.save(employment);
        return true;
    }

    private Map<String, Object> nameSnapshot(ApplicantEntity applicant) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("first_name", applicant.getFirstName());
        snapshot.put("last_name_1", applicant.getLastName1());
        snapshot.put("last_name_2", applicant.getLastName2());
        return snapshot;
    }

    private Map<String, Object> addressSnapshot(AddressEntity address) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("street", address.getStreet());
        snapshot.put("ext_number", address.getExtNumber());
        snapshot.put("int_number", address.getIntNumber());
        snapshot.put("neighborhood", address.getNeighborhood());
        snapshot.put("postal_code", address.getPostalCode());
        snapshot.put("municipality", address.getMunicipality());
        snapshot.put("state", address.getState());
        return snapshot;
    }

    private Map<String, Object> employmentSnapshot(EmploymentRecordEntity employment) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("type", employment.getEmploymentType() != null ? employment.getEmploymentType().name() : null);
        snapshot.put("company_name", employment.getCompanyName());
        snapshot.put("position", employment.getPosition());
        snapshot.put("monthly_income", employment.getMonthlyIncome());
        snapshot.put("seniority_months", employment.getSeniorityMonths());
        return snapshot;
    }

    private String scalarValue(ApplicantEntity applicant, VerifiableField field) {
        return switch (field) {
            case FIRST_NAME -> applicant.getFirstName();
            case LAST_NAME_1 -> applicant.getLastName1();
            case LAST_NAME_2 -> applicant.getLastName2();
            case CURP -> applicant.getCurp();
            case RFC -> applicant.getRfc();
            case INE -> applicant.getIneClave();
            case PHONE -> applicant.getPhone();
            case EMAIL -> applicant.getEmail();
            case BIRTH_DATE -> applicant.getBirthDate() != null ? applicant.getBirthDate().toString() : null;
            default -> null;
        };
    }

    private LocalDate parseBirthDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ValidationException.of("new_value", "La fecha de nacimiento debe tener el formato AAAA-MM-DD");
        }
    }

    /**
     * Amount that fits monthly_income NUMERIC(14,2)
     */
    private BigDecimal toMoney(Object value, String key) {
        BigDecimal amount = toDecimal(value, key);
        if (amount.signum() < 0) {
            throw ValidationException.of("new_value." + key, "No puede ser negativo");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > MONEY_SCALE) {
            throw ValidationException.of("new_value." + key, "Admite como máximo dos decimales");
        }
        if (stripped.precision() - stripped.scale() > MONEY_PRECISION - MONEY_SCALE) {
            throw ValidationException.of("new_value." + key, "El monto excede el máximo permitido");
        }
        return stripped.setScale(MONEY_SCALE);
    }

    private int toMonths(Object value, String key) {
        BigDecimal months = toDecimal(value, key);
        if (months.signum() < 0) {
            throw ValidationException.of("new_value." + key, "No puede ser negativo");
        }
        if (months.precision() - months.scale() > MAX_MONTHS_DIGITS) {
            throw ValidationException.of("new_value." + key, "La antigüedad excede el máximo permitido");
        }
        try {
            return months.intValueExact();
        } catch (ArithmeticException e) {
            throw ValidationException.of("new_value." + key, "Debe ser un número entero de meses");
        }
    }

    private BigDecimal toDecimal(Object value, String key) {
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw ValidationException.of("new_value." + key, "Debe ser un valor numérico");
        }
    }

    private static String requireScalar(Object newValue) {
        if (newValue instanceof Map || newValue instanceof Iterable) {
            throw ValidationException.of("new_value", "Se espera un valor de texto para este campo");
        }
        return newValue != null ? newValue.toString().trim() : null;
    }

    private static Map<?, ?> requireComposite(Object newValue, String message) {
        if (!(newValue instanceof Map)) {
            throw ValidationException.of("new_value", message);
        }
        return (Map<?, ?>) newValue;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
