package com.bank.lending.application.service;

import com.bank.lending.domain.enums.CompositeKind;
import com.bank.lending.domain.enums.EmploymentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders field values and before/after changes as human-readable Spanish text.
 * Pure: no I/O, no state.
 */
@Component
public class DiffFormatter {

    private static final Logger log = LoggerFactory.getLogger(DiffFormatter.class);

    static final String EMPTY = "(vacío)";
    static final String ARROW = " → ";

    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*", Pattern.DOTALL);
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private static final int MAX_INTEGER_DIGITS = 15;
    private static final int MAX_SCALE = 10;

    private static final List<String> NAME_KEYS = List.of("first_name", "last_name_1", "last_name_2");
    private static final List<String> EMPLOYMENT_KEYS = List.of("company_name", "type");
    private static final List<String> ADDRESS_KEYS = List.of("street", "ext_number", "neighborhood");

    /**
     * Sub-keys whose value differs between {@code oldValue} and {@code newValue}, as
     * {@code label -> "old → new"} in the kind's display order.
     * Empty unless both values are composite objects.
     */
    public Map<String, String> diff(Object oldValue, Object newValue, CompositeKind kind) {
        Map<String, String> changes = new LinkedHashMap<>();
        if (kind == null || !(oldValue instanceof Map) || !(newValue instanceof Map)) {
            return changes;
        }
        Map<?, ?> oldMap = (Map<?, ?>) oldValue;
        Map<?, ?> newMap = (Map<?, ?>) newValue;

        kind.getKeyLabels().forEach((key, label) -> {
            Object before = oldMap.get(key);
            Object after = newMap.get(key);
            if (!normalize(before, key).equals(normalize(after, key))) {
                changes.put(label, formatSingleValue(before, key) + ARROW + formatSingleValue(after, key));
            }
        });
        return changes;
    }

    /**
     * Timeline text for a correction: "Label: old → new" pairs joined by ", ",
     * or the two summaries when no sub-key diff is available.
     */
    public String formatChangesForTimeline(Object oldValue, Object newValue, CompositeKind kind) {
        Map<String, String> changes = diff(oldValue, newValue, kind);
        if (changes.isEmpty()) {
            return formatSummary(oldValue) + ARROW + formatSummary(newValue);
        }
        return changes.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
    }

    /**
     * One-line summary of any stored value. Never throws; unreadable input renders as "(vacío)".
     */
    public String formatSummary(Object value) {
        try {
            return summarize(value);
        } catch (RuntimeException e) {
            log.debug("Could not summarize value of type {}: {}",
                    value != null ? value.getClass().getSimpleName() : "null", e.getMessage());
            return EMPTY;
        }
    }

    /**
     * Display form of a single sub-key value
     */
    String formatSingleValue(Object value, String key) {
        if (isBlank(value)) {
            return EMPTY;
        }
        String text = value.toString();
        switch (key) {
            case "type":
                return EmploymentType.tryFrom(text).map(EmploymentType::getLabel).orElse(text);
            case "monthly_income":
                return "$" + formatMoney(value);
            case "seniority_months":
                return formatSeniority(toNumber(value).longValue());
            default:
                return text;
        }
    }

    private String summarize(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof Map) {
            return summarizeMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            return firstNonEmpty((Collection<?>) value);
        }

        String text = value.toString();
        if (text.isEmpty()) {
            return EMPTY;
        }
        if (ISO_DATE_PREFIX.matcher(text).matches()) {
            try {
                return LocalDate.parse(text.substring(0, 10)).format(DISPLAY_DATE);
            } catch (DateTimeParseException e) {
                return text;
            }
        }
        return text;
    }

    private String summarizeMap(Map<?, ?> map) {
        if (hasAnyKey(map, NAME_KEYS)) {
            String name = NAME_KEYS.stream()
                    .map(map::get)
                    .filter(part -> !isBlank(part))
                    .map(Object::toString)
                    .collect(Collectors.joining(" "));
            return name.isEmpty() ? EMPTY : name;
        }

        if (hasAnyKey(map, EMPLOYMENT_KEYS)) {
            List<String> parts = new ArrayList<>();
            if (!isBlank(map.get("type"))) {
                parts.add(formatSingleValue(map.get("type"), "type"));
            }
            addIfPresent(parts, map.get("company_name"));
            addIfPresent(parts, map.get("position"));
            Object income = map.get("monthly_income");
            if (!isBlank(income) && toNumber(income).signum() != 0) {
                parts.add("$" + formatMoney(income));
            }
            return parts.isEmpty() ? EMPTY : String.join(" - ", parts);
        }

        if (hasAnyKey(map, ADDRESS_KEYS)) {
            return summarizeAddress(map);
        }

        return firstNonEmpty(map.values());
    }

    private String summarizeAddress(Map<?, ?> map) {
        List<String> parts = new ArrayList<>();

        String streetLine = (text(map.get("street")) + " " + text(map.get("ext_number"))).trim();
        if (!isBlank(map.get("int_number"))) {
            streetLine = streetLine + " Int. " + text(map.get("int_number"));
        }
        if (!streetLine.isEmpty()) {
            parts.add(streetLine);
        }
        if (!isBlank(map.get("neighborhood"))) {
            parts.add("Col. " + text(map.get("neighborhood")));
        }
        if (!isBlank(map.get("postal_code"))) {
            parts.add("C.P. " + text(map.get("postal_code")));
        }
        String location = trimSeparators(text(map.get("municipality")) + ", " + text(map.get("state")));
        if (!location.isEmpty()) {
            parts.add(location);
        }
        return parts.isEmpty() ? EMPTY : String.join(", ", parts);
    }

    /**
     * Canonical comparison form: blanks are equal to each other, employment type is case-insensitive,
     * numbers compare by value ("15000" equals "15000.00")
     */
    private String normalize(Object value, String key) {
        if (isBlank(value)) {
            return "";
        }
        switch (key) {
            case "type":
                return value.toString().toUpperCase(Locale.ROOT);
            case "monthly_income":
            case "seniority_months":
                return toNumber(value).stripTrailingZeros().toPlainString();
            default:
                return value.toString();
        }
    }

    private String formatSeniority(long months) {
        if (months >= 12) {
            long years = months / 12;
            long remaining = months % 12;
            if (remaining > 0) {
                return years + " año(s) y " + remaining + " mes(es)";
            }
            return years + " año(s)";
        }
        return months + " mes(es)";
    }

    private String formatMoney(Object value) {
        DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(toNumber(value));
    }

    /**
     * Lenient numeric read; anything unparseable or outside 15 integer digits / 10 decimals counts as zero
     */
    private BigDecimal toNumber(Object value) {
        BigDecimal number;
        try {
            number = value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() > MAX_SCALE || stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            log.debug("Numeric value out of display range, rendered as zero");
            return BigDecimal.ZERO;
        }
        return number;
    }

    private String firstNonEmpty(Collection<?> values) {
        return values.stream()
                .filter(candidate -> !isBlank(candidate))
                .map(this::summarize)
                .findFirst()
                .orElse(EMPTY);
    }

    private static boolean hasAnyKey(Map<?, ?> map, List<String> keys) {
        return keys.stream().anyMatch(key -> map.get(key) != null);
    }

    private static void addIfPresent(List<String> parts, Object value) {
        if (!isBlank(value)) {
            parts.add(value.toString());
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isEmpty();
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String trimSeparators(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == ',' || value.charAt(start) == ' ')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == ',' || value.charAt(end - 1) == ' ')) {
            end--;
        }
        return value.substring(start, end);
    }
}
