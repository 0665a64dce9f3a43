package com.example.personioexport.application.service;

import com.example.personioexport.domain.exception.InvalidEmployeeRecordException;
import com.example.personioexport.domain.model.EmployeeRow;
import com.example.personioexport.domain.model.RawEmployeeRecord;
import com.example.personioexport.infrastructure.personio.PersonioJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flattens nested Personio records into {@link EmployeeRow}s.
 * Pure mapping without IO; missing optional attributes become empty strings.
 */
@Service
public class EmployeeRowTransformer {

    private static final Logger log = LoggerFactory.getLogger(EmployeeRowTransformer.class);
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern GERMAN_DATE = Pattern.compile("^\\d{1,2}\\.\\d{1,2}\\.\\d{4}$");
    private static final DateTimeFormatter GERMAN_DATE_FORMATTER = DateTimeFormatter.ofPattern("d.M.uuuu");
    private static final List<String> BASE_SALARY_MARKERS = List.of("base", "fixed", "salary");

	/**
	 * Flattens every record, skipping the ones that cannot be mapped.
	 *
	 * @param records raw records in extraction order
	 * @return rows in the same order, without the skipped records
	 */
    public List<EmployeeRow> flattenAll(List<RawEmployeeRecord> records) {
        List<EmployeeRow> rows = new ArrayList<>(records.size());
        for (RawEmployeeRecord record : records) {
            try {
                rows.add(flatten(record));
            } catch (InvalidEmployeeRecordException ex) {
                log.warn("Skipping employee record: {}", ex.getMessage());
            }
        }
        return rows;
    }

	/**
	 * Maps one raw record onto the fixed row schema.
	 *
	 * @param record joined raw record
	 * @return flattened row
	 * @throws InvalidEmployeeRecordException when the record carries no employee id
	 */
    public EmployeeRow flatten(RawEmployeeRecord record) {
        if (record == null || record.employeeId().isBlank()) {
            throw new InvalidEmployeeRecordException("missing employee id");
        }
        JsonNode master = record.masterData();
        JsonNode employment = record.primaryEmployment();

        return new EmployeeRow(
                record.employeeId(),
                masterText(master, "first_name"),
                masterText(master, "last_name"),
                masterText(master, "email"),
                masterText(master, "status"),
                isoDate(PersonioJson.attribute(master, "hire_date")),
                isoDate(PersonioJson.attribute(master, "termination_date")),
                employmentText(employment, master, "position"),
                masterText(master, "department"),
                masterText(master, "team"),
                supervisorName(master),
                masterText(master, "office"),
                employmentText(employment, master, "weekly_working_hours"),
                employmentText(employment, master, "employment_type"),
                employmentText(employment, master, "cost_centers"),
                baseSalary(record.compensations()),
                isoDate(PersonioJson.attribute(master, "last_modified_at"))
        );
    }

    private String masterText(JsonNode master, String key) {
        return PersonioJson.text(PersonioJson.attribute(master, key));
    }

    private String employmentText(JsonNode employment, JsonNode master, String key) {
        String value = PersonioJson.text(PersonioJson.attribute(employment, key));
        return value.isEmpty() ? masterText(master, key) : value;
    }

    private String supervisorName(JsonNode master) {
        JsonNode supervisor = PersonioJson.attribute(master, "supervisor");
        if (!supervisor.isObject()) {
            return "";
        }
        String first = PersonioJson.text(PersonioJson.attribute(supervisor, "first_name"));
        String last = PersonioJson.text(PersonioJson.attribute(supervisor, "last_name"));
        return (first + " " + last).strip();
    }

	/**
	 * Picks the base salary: the first compensation typed as base/fixed salary, otherwise the
	 * first compensation carrying a numeric amount.
	 */
    private String baseSalary(List<JsonNode> compensations) {
        Optional<BigDecimal> typed = compensations.stream()
                .filter(this::isBaseSalary)
                .map(this::amount)
                .flatMap(Optional::stream)
                .findFirst();
        Optional<BigDecimal> amount = typed.isPresent()
                ? typed
                : compensations.stream().map(this::amount).flatMap(Optional::stream).findFirst();
        return amount.map(value -> value.setScale(2, RoundingMode.HALF_UP).toPlainString()).orElse("");
    }

    private boolean isBaseSalary(JsonNode compensation) {
        String type = PersonioJson.text(PersonioJson.attribute(compensation, "type")).toLowerCase(Locale.ROOT);
        return BASE_SALARY_MARKERS.stream().anyMatch(type::contains);
    }

    private Optional<BigDecimal> amount(JsonNode compensation) {
        Optional<BigDecimal> amount = PersonioJson.decimal(PersonioJson.attribute(compensation, "amount"));
        return amount.isPresent() ? amount : PersonioJson.decimal(PersonioJson.attribute(compensation, "fixed_salary"));
    }

	/**
	 * Normalizes a date-like value to {@code YYYY-MM-DD}.
	 *
	 * @param node ISO date, ISO timestamp or German {@code dd.MM.yyyy} date
	 * @return ISO date, or an empty string when the value is absent or unreadable
	 */
    static String isoDate(JsonNode node) {
        String value = PersonioJson.text(node);
        if (value.isEmpty()) {
            return "";
        }
        try {
            if (ISO_DATE_PREFIX.matcher(value).find()) {
                return LocalDate.parse(value.substring(0, 10)).toString();
            }
            if (GERMAN_DATE.matcher(value).matches()) {
                return LocalDate.parse(value, GERMAN_DATE_FORMATTER).toString();
            }
        } catch (DateTimeParseException ex) {
            log.debug("Unreadable date value '{}'", value);
            return "";
        }
        log.debug("Unsupported date format '{}'", value);
        return "";
    }
}
