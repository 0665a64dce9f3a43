package com.example.personioexport.infrastructure.personio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for reading Personio payloads.
 * <p>
 * Personio wraps employee attributes as {@code {"attributes": {"first_name": {"label": ..., "value": ...}}}}
 * while newer resources use flat objects. The helpers here accept both shapes.
 */
public final class PersonioJson {

    private static final List<String> LABEL_KEYS = List.of("label", "name", "value", "title");
    private static final List<String> EMPLOYEE_REFERENCE_KEYS = List.of("employee_id", "employee", "person");

    private PersonioJson() {
    }

	/**
	 * Looks up an attribute by key, preferring the {@code attributes} map, and unwraps its
	 * {@code value} when the attribute is a Personio attribute object.
	 *
	 * @param record employee or resource record
	 * @param key    attribute key
	 * @return the attribute value, or a missing node
	 */
    public static JsonNode attribute(JsonNode record, String key) {
        if (record == null || record.isMissingNode() || record.isNull()) {
            return MissingNode.getInstance();
        }
        JsonNode attributes = record.path("attributes");
        JsonNode node = attributes.has(key) ? attributes.get(key) : record.path(key);
        if (node.isObject() && node.has("value")) {
            return node.get("value");
        }
        return node;
    }

	/**
	 * Renders a value as display text.
	 * Nested objects resolve to their label or name, lists are joined with {@code ", "},
	 * numbers lose insignificant trailing zeros and absent values become empty strings.
	 *
	 * @param node any JSON value
	 * @return text, never {@code null}
	 */
    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue().strip();
        }
        if (node.isNumber()) {
            return node.decimalValue().stripTrailingZeros().toPlainString();
        }
        if (node.isBoolean()) {
            return node.asText();
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode element : node) {
                String part = text(element);
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            return String.join(", ", parts);
        }
        if (node.isObject()) {
            for (String key : LABEL_KEYS) {
                String candidate = text(node.get(key));
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
            if (node.has("attributes")) {
                return text(attribute(node, "name"));
            }
        }
        return "";
    }

	/**
	 * @param record employee master record
	 * @return employee id as text, empty when the record carries none
	 */
    public static String employeeId(JsonNode record) {
        return text(attribute(record, "id"));
    }

	/**
	 * Finds the employee a resource record belongs to, looking at {@code employee_id},
	 * {@code employee.id} and {@code person.id}.
	 *
	 * @param record employment, compensation or similar record
	 * @return referenced employee id, empty when none is present
	 */
    public static String referencedEmployeeId(JsonNode record) {
        for (String key : EMPLOYEE_REFERENCE_KEYS) {
            JsonNode reference = attribute(record, key);
            String id = reference.isObject() ? text(attribute(reference, "id")) : text(reference);
            if (!id.isEmpty()) {
                return id;
            }
        }
        return "";
    }

	/**
	 * Reads a decimal from a number, a numeric string or an object holding one under {@code value}.
	 *
	 * @param node value to read
	 * @return the amount, or empty when the value is absent or not numeric
	 */
    public static Optional<BigDecimal> decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        if (node.isObject()) {
            return decimal(node.get("value"));
        }
        if (node.isTextual()) {
            String value = node.textValue().strip().replace(",", "");
            if (value.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(value));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
