package com.darkwatch.core.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Lenient accessors for vendor payloads, where any field may be missing or {@code null}.
 */
public final class JsonFields {

    private static final Logger log = LoggerFactory.getLogger(JsonFields.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            raw -> OffsetDateTime.parse(raw).toInstant(),
            raw -> LocalDate.parse(raw).atStartOfDay().toInstant(ZoneOffset.UTC));

    private JsonFields() {
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static String text(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null ? fallback : value;
    }

    public static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() || !value.isNumber() && !value.isTextual()
                ? fallback : value.asDouble(fallback);
    }

    public static long integer(JsonNode node, String field, long fallback) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? fallback : value.asLong(fallback);
    }

    public static boolean bool(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.asBoolean(false);
    }

    public static List<String> strings(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        var result = new ArrayList<String>();
        if (value != null && value.isArray()) {
            value.forEach(item -> {
                if (!item.isNull()) {
                    result.add(item.asText());
                }
            });
        }
        return result;
    }

    /**
     * Elements of an array field, or an empty list when the field is absent or not an array.
     */
    public static List<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        var result = new ArrayList<JsonNode>();
        if (value != null && value.isArray()) {
            value.forEach(result::add);
        }
        return result;
    }

    /**
     * Parses ISO-8601 instants, offset date-times and plain dates. Returns {@code null} for
     * anything else.
     */
    public static Instant instant(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (var parser : DATE_PARSERS) {
            try {
                return parser.apply(raw);
            } catch (DateTimeParseException e) {
                log.trace("'{}' is not in the expected format: {}", raw, e.getMessage());
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isObject()) {
            return new LinkedHashMap<>();
        }
        return MAPPER.convertValue(value, LinkedHashMap.class);
    }
}
